package nl.nfi.cfglab.grammar;

import java.util.List;

import static nl.nfi.cfglab.grammar.Symbols.EMPTY_WORD;
import static nl.nfi.cfglab.grammar.Symbols.EPSILON;
import static nl.nfi.cfglab.grammar.Symbols.format;

// a rewrite rule lhs -> rhs, e.g.:
//      E -> E + T
//  where lhsSymbols = [E] and rhs = [E, +, T]
// the lhs holds more than one symbol only in type-0/type-1 grammars (e.g. b Q c -> b b c c),
// an empty rhs is stored as [ε]
public record Production(List<String> lhsSymbols, List<String> rhs) implements Comparable<Production> {

    public Production {
        if (lhsSymbols == null || lhsSymbols.isEmpty() || !allNonEmpty(lhsSymbols) || lhsSymbols.contains(EPSILON)) {
            throw new InvalidGrammarException("The lhs is not a nonempty symbol, nor a nonempty sequence of nonempty symbols: %s".formatted(lhsSymbols));
        }
        if (rhs == null || !allNonEmpty(rhs)) {
            throw new InvalidGrammarException("The rhs is not a sequence of nonempty symbols: %s".formatted(rhs));
        }
        lhsSymbols = List.copyOf(lhsSymbols);
        rhs = rhs.isEmpty() ? EMPTY_WORD : List.copyOf(rhs);
        if (rhs.contains(EPSILON) && rhs.size() != 1) {
            throw new InvalidGrammarException("The righthand side contains ε but has more than one symbol: %s".formatted(format(rhs)));
        }
    }

    public static Production of(final String lhs, final List<String> rhs) {
        return new Production(List.of(lhs), rhs);
    }

    public static Production of(final String lhs, final String... rhs) {
        return of(lhs, List.of(rhs));
    }

    public static ProductionFilter suchThat() {
        return ProductionFilter.any();
    }

    public boolean isContextFree() {
        return lhsSymbols.size() == 1;
    }

    // the single lhs nonterminal of a context-free production
    public String lhs() {
        if (!isContextFree()) {
            throw new IllegalStateException("Production %s has more than one symbol as lefthand side".formatted(this));
        }
        return lhsSymbols.get(0);
    }

    public boolean isEpsilon() {
        return rhs.equals(EMPTY_WORD);
    }

    @Override
    public int compareTo(final Production other) {
        final int byLhs = compareWords(lhsSymbols, other.lhsSymbols);
        return byLhs != 0 ? byLhs : compareWords(rhs, other.rhs);
    }

    @Override
    public String toString() {
        return "%s -> %s".formatted(format(lhsSymbols), format(rhs));
    }

    private static int compareWords(final List<String> left, final List<String> right) {
        for (int i = 0; i < Math.min(left.size(), right.size()); i++) {
            final int bySymbol = left.get(i).compareTo(right.get(i));
            if (bySymbol != 0) {
                return bySymbol;
            }
        }
        return Integer.compare(left.size(), right.size());
    }

    private static boolean allNonEmpty(final List<String> symbols) {
        for (final String symbol : symbols) {
            if (symbol == null || symbol.isEmpty()) {
                return false;
            }
        }
        return true;
    }
}
