package nl.nfi.cfglab.parse;

import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.grammar.Production;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static nl.nfi.cfglab.grammar.Symbols.symbolsOf;
import static nl.nfi.cfglab.transform.Hygiene.nullable;

/**
 * Answers which parts of the input a sequence of symbols of the original grammar can derive, using the CYK table
 * computed for its Chomsky normal form. The normal form must keep the original nonterminals (as
 * {@code ChomskyNormalForm.steps} does), the empty spans are filled in here from the nullable nonterminals of the
 * original grammar.
 * <p>
 * Spans are 1-based: {@code (i, l)} covers the {@code l} input symbols starting at position {@code i}, with
 * {@code 1 <= i <= n + 1} and {@code 0 <= l <= n - i + 1}.
 */
public final class SpanDerivability {

    private final Grammar grammar;
    private final CykTable table;

    private SpanDerivability(final Grammar grammar, final CykTable table) {
        this.grammar = grammar;
        this.table = table;
    }

    public static SpanDerivability forTable(final Grammar original, final CykTable cnfTable) {
        return new SpanDerivability(original, cnfTable.withEmptySpans(nullable(original)));
    }

    public Grammar grammar() {
        return grammar;
    }

    // the table including the empty spans
    public CykTable table() {
        return table;
    }

    // how many input symbols each symbol of the word consumes, for the first way found (smallest lengths first)
    public Optional<List<Integer>> derives(final List<String> word, final int start, final int length) {
        final List<List<Integer>> derivations = collect(word, start, length, 1);
        return derivations.isEmpty() ? Optional.empty() : Optional.of(derivations.get(0));
    }

    public List<List<Integer>> allDerivations(final List<String> word, final int start, final int length) {
        return collect(word, start, length, Integer.MAX_VALUE);
    }

    // production indices of a leftmost derivation of the whole input in the original grammar
    public Optional<List<Integer>> leftmostProductions() {
        final List<Integer> productions = new ArrayList<>();
        if (reconstruct(grammar.start(), 1, table.size(), productions, new HashSet<>())) {
            return Optional.of(List.copyOf(productions));
        }
        return Optional.empty();
    }

    private List<List<Integer>> collect(final List<String> word, final int start, final int length, final int limit) {
        final int n = table.size();
        if (start < 1 || start > n + 1 || length < 0 || start + length - 1 > n) {
            throw new IllegalArgumentException("Span (%d, %d) is outside of an input of length %d".formatted(start, length, n));
        }
        final List<List<Integer>> results = new ArrayList<>();
        collect(symbolsOf(word), 0, start, length, new ArrayDeque<>(), results, limit);
        return results;
    }

    // returns true once enough results have been found
    private boolean collect(final List<String> word, final int offset, final int start, final int length,
                            final Deque<Integer> consumed, final List<List<Integer>> results, final int limit) {
        if (offset == word.size()) {
            if (length == 0) {
                results.add(List.copyOf(consumed));
            }
            return results.size() >= limit;
        }

        final String symbol = word.get(offset);
        if (grammar.isNonterminal(symbol)) {
            for (int used = 0; used <= length; used++) {
                if (table.contains(symbol, start, used)) {
                    consumed.addLast(used);
                    final boolean done = collect(word, offset + 1, start + used, length - used, consumed, results, limit);
                    consumed.removeLast();
                    if (done) {
                        return true;
                    }
                }
            }
            return false;
        }

        // a terminal only derives itself
        if (length >= 1 && table.inputAt(start).equals(symbol)) {
            consumed.addLast(1);
            final boolean done = collect(word, offset + 1, start + 1, length - 1, consumed, results, limit);
            consumed.removeLast();
            return done;
        }
        return false;
    }

    private boolean reconstruct(final String symbol, final int start, final int length, final List<Integer> productions, final Set<SymbolSpan> inProgress) {
        if (!table.contains(symbol, start, length)) {
            return false;
        }
        // a derivation returning to the same symbol on the same span can always be shortened
        final SymbolSpan key = new SymbolSpan(symbol, start, length);
        if (!inProgress.add(key)) {
            return false;
        }

        try {
            for (int index = 0; index < grammar.productions().size(); index++) {
                final Production production = grammar.production(index);
                if (!production.lhs().equals(symbol)) {
                    continue;
                }
                final List<String> rhs = symbolsOf(production.rhs());
                for (final List<Integer> split : allDerivations(rhs, start, length)) {
                    final int mark = productions.size();
                    productions.add(index);
                    if (reconstructChildren(rhs, split, start, productions, inProgress)) {
                        return true;
                    }
                    productions.subList(mark, productions.size()).clear();
                }
            }
            return false;
        } finally {
            inProgress.remove(key);
        }
    }

    private boolean reconstructChildren(final List<String> rhs, final List<Integer> split, final int start,
                                        final List<Integer> productions, final Set<SymbolSpan> inProgress) {
        int position = start;
        for (int i = 0; i < rhs.size(); i++) {
            final String symbol = rhs.get(i);
            if (grammar.isNonterminal(symbol) && !reconstruct(symbol, position, split.get(i), productions, inProgress)) {
                return false;
            }
            position += split.get(i);
        }
        return true;
    }

    private record SymbolSpan(String symbol, int start, int length) {
    }
}
