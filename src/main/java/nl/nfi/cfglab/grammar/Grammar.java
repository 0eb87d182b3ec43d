package nl.nfi.cfglab.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;

import static java.util.stream.Collectors.joining;
import static nl.nfi.cfglab.grammar.Symbols.EPSILON;

/**
 * An immutable grammar {@code (N, T, P, S)}.
 * <p>
 * Productions keep the order in which they were given (duplicates collapse onto their first occurrence), so a
 * production index is stable for the lifetime of the grammar; derivations and parsers refer to productions by
 * that index.
 */
public final class Grammar {

    private final SortedSet<String> nonterminals;
    private final SortedSet<String> terminals;
    private final List<Production> productions;
    private final Map<Production, Integer> indices;
    private final String start;
    private final boolean contextFree;

    private Grammar(final Collection<String> nonterminals, final Collection<String> terminals, final Collection<Production> productions, final String start) {
        this.nonterminals = Collections.unmodifiableSortedSet(new TreeSet<>(nonterminals));
        this.terminals = Collections.unmodifiableSortedSet(new TreeSet<>(terminals));
        this.productions = List.copyOf(new LinkedHashSet<>(productions));
        this.start = start;

        final Map<Production, Integer> indices = new HashMap<>();
        for (int index = 0; index < this.productions.size(); index++) {
            indices.put(this.productions.get(index), index);
        }
        this.indices = indices;
        this.contextFree = this.productions.stream().allMatch(Production::isContextFree);

        validate();
    }

    public static Grammar of(final Collection<String> nonterminals, final Collection<String> terminals, final Collection<Production> productions, final String start) {
        return new Grammar(nonterminals, terminals, productions, start);
    }

    // nonterminals are the lefthand sides, start symbol is the lhs of the first production
    public static Grammar fromString(final String text) {
        return fromString(text, true);
    }

    // for grammars that are not context-free the nonterminals are the symbols beginning with an uppercase letter
    public static Grammar fromString(final String text, final boolean contextFree) {
        final List<Production> productions = Productions.fromString(text, contextFree);
        if (productions.isEmpty()) {
            throw new InvalidGrammarException("The grammar text contains no productions");
        }

        final Set<String> nonterminals = new HashSet<>();
        final Set<String> terminals = new HashSet<>();
        if (contextFree) {
            productions.forEach(production -> nonterminals.add(production.lhs()));
            productions.forEach(production -> terminals.addAll(production.rhs()));
        } else {
            for (final String symbol : symbolsOf(productions)) {
                if (Character.isUpperCase(symbol.codePointAt(0))) {
                    nonterminals.add(symbol);
                } else {
                    terminals.add(symbol);
                }
            }
        }
        terminals.removeAll(nonterminals);
        terminals.remove(EPSILON);

        final Grammar grammar = new Grammar(nonterminals, terminals, productions, productions.get(0).lhsSymbols().get(0));
        if (contextFree && !grammar.isContextFree()) {
            throw new InvalidGrammarException("The resulting grammar is not context-free, even if so requested");
        }
        return grammar;
    }

    // the terminals are given, every other symbol is a nonterminal; lefthand sides may hold more than one symbol
    public static Grammar fromString(final String text, final Set<String> terminals) {
        final List<Production> productions = Productions.fromString(text, false);
        if (productions.isEmpty()) {
            throw new InvalidGrammarException("The grammar text contains no productions");
        }

        final Set<String> nonterminals = symbolsOf(productions);
        nonterminals.removeAll(terminals);
        nonterminals.remove(EPSILON);

        return new Grammar(nonterminals, terminals, productions, productions.get(0).lhsSymbols().get(0));
    }

    public SortedSet<String> nonterminals() {
        return nonterminals;
    }

    public SortedSet<String> terminals() {
        return terminals;
    }

    public Set<String> symbols() {
        final Set<String> symbols = new TreeSet<>(nonterminals);
        symbols.addAll(terminals);
        return symbols;
    }

    public List<Production> productions() {
        return productions;
    }

    public List<Production> productions(final Predicate<? super Production> filter) {
        return productions.stream().filter(filter).toList();
    }

    public Production production(final int index) {
        return productions.get(index);
    }

    // -1 if the production is not part of this grammar
    public int indexOf(final Production production) {
        return indices.getOrDefault(production, -1);
    }

    public boolean contains(final Production production) {
        return indices.containsKey(production);
    }

    public String start() {
        return start;
    }

    public boolean isContextFree() {
        return contextFree;
    }

    public boolean isNonterminal(final String symbol) {
        return nonterminals.contains(symbol);
    }

    public boolean isTerminal(final String symbol) {
        return terminals.contains(symbol);
    }

    public List<List<String>> alternatives(final String nonterminal) {
        final List<List<String>> alternatives = new ArrayList<>();
        for (final Production production : productions) {
            if (production.lhsSymbols().equals(List.of(nonterminal))) {
                alternatives.add(production.rhs());
            }
        }
        return alternatives;
    }

    // keeps N, T and P within the given symbols (ε is always allowed), the start symbol is always kept
    public Grammar restrictTo(final Set<String> symbols) {
        final Set<String> nonterminals = new TreeSet<>(this.nonterminals);
        nonterminals.retainAll(symbols);
        nonterminals.add(start);

        final Set<String> terminals = new TreeSet<>(this.terminals);
        terminals.retainAll(symbols);

        final List<Production> productions = new ArrayList<>();
        for (final Production production : this.productions) {
            if (symbols.containsAll(production.lhsSymbols()) && withinSymbols(production.rhs(), symbols)) {
                productions.add(production);
            }
        }
        return new Grammar(nonterminals, terminals, productions, start);
    }

    public Grammar withProductions(final Collection<String> nonterminals, final Collection<Production> productions) {
        return new Grammar(nonterminals, terminals, productions, start);
    }

    private static boolean withinSymbols(final List<String> rhs, final Set<String> symbols) {
        for (final String symbol : rhs) {
            if (!symbol.equals(EPSILON) && !symbols.contains(symbol)) {
                return false;
            }
        }
        return true;
    }

    private static Set<String> symbolsOf(final List<Production> productions) {
        final Set<String> symbols = new TreeSet<>();
        for (final Production production : productions) {
            symbols.addAll(production.lhsSymbols());
            symbols.addAll(production.rhs());
        }
        symbols.remove(EPSILON);
        return symbols;
    }

    private void validate() {
        final Set<String> common = new TreeSet<>(nonterminals);
        common.retainAll(terminals);
        if (!common.isEmpty()) {
            throw new InvalidGrammarException("The set of terminals and nonterminals are not disjoint, but have %s in common".formatted(setToString(common)));
        }
        if (nonterminals.contains(EPSILON) || terminals.contains(EPSILON)) {
            throw new InvalidGrammarException("ε can be neither a terminal nor a nonterminal");
        }
        if (start == null || !nonterminals.contains(start)) {
            throw new InvalidGrammarException("The start symbol %s is not a nonterminal".formatted(start));
        }

        if (contextFree) {
            final List<Production> badLhs = productions.stream()
                .filter(production -> !nonterminals.contains(production.lhs()))
                .toList();
            if (!badLhs.isEmpty()) {
                throw new InvalidGrammarException("The following productions have a lhs that is not a nonterminal: %s".formatted(listToString(badLhs)));
            }
        }

        final Set<String> symbols = symbols();
        final List<Production> badSymbols = productions.stream()
            .filter(production -> !withinSymbols(production.lhsSymbols(), symbols) || !withinSymbols(production.rhs(), symbols))
            .toList();
        if (!badSymbols.isEmpty()) {
            throw new InvalidGrammarException("The following productions contain symbols that are neither terminals or nonterminals: %s".formatted(listToString(badSymbols)));
        }
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Grammar that)) {
            return false;
        }
        // production order is not part of the identity of a grammar
        return nonterminals.equals(that.nonterminals)
            && terminals.equals(that.terminals)
            && start.equals(that.start)
            && indices.keySet().equals(that.indices.keySet());
    }

    @Override
    public int hashCode() {
        int result = nonterminals.hashCode();
        result = 31 * result + terminals.hashCode();
        result = 31 * result + indices.keySet().hashCode();
        result = 31 * result + start.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Grammar(N=%s, T=%s, P=%s, S=%s)".formatted(setToString(nonterminals), setToString(terminals), listToString(productions), start);
    }

    private static String setToString(final Set<String> symbols) {
        return symbols.stream().sorted().collect(joining(", ", "{", "}"));
    }

    private static String listToString(final List<Production> productions) {
        return productions.stream().map(Production::toString).collect(joining(", ", "(", ")"));
    }
}
