package nl.nfi.cfglab.parse;

import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.grammar.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static nl.nfi.cfglab.grammar.Symbols.format;
import static nl.nfi.cfglab.transform.ChomskyNormalForm.checkCykCompatible;

/**
 * Cocke-Younger-Kasami recognition for grammars in Chomsky normal form, relaxed to allow ε-rules for any
 * nonterminal (those are ignored, the table only covers non-empty spans). The empty input is recognized when
 * the grammar has the production {@code S -> ε}.
 * <p>
 * The reconstruction of a leftmost derivation is canonical: at every node the first production of the grammar
 * that fits is taken, with the smallest split.
 */
public final class CykParser {

    private static final Logger LOG = LoggerFactory.getLogger(CykParser.class);

    private final Grammar grammar;
    private final List<Integer> terminalProductions;
    private final List<Integer> binaryProductions;

    private CykParser(final Grammar grammar) {
        this.grammar = grammar;

        final List<Integer> terminalProductions = new ArrayList<>();
        final List<Integer> binaryProductions = new ArrayList<>();
        for (int index = 0; index < grammar.productions().size(); index++) {
            final Production production = grammar.production(index);
            if (production.rhs().size() == 2) {
                binaryProductions.add(index);
            } else if (grammar.isTerminal(production.rhs().get(0))) {
                terminalProductions.add(index);
            }
        }
        this.terminalProductions = List.copyOf(terminalProductions);
        this.binaryProductions = List.copyOf(binaryProductions);
    }

    public static CykParser forGrammar(final Grammar grammar) {
        checkCykCompatible(grammar);
        return new CykParser(grammar);
    }

    public Grammar grammar() {
        return grammar;
    }

    public CykTable parse(final List<String> input) {
        final int n = input.size();
        final CykTable.Builder table = CykTable.builder(input);

        for (int start = 1; start <= n; start++) {
            for (final int index : terminalProductions) {
                final Production production = grammar.production(index);
                if (production.rhs().get(0).equals(input.get(start - 1))) {
                    table.add(start, 1, production.lhs());
                }
            }
        }
        for (int length = 2; length <= n; length++) {
            for (int start = 1; start <= n - length + 1; start++) {
                for (int split = 1; split < length; split++) {
                    for (final int index : binaryProductions) {
                        final Production production = grammar.production(index);
                        if (table.contains(production.rhs().get(0), start, split)
                            && table.contains(production.rhs().get(1), start + split, length - split)) {
                            table.add(start, length, production.lhs());
                        }
                    }
                }
            }
        }

        final CykTable result = table.build();
        LOG.debug("Parsed {} symbol(s), {} non-empty table entries", n, result.entries().size());
        return result;
    }

    public boolean recognizes(final List<String> input) {
        if (input.isEmpty()) {
            return hasEmptyStart();
        }
        return parse(input).contains(grammar.start(), 1, input.size());
    }

    public boolean recognizes(final CykTable table) {
        if (table.size() == 0) {
            return hasEmptyStart();
        }
        return table.contains(grammar.start(), 1, table.size());
    }

    // production indices of the canonical leftmost derivation of the parsed input, in pre-order
    public List<Integer> leftmostProductions(final CykTable table) {
        requireRecognized(table);
        final List<Integer> productions = new ArrayList<>();
        if (table.size() == 0) {
            productions.add(emptyStartProduction());
        } else {
            leftmost(table, grammar.start(), 1, table.size(), productions);
        }
        return productions;
    }

    // every leftmost derivation of the parsed input, the canonical one first
    public List<List<Integer>> allLeftmostProductions(final CykTable table) {
        requireRecognized(table);
        if (table.size() == 0) {
            return List.of(List.of(emptyStartProduction()));
        }
        return allLeftmost(table, grammar.start(), 1, table.size(), new HashMap<>());
    }

    private void leftmost(final CykTable table, final String symbol, final int start, final int length, final List<Integer> productions) {
        if (length == 1) {
            for (final int index : terminalProductions) {
                final Production production = grammar.production(index);
                if (production.lhs().equals(symbol) && production.rhs().get(0).equals(table.inputAt(start))) {
                    productions.add(index);
                    return;
                }
            }
        }
        for (final int index : binaryProductions) {
            final Production production = grammar.production(index);
            if (!production.lhs().equals(symbol)) {
                continue;
            }
            for (int split = 1; split < length; split++) {
                final String left = production.rhs().get(0);
                final String right = production.rhs().get(1);
                if (table.contains(left, start, split) && table.contains(right, start + split, length - split)) {
                    productions.add(index);
                    leftmost(table, left, start, split, productions);
                    leftmost(table, right, start + split, length - split, productions);
                    return;
                }
            }
        }
        // only reachable with a table that was not built by this parser
        throw new IllegalStateException("No production of %s derives %s".formatted(symbol, new CykTable.Span(start, length)));
    }

    private List<List<Integer>> allLeftmost(final CykTable table, final String symbol, final int start, final int length,
                                            final Map<SymbolSpan, List<List<Integer>>> memo) {
        final SymbolSpan key = new SymbolSpan(symbol, start, length);
        final List<List<Integer>> cached = memo.get(key);
        if (cached != null) {
            return cached;
        }

        final List<List<Integer>> derivations = new ArrayList<>();
        if (length == 1) {
            for (final int index : terminalProductions) {
                final Production production = grammar.production(index);
                if (production.lhs().equals(symbol) && production.rhs().get(0).equals(table.inputAt(start))) {
                    derivations.add(List.of(index));
                }
            }
        }
        for (final int index : binaryProductions) {
            final Production production = grammar.production(index);
            if (!production.lhs().equals(symbol)) {
                continue;
            }
            for (int split = 1; split < length; split++) {
                final String left = production.rhs().get(0);
                final String right = production.rhs().get(1);
                if (!table.contains(left, start, split) || !table.contains(right, start + split, length - split)) {
                    continue;
                }
                for (final List<Integer> leftDerivation : allLeftmost(table, left, start, split, memo)) {
                    for (final List<Integer> rightDerivation : allLeftmost(table, right, start + split, length - split, memo)) {
                        final List<Integer> derivation = new ArrayList<>(1 + leftDerivation.size() + rightDerivation.size());
                        derivation.add(index);
                        derivation.addAll(leftDerivation);
                        derivation.addAll(rightDerivation);
                        derivations.add(List.copyOf(derivation));
                    }
                }
            }
        }

        final List<List<Integer>> result = List.copyOf(derivations);
        memo.put(key, result);
        return result;
    }

    private void requireRecognized(final CykTable table) {
        if (!recognizes(table)) {
            throw new IllegalArgumentException("The input \"%s\" is not derivable from %s".formatted(format(table.input()), grammar.start()));
        }
    }

    private boolean hasEmptyStart() {
        return grammar.contains(Production.of(grammar.start()));
    }

    private int emptyStartProduction() {
        return grammar.indexOf(Production.of(grammar.start()));
    }

    private record SymbolSpan(String symbol, int start, int length) {
    }
}
