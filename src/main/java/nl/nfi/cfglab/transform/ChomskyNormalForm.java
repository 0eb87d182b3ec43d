package nl.nfi.cfglab.transform;

import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.grammar.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static java.util.stream.Collectors.joining;
import static nl.nfi.cfglab.common.Closures.closure;
import static nl.nfi.cfglab.grammar.Symbols.EMPTY_WORD;
import static nl.nfi.cfglab.transform.Hygiene.removeUnproductiveUnreachable;
import static nl.nfi.cfglab.transform.Hygiene.requireContextFree;

/**
 * Conversion of a context-free grammar to Chomsky normal form, in four steps applied in this order:
 * <ol>
 *     <li>{@link #eliminateEpsilonRules}: rhs occurrences of a nullable {@code A} are either dropped or replaced
 *     by {@code A′}, a copy of {@code A} without its ε-rule</li>
 *     <li>{@link #eliminateUnitRules}: {@code A -> B} is replaced by {@code A -> α} for the alternatives of
 *     {@code B}</li>
 *     <li>{@link #eliminateNonSolitaryTerminals}: terminals in a rhs of length two or more are replaced by a
 *     carrier nonterminal {@code Nx -> x}</li>
 *     <li>{@link #binarize}: long righthand sides are split into chains of binary productions</li>
 * </ol>
 * Every step keeps the production order of its input: a rewritten production is replaced in place by the
 * productions that take its role. {@link #steps} leaves the original nonterminals (and the ε-rules no longer
 * reachable) in the grammar, which is what the reconstruction of derivations in the original grammar needs;
 * {@link #transform} cleans the result up.
 */
public final class ChomskyNormalForm {

    private static final Logger LOG = LoggerFactory.getLogger(ChomskyNormalForm.class);

    public static Grammar transform(final Grammar grammar) {
        return removeUnproductiveUnreachable(steps(grammar));
    }

    public static Grammar steps(final Grammar grammar) {
        return steps(grammar, NameAllocator.forGrammar(grammar));
    }

    public static Grammar steps(final Grammar grammar, final NameAllocator names) {
        final Grammar withoutEpsilon = eliminateEpsilonRules(grammar, names);
        final Grammar withoutUnits = eliminateUnitRules(withoutEpsilon);
        final Grammar withCarriers = eliminateNonSolitaryTerminals(withoutUnits, names);
        return binarize(withCarriers, names);
    }

    public static Grammar eliminateEpsilonRules(final Grammar grammar) {
        return eliminateEpsilonRules(grammar, NameAllocator.forGrammar(grammar));
    }

    public static Grammar eliminateEpsilonRules(final Grammar grammar, final NameAllocator names) {
        requireContextFree(grammar);
        final EliminationState<String> initial = new EliminationState<>(grammar, Set.of());
        final Grammar result = closure(state -> eliminateNextEpsilonRule(state, names), initial).grammar();
        logStep("ε-rules", grammar, result);
        return result;
    }

    public static Grammar eliminateUnitRules(final Grammar grammar) {
        requireContextFree(grammar);
        final EliminationState<Production> initial = new EliminationState<>(grammar, Set.of());
        final Grammar result = closure(ChomskyNormalForm::eliminateNextUnitRule, initial).grammar();
        logStep("unit rules", grammar, result);
        return result;
    }

    public static Grammar eliminateNonSolitaryTerminals(final Grammar grammar) {
        return eliminateNonSolitaryTerminals(grammar, NameAllocator.forGrammar(grammar));
    }

    public static Grammar eliminateNonSolitaryTerminals(final Grammar grammar, final NameAllocator names) {
        requireContextFree(grammar);
        final Set<String> nonterminals = new TreeSet<>(grammar.nonterminals());
        final List<Production> productions = new ArrayList<>();
        // terminal -> carrier, in first-use order
        final Map<String, String> carriers = new LinkedHashMap<>();

        for (final Production production : grammar.productions()) {
            if (production.rhs().size() < 2) {
                productions.add(production);
                continue;
            }
            final List<String> rhs = new ArrayList<>();
            for (final String symbol : production.rhs()) {
                if (grammar.isTerminal(symbol)) {
                    rhs.add(carriers.computeIfAbsent(symbol, names::terminalCarrier));
                } else {
                    rhs.add(symbol);
                }
            }
            productions.add(Production.of(production.lhs(), rhs));
        }
        carriers.forEach((terminal, carrier) -> {
            nonterminals.add(carrier);
            productions.add(Production.of(carrier, terminal));
        });

        final Grammar result = grammar.withProductions(nonterminals, productions);
        logStep("non-solitary terminals", grammar, result);
        return result;
    }

    public static Grammar binarize(final Grammar grammar) {
        return binarize(grammar, NameAllocator.forGrammar(grammar));
    }

    public static Grammar binarize(final Grammar grammar, final NameAllocator names) {
        requireContextFree(grammar);
        final Set<String> nonterminals = new TreeSet<>(grammar.nonterminals());
        final List<Production> productions = new ArrayList<>();

        for (final Production production : grammar.productions()) {
            final List<String> rhs = production.rhs();
            if (rhs.size() <= 2) {
                productions.add(production);
                continue;
            }
            // X1 ... Xk becomes A1 -> X1 X2, A2 -> A1 X3, ..., A -> A(k-2) Xk
            String previous = rhs.get(0);
            for (int i = 1; i < rhs.size() - 1; i++) {
                final String link = names.nextInChain(production.lhs());
                nonterminals.add(link);
                productions.add(Production.of(link, previous, rhs.get(i)));
                previous = link;
            }
            productions.add(Production.of(production.lhs(), previous, rhs.get(rhs.size() - 1)));
        }

        final Grammar result = grammar.withProductions(nonterminals, productions);
        logStep("long righthand sides", grammar, result);
        return result;
    }

    public static boolean isInCnf(final Grammar grammar) {
        return violations(grammar, false).isEmpty();
    }

    public static void checkCnf(final Grammar grammar) {
        final List<Production> violations = violations(grammar, false);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("The grammar is not in Chomsky normal form, offending productions: %s".formatted(format(violations)));
        }
    }

    // as checkCnf, but ε-rules are accepted for every lhs: they never contribute to a non-empty span
    public static void checkCykCompatible(final Grammar grammar) {
        final List<Production> violations = violations(grammar, true);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException("The grammar is not suitable for CYK parsing, offending productions: %s".formatted(format(violations)));
        }
    }

    private static List<Production> violations(final Grammar grammar, final boolean anyEpsilon) {
        requireContextFree(grammar);
        final List<Production> violations = new ArrayList<>();
        for (final Production production : grammar.productions()) {
            final List<String> rhs = production.rhs();
            final boolean terminal = rhs.size() == 1 && grammar.isTerminal(rhs.get(0));
            final boolean binary = rhs.size() == 2 && grammar.isNonterminal(rhs.get(0)) && grammar.isNonterminal(rhs.get(1));
            final boolean epsilon = production.isEpsilon() && (anyEpsilon || production.lhs().equals(grammar.start()));
            if (!terminal && !binary && !epsilon) {
                violations.add(production);
            }
        }
        return violations;
    }

    // one nullable nonterminal per application, in sorted order
    private static EliminationState<String> eliminateNextEpsilonRule(final EliminationState<String> state, final NameAllocator names) {
        final Grammar grammar = state.grammar();
        final String nullable = grammar.productions(Production::isEpsilon).stream()
            .map(Production::lhs)
            .filter(lhs -> !state.seen().contains(lhs))
            .sorted()
            .findFirst()
            .orElse(null);
        if (nullable == null) {
            return state;
        }

        final String primed = names.primed(nullable);
        final Set<String> nonterminals = new TreeSet<>(grammar.nonterminals());
        nonterminals.add(primed);

        final List<Production> rewritten = closure(productions -> rewriteFirstOccurrence(productions, nullable, primed), grammar.productions());
        final Grammar intermediate = grammar.withProductions(nonterminals, rewritten);

        final List<Production> productions = new ArrayList<>(rewritten);
        for (final List<String> alternative : intermediate.alternatives(nullable)) {
            if (!alternative.equals(EMPTY_WORD)) {
                productions.add(Production.of(primed, alternative));
            }
        }

        final Set<String> seen = new HashSet<>(state.seen());
        seen.add(nullable);
        LOG.trace("Eliminated ε-rule of {}, introducing {}", nullable, primed);
        return new EliminationState<>(grammar.withProductions(nonterminals, productions), seen);
    }

    private static List<Production> rewriteFirstOccurrence(final List<Production> productions, final String nullable, final String primed) {
        final Set<Production> rewritten = new LinkedHashSet<>();
        for (final Production production : productions) {
            final int position = production.rhs().indexOf(nullable);
            if (position < 0) {
                rewritten.add(production);
                continue;
            }
            final List<String> dropped = new ArrayList<>(production.rhs());
            dropped.remove(position);
            final List<String> replaced = new ArrayList<>(production.rhs());
            replaced.set(position, primed);

            // an empty rhs becomes ε in the Production constructor
            rewritten.add(new Production(production.lhsSymbols(), dropped));
            rewritten.add(new Production(production.lhsSymbols(), replaced));
        }
        return List.copyOf(rewritten);
    }

    private static EliminationState<Production> eliminateNextUnitRule(final EliminationState<Production> state) {
        final Grammar grammar = state.grammar();
        final Production unit = grammar.productions().stream()
            .filter(production -> isUnit(grammar, production))
            .filter(production -> !state.seen().contains(production))
            .findFirst()
            .orElse(null);
        if (unit == null) {
            return state;
        }

        final Set<Production> productions = new LinkedHashSet<>();
        for (final Production production : grammar.productions()) {
            if (!production.equals(unit)) {
                productions.add(production);
                continue;
            }
            for (final List<String> alternative : grammar.alternatives(unit.rhs().get(0))) {
                final Production replacement = Production.of(unit.lhs(), alternative);
                if (!isSelfUnit(replacement) && !state.seen().contains(replacement)) {
                    productions.add(replacement);
                }
            }
        }

        final Set<Production> seen = new HashSet<>(state.seen());
        seen.add(unit);
        return new EliminationState<>(grammar.withProductions(grammar.nonterminals(), productions), seen);
    }

    private static boolean isUnit(final Grammar grammar, final Production production) {
        return production.rhs().size() == 1 && grammar.isNonterminal(production.rhs().get(0));
    }

    private static boolean isSelfUnit(final Production production) {
        return production.rhs().equals(List.of(production.lhs()));
    }

    private static void logStep(final String step, final Grammar before, final Grammar after) {
        if (LOG.isDebugEnabled()) {
            final Set<String> introduced = new TreeSet<>(after.nonterminals());
            introduced.removeAll(before.nonterminals());
            LOG.debug("Eliminated {}: {} -> {} productions, introduced {}", step, before.productions().size(), after.productions().size(), introduced);
        }
    }

    private static String format(final List<Production> productions) {
        return productions.stream().map(Production::toString).collect(joining(", ", "(", ")"));
    }

    // the grammar under transformation with what has already been handled: nonterminals for ε-rules,
    // productions for unit rules
    private record EliminationState<S>(Grammar grammar, Set<S> seen) {
    }
}
