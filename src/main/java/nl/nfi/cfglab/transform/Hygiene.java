package nl.nfi.cfglab.transform;

import nl.nfi.cfglab.grammar.Grammar;
import nl.nfi.cfglab.grammar.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;

import static nl.nfi.cfglab.common.Closures.closure;
import static nl.nfi.cfglab.grammar.Symbols.EPSILON;

// removal of useless symbols: non-productive, unreachable and undefined ones
public final class Hygiene {

    private static final Logger LOG = LoggerFactory.getLogger(Hygiene.class);

    // symbols deriving some terminal string: T, ε, and every A with some A -> α where all of α is productive
    public static Set<String> productive(final Grammar grammar) {
        requireContextFree(grammar);
        final Set<String> initial = new TreeSet<>(grammar.terminals());
        initial.add(EPSILON);
        return closure(Hygiene::expandProductive, initial, grammar);
    }

    // symbols occurring in some sentential form derivable from the start symbol
    public static Set<String> reachable(final Grammar grammar) {
        requireContextFree(grammar);
        return closure(Hygiene::expandReachable, Set.of(grammar.start()), grammar);
    }

    // nonterminals deriving the empty word
    public static Set<String> nullable(final Grammar grammar) {
        requireContextFree(grammar);
        final Set<String> initial = new TreeSet<>();
        for (final Production production : grammar.productions()) {
            if (production.isEpsilon()) {
                initial.add(production.lhs());
            }
        }
        return closure(Hygiene::expandNullable, initial, grammar);
    }

    // reachability must be computed on the already restricted grammar: a symbol only used by
    // non-productive alternatives becomes unreachable once those are gone
    public static Grammar removeUnproductiveUnreachable(final Grammar grammar) {
        final Grammar productiveOnly = grammar.restrictTo(productive(grammar));
        final Grammar cleaned = productiveOnly.restrictTo(reachable(productiveOnly));
        LOG.debug("Removed unproductive/unreachable symbols: {} -> {} productions, {} -> {} nonterminals",
            grammar.productions().size(), cleaned.productions().size(),
            grammar.nonterminals().size(), cleaned.nonterminals().size());
        return cleaned;
    }

    // keeps the nonterminals that are the lhs of some production (and the terminals)
    public static Grammar removeUndefined(final Grammar grammar) {
        requireContextFree(grammar);
        final Set<String> defined = new TreeSet<>(grammar.terminals());
        for (final Production production : grammar.productions()) {
            defined.add(production.lhs());
        }
        return grammar.restrictTo(defined);
    }

    static void requireContextFree(final Grammar grammar) {
        if (!grammar.isContextFree()) {
            throw new IllegalArgumentException("Operation requires a context-free grammar, got: %s".formatted(grammar));
        }
    }

    private static Set<String> expandProductive(final Set<String> productive, final Grammar grammar) {
        final Set<String> next = new TreeSet<>(productive);
        for (final Production production : grammar.productions()) {
            if (productive.containsAll(production.rhs())) {
                next.add(production.lhs());
            }
        }
        return next;
    }

    private static Set<String> expandReachable(final Set<String> reachable, final Grammar grammar) {
        final Set<String> next = new TreeSet<>(reachable);
        for (final Production production : grammar.productions()) {
            if (reachable.contains(production.lhs())) {
                next.addAll(production.rhs());
            }
        }
        next.remove(EPSILON);
        return next;
    }

    private static Set<String> expandNullable(final Set<String> nullable, final Grammar grammar) {
        final Set<String> next = new TreeSet<>(nullable);
        for (final Production production : grammar.productions()) {
            if (!production.isEpsilon() && nullable.containsAll(production.rhs())) {
                next.add(production.lhs());
            }
        }
        return next;
    }
}
