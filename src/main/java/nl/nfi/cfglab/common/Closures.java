package nl.nfi.cfglab.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * Fixpoint iteration: applies an expansion function to its own result until the result no longer changes.
 * <p>
 * The expansion must return a new value rather than mutate its argument, and is expected to be monotone over a
 * finite universe (sets of symbols, sets of productions, ...), which guarantees termination. A function that keeps
 * producing different values is stopped after a bound on the number of iterations.
 */
public final class Closures {

    private static final Logger LOG = LoggerFactory.getLogger(Closures.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100_000;

    public static <T> T closure(final UnaryOperator<T> expansion, final T initial) {
        return boundedClosure(expansion, initial, DEFAULT_MAX_ITERATIONS);
    }

    // the context is passed unchanged to every application
    public static <T, C> T closure(final BiFunction<T, C, T> expansion, final T initial, final C context) {
        return boundedClosure(current -> expansion.apply(current, context), initial, DEFAULT_MAX_ITERATIONS);
    }

    public static <T> T boundedClosure(final UnaryOperator<T> expansion, final T initial, final int maxIterations) {
        T current = initial;
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            final T next = expansion.apply(current);
            if (next.equals(current)) {
                LOG.trace("Fixpoint reached after {} iteration(s)", iteration);
                return current;
            }
            current = next;
        }
        throw new IllegalStateException("No fixpoint reached after %d iterations, is the expansion monotone?".formatted(maxIterations));
    }
}
