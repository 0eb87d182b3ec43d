package nl.nfi.cfglab.common;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.TreeSet;

import static nl.nfi.cfglab.common.Closures.boundedClosure;
import static nl.nfi.cfglab.common.Closures.closure;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClosuresTest {

    @Test
    void expandsUntilNothingChanges() {
        assertThat(closure(ClosuresTest::decrement, Set.of(4)))
            .containsExactlyInAnyOrder(0, 1, 2, 3, 4);
    }

    @Test
    void passesContextToEveryApplication() {
        assertThat(closure(ClosuresTest::reduceUpTo, Set.of(4), 2))
            .containsExactlyInAnyOrder(2, 3, 4);
        assertThat(closure(ClosuresTest::reduceUpTo, Set.of(7, 1), 5))
            .containsExactlyInAnyOrder(1, 5, 6, 7);
    }

    @Test
    void isIdempotent() {
        final Set<Integer> once = closure(ClosuresTest::decrement, Set.of(3, 9));
        final Set<Integer> twice = closure(ClosuresTest::decrement, once);

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void fixpointOfInitialValueIsReturnedAsIs() {
        final Set<Integer> initial = Set.of(0);
        assertThat(closure(ClosuresTest::decrement, initial)).isSameAs(initial);
    }

    @Test
    void failsWhenNoFixpointIsReached() {
        assertThatThrownBy(() -> boundedClosure(value -> value + 1, 0, 10))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("No fixpoint reached after 10 iterations");
    }

    private static Set<Integer> decrement(final Set<Integer> values) {
        final Set<Integer> next = new TreeSet<>(values);
        for (final int value : values) {
            if (value > 0) {
                next.add(value - 1);
            }
        }
        return next;
    }

    private static Set<Integer> reduceUpTo(final Set<Integer> values, final Integer minimum) {
        final Set<Integer> next = new TreeSet<>(values);
        for (final int value : values) {
            if (value > minimum) {
                next.add(value - 1);
            }
        }
        return next;
    }
}
