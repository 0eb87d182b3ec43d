package nl.nfi.cfglab.grammar;

import java.util.List;
import java.util.function.Predicate;

/**
 * Conjunction of optional constraints on the shape of a production, e.g.
 * {@code Production.suchThat().lhs("B").rhsLength(1)} matches {@code B -> b} but not {@code A -> B C}.
 * A filter without constraints matches every production.
 */
public final class ProductionFilter implements Predicate<Production> {

    private static final ProductionFilter ANY = new ProductionFilter(null, null, null, null);

    private final String lhs;
    private final List<String> rhs;
    private final Integer rhsLength;
    private final List<String> rhsSuffixOf;

    private ProductionFilter(final String lhs, final List<String> rhs, final Integer rhsLength, final List<String> rhsSuffixOf) {
        this.lhs = lhs;
        this.rhs = rhs;
        this.rhsLength = rhsLength;
        this.rhsSuffixOf = rhsSuffixOf;
    }

    public static ProductionFilter any() {
        return ANY;
    }

    public ProductionFilter lhs(final String lhs) {
        return new ProductionFilter(lhs, rhs, rhsLength, rhsSuffixOf);
    }

    public ProductionFilter rhs(final List<String> rhs) {
        return new ProductionFilter(lhs, List.copyOf(rhs), rhsLength, rhsSuffixOf);
    }

    public ProductionFilter rhs(final String... rhs) {
        return rhs(List.of(rhs));
    }

    public ProductionFilter rhsLength(final int rhsLength) {
        return new ProductionFilter(lhs, rhs, rhsLength, rhsSuffixOf);
    }

    // matches when the rhs is a suffix of the given word, e.g. [x] of [a, x]
    public ProductionFilter rhsIsSuffixOf(final List<String> word) {
        return new ProductionFilter(lhs, rhs, rhsLength, List.copyOf(word));
    }

    @Override
    public boolean test(final Production production) {
        if (lhs != null && !production.lhsSymbols().equals(List.of(lhs))) {
            return false;
        }
        if (rhs != null && !production.rhs().equals(rhs)) {
            return false;
        }
        if (rhsLength != null && production.rhs().size() != rhsLength) {
            return false;
        }
        return rhsSuffixOf == null || isSuffix(production.rhs(), rhsSuffixOf);
    }

    private static boolean isSuffix(final List<String> suffix, final List<String> word) {
        return suffix.size() <= word.size() && word.subList(word.size() - suffix.size(), word.size()).equals(suffix);
    }
}
