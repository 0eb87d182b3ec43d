package nl.nfi.cfglab.derive;

// application of production number `production` at index `position` of the sentential form
public record Step(int production, int position) {

    public static Step of(final int production, final int position) {
        return new Step(production, position);
    }

    @Override
    public String toString() {
        return "(%d, %d)".formatted(production, position);
    }
}
