package nl.nfi.cfglab.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Collections.unmodifiableMap;
import static java.util.stream.Collectors.joining;

/**
 * The recognition table of a CYK run: for the span of {@code length} input symbols starting at the 1-based
 * position {@code start}, the nonterminals deriving exactly those symbols.
 * <p>
 * Spans of length zero only appear in tables augmented by {@link #withEmptySpans}.
 */
public final class CykTable {

    public record Span(int start, int length) {

        @Override
        public String toString() {
            return "R[%d, %d]".formatted(start, length);
        }
    }

    private final List<String> input;
    private final Map<Span, SortedSet<String>> entries;

    private CykTable(final List<String> input, final Map<Span, SortedSet<String>> entries) {
        this.input = List.copyOf(input);
        this.entries = entries;
    }

    static Builder builder(final List<String> input) {
        return new Builder(input);
    }

    public List<String> input() {
        return input;
    }

    public int size() {
        return input.size();
    }

    // the symbol at 1-based position i
    public String inputAt(final int start) {
        return input.get(start - 1);
    }

    public SortedSet<String> get(final int start, final int length) {
        final SortedSet<String> symbols = entries.get(new Span(start, length));
        return symbols == null ? Collections.emptySortedSet() : symbols;
    }

    public boolean contains(final String symbol, final int start, final int length) {
        return get(start, length).contains(symbol);
    }

    // non-empty entries only
    public Map<Span, SortedSet<String>> entries() {
        return unmodifiableMap(entries);
    }

    // R[i, 0] = nullable for every i = 1..n+1, all other entries unchanged
    public CykTable withEmptySpans(final Set<String> nullable) {
        final Builder builder = new Builder(input);
        entries.forEach((span, symbols) -> symbols.forEach(symbol -> builder.add(span.start(), span.length(), symbol)));
        for (int start = 1; start <= input.size() + 1; start++) {
            for (final String symbol : nullable) {
                builder.add(start, 0, symbol);
            }
        }
        return builder.build();
    }

    // longest spans first, like the triangle on a blackboard
    @Override
    public String toString() {
        final StringBuilder text = new StringBuilder();
        for (int length = input.size(); length >= 0; length--) {
            for (int start = 1; start <= input.size() - length + 1; start++) {
                final SortedSet<String> symbols = get(start, length);
                if (!symbols.isEmpty()) {
                    text.append(new Span(start, length)).append(" = ").append(symbols.stream().collect(joining(", ", "{", "}"))).append('\n');
                }
            }
        }
        return text.toString();
    }

    static final class Builder {

        private final List<String> input;
        private final Map<Span, SortedSet<String>> entries = new LinkedHashMap<>();

        private Builder(final List<String> input) {
            this.input = input;
        }

        Builder add(final int start, final int length, final String symbol) {
            entries.computeIfAbsent(new Span(start, length), span -> new TreeSet<>()).add(symbol);
            return this;
        }

        boolean contains(final String symbol, final int start, final int length) {
            final SortedSet<String> symbols = entries.get(new Span(start, length));
            return symbols != null && symbols.contains(symbol);
        }

        CykTable build() {
            final Map<Span, SortedSet<String>> frozen = new LinkedHashMap<>();
            entries.forEach((span, symbols) -> frozen.put(span, Collections.unmodifiableSortedSet(new TreeSet<>(symbols))));
            return new CykTable(input, frozen);
        }
    }
}
