package nl.nfi.cfglab.transform;

import nl.nfi.cfglab.grammar.Grammar;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;

/**
 * Hands out fresh nonterminal names that collide with no symbol of the grammar it was created for, nor with any
 * name it handed out before. Names are a function of the input only, so running a transformation twice on the same
 * grammar yields the same names.
 * <ul>
 *     <li>primed: {@code A′} (another {@code ′} per collision), one per origin symbol</li>
 *     <li>terminal carrier: {@code Nx} for terminal {@code x} ({@code ′} appended on collision), one per terminal</li>
 *     <li>chain: {@code A1}, {@code A2}, ... numbered per origin symbol, taken numbers are skipped</li>
 * </ul>
 * Every generated name is registered with its {@link Origin}, which keeps synthesized nonterminals apart from the
 * ones the grammar was written with.
 */
public final class NameAllocator {

    public static final String PRIME = "′";
    public static final String CARRIER_PREFIX = "N";

    public enum Kind {
        PRIMED,
        TERMINAL_CARRIER,
        CHAIN
    }

    public record Origin(Kind kind, String symbol) {
    }

    private final Set<String> taken;
    private final Map<String, Origin> generated;
    private final Map<String, String> primed;
    private final Map<String, String> carriers;
    private final Map<String, Integer> chainCounters;

    private NameAllocator(final Collection<String> reserved) {
        this.taken = new HashSet<>(reserved);
        this.generated = new LinkedHashMap<>();
        this.primed = new HashMap<>();
        this.carriers = new HashMap<>();
        this.chainCounters = new HashMap<>();
    }

    public static NameAllocator reserving(final Collection<String> symbols) {
        return new NameAllocator(symbols);
    }

    public static NameAllocator forGrammar(final Grammar grammar) {
        return reserving(grammar.symbols());
    }

    public String primed(final String symbol) {
        return primed.computeIfAbsent(symbol, origin -> {
            String name = origin + PRIME;
            while (taken.contains(name)) {
                name += PRIME;
            }
            return register(name, new Origin(Kind.PRIMED, origin));
        });
    }

    public String terminalCarrier(final String terminal) {
        return carriers.computeIfAbsent(terminal, origin -> {
            String name = CARRIER_PREFIX + origin;
            while (taken.contains(name)) {
                name += PRIME;
            }
            return register(name, new Origin(Kind.TERMINAL_CARRIER, origin));
        });
    }

    public String nextInChain(final String symbol) {
        int counter = chainCounters.getOrDefault(symbol, 0);
        String name;
        do {
            counter++;
            name = symbol + counter;
        } while (taken.contains(name));
        chainCounters.put(symbol, counter);
        return register(name, new Origin(Kind.CHAIN, symbol));
    }

    public Optional<Origin> originOf(final String name) {
        return Optional.ofNullable(generated.get(name));
    }

    public boolean isGenerated(final String name) {
        return generated.containsKey(name);
    }

    // in allocation order
    public Map<String, Origin> generated() {
        return unmodifiableMap(generated);
    }

    private String register(final String name, final Origin origin) {
        taken.add(name);
        generated.put(name, origin);
        return name;
    }
}
