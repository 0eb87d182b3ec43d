package nl.nfi.cfglab.grammar;

import java.util.Arrays;
import java.util.List;

import static java.lang.String.join;

// symbols are plain non-empty strings, words are immutable lists of symbols
public final class Symbols {

    public static final String EPSILON = "ε";

    // the right-hand side of an ε-production
    public static final List<String> EMPTY_WORD = List.of(EPSILON);

    public static boolean isEmptyWord(final List<String> word) {
        return word.isEmpty() || word.equals(EMPTY_WORD);
    }

    // the symbols a word actually contributes to a sentential form
    public static List<String> symbolsOf(final List<String> word) {
        return word.equals(EMPTY_WORD) ? List.of() : word;
    }

    // e.g. "i + i * i" -> [i, +, i, *, i]
    public static List<String> word(final String text) {
        final String stripped = text.strip();
        if (stripped.isEmpty()) {
            return List.of();
        }
        return List.of(stripped.split("\\s+"));
    }

    public static List<String> word(final String... symbols) {
        return List.copyOf(Arrays.asList(symbols));
    }

    public static String format(final List<String> word) {
        return join(" ", word);
    }
}
