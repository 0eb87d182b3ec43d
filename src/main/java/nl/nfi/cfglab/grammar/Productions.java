package nl.nfi.cfglab.grammar;

import java.util.ArrayList;
import java.util.List;

import static nl.nfi.cfglab.grammar.Symbols.word;

// reads the line-oriented notation, e.g.:
//      S -> ( S ) | x T y
//      x T y -> t
//  one line per lhs, alternatives separated by '|', ε for the empty word, blank lines ignored
public final class Productions {

    private static final String ARROW = "->";

    public static List<Production> fromString(final String text) {
        return fromString(text, true);
    }

    public static List<Production> fromString(final String text, final boolean contextFree) {
        final List<Production> productions = new ArrayList<>();

        final List<String> lines = text.lines().toList();
        for (int index = 0; index < lines.size(); index++) {
            final String line = lines.get(index);
            if (line.isBlank()) {
                continue;
            }
            productions.addAll(parseLine(index + 1, line, contextFree));
        }

        return productions;
    }

    private static List<Production> parseLine(final int lineNumber, final String line, final boolean contextFree) {
        final String[] sides = line.split(ARROW, -1);
        if (sides.length != 2) {
            throw new GrammarParseException(lineNumber, line, "expected exactly one '%s'".formatted(ARROW));
        }

        final List<String> lhs = word(sides[0]);
        if (lhs.isEmpty()) {
            throw new GrammarParseException(lineNumber, line, "the lefthand side is empty");
        }
        if (contextFree && lhs.size() != 1) {
            throw new GrammarParseException(lineNumber, line,
                "more than one symbol as lefthand side, that is forbidden in a context-free grammar");
        }

        final List<Production> productions = new ArrayList<>();
        for (final String alternative : sides[1].split("\\|", -1)) {
            final List<String> rhs = word(alternative);
            if (rhs.isEmpty()) {
                throw new GrammarParseException(lineNumber, line, "empty alternative, use ε for the empty word");
            }
            try {
                productions.add(new Production(lhs, rhs));
            } catch (final InvalidGrammarException e) {
                throw new GrammarParseException(lineNumber, line, e);
            }
        }
        return productions;
    }
}
