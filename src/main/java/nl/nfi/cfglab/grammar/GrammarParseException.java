package nl.nfi.cfglab.grammar;

// raised while reading the textual notation, lineNumber is 1-based
public final class GrammarParseException extends InvalidGrammarException {

    private final int lineNumber;
    private final String line;

    public GrammarParseException(final int lineNumber, final String line, final String reason) {
        super("Line %d (\"%s\"): %s".formatted(lineNumber, line.strip(), reason));
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public GrammarParseException(final int lineNumber, final String line, final InvalidGrammarException cause) {
        super("Line %d (\"%s\"): %s".formatted(lineNumber, line.strip(), cause.getMessage()), cause);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String line() {
        return line;
    }
}
