package nl.nfi.cfglab.grammar;

public class InvalidGrammarException extends IllegalArgumentException {

    public InvalidGrammarException(final String message) {
        super(message);
    }

    public InvalidGrammarException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
