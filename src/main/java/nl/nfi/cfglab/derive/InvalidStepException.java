package nl.nfi.cfglab.derive;

public final class InvalidStepException extends IllegalStateException {

    public InvalidStepException(final String message) {
        super(message);
    }
}
