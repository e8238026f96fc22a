package org.pragmatica.minilang.error;

/**
 * Thrown when a failed parse result is unwrapped.
 */
public final class SyntaxException extends RuntimeException {
    private final SyntaxError error;

    public SyntaxException(SyntaxError error) {
        super(error.message());
        this.error = error;
    }

    public SyntaxError error() {
        return error;
    }
}
