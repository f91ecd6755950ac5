package io.errorchain.core.error;

/**
 * A plain error returned by {@link Errors#wrapMessage} and {@link Errors#wrapWithCause}. Its
 * message is the composed display text and it unwraps to the error it decorates.
 */
public final class WrappedError extends RuntimeException {

    private static final long serialVersionUID = 1L;

    WrappedError(String message, Throwable wrapped) {
        super(message, wrapped);
    }

    /** The decorated error (same as {@link #getCause()}). */
    public Throwable unwrap() {
        return getCause();
    }
}
