package io.github.yok.sentilink.exception;

import lombok.Getter;

/**
 * Root of all exceptions raised by SentiLink.
 *
 * <p>
 * Every subclass carries an {@link ErrorKind} so that callers can decide how to react without
 * inspecting concrete types.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public abstract class SentiLinkException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    // Category of this failure
    private final ErrorKind kind;

    /**
     * Creates an exception without a cause.
     *
     * @param kind failure category
     * @param message detail message
     */
    protected SentiLinkException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Creates an exception with a cause.
     *
     * @param kind failure category
     * @param message detail message
     * @param cause root cause
     */
    protected SentiLinkException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
}
