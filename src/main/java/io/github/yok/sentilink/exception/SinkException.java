package io.github.yok.sentilink.exception;

/**
 * Thrown when the processed dataset cannot be persisted.
 *
 * @author Yasuharu.Okawauchi
 */
public class SinkException extends SentiLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message detail message naming the path or table
     */
    public SinkException(String message) {
        super(ErrorKind.SINK, message);
    }

    /**
     * @param message detail message naming the path or table
     * @param cause root cause
     */
    public SinkException(String message, Throwable cause) {
        super(ErrorKind.SINK, message, cause);
    }
}
