package io.github.yok.sentilink.exception;

import lombok.Getter;

/**
 * Thrown when the input dataset cannot be loaded.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SourceException extends SentiLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * Reason why loading failed.
     */
    public enum Reason {
        // Input file does not exist
        NOT_FOUND,
        // Input file exists but cannot be parsed
        FORMAT_ERROR,
        // Database connection could not be opened
        CONNECTION_ERROR,
        // Query failed on an open connection
        QUERY_ERROR
    }

    private final Reason reason;

    /**
     * @param reason failure reason
     * @param message detail message naming the path or connection
     */
    public SourceException(Reason reason, String message) {
        super(ErrorKind.SOURCE, message);
        this.reason = reason;
    }

    /**
     * @param reason failure reason
     * @param message detail message naming the path or connection
     * @param cause root cause
     */
    public SourceException(Reason reason, String message, Throwable cause) {
        super(ErrorKind.SOURCE, message, cause);
        this.reason = reason;
    }
}
