package io.github.yok.sentilink.exception;

/**
 * Thrown when the statistics report cannot be generated. Never fails a run.
 *
 * @author Yasuharu.Okawauchi
 */
public class ReportException extends SentiLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message detail message naming the report path
     * @param cause root cause
     */
    public ReportException(String message, Throwable cause) {
        super(ErrorKind.REPORT, message, cause);
    }
}
