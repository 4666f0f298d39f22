package io.github.yok.sentilink.exception;

/**
 * Thrown when source or destination settings are missing or invalid. Always raised before any row
 * is processed.
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigurationException extends SentiLinkException {

    private static final long serialVersionUID = 1L;

    /**
     * @param message detail message naming the offending setting
     */
    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    /**
     * @param message detail message naming the offending setting
     * @param cause root cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
