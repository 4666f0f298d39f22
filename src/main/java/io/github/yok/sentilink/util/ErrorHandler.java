package io.github.yok.sentilink.util;

import io.github.yok.sentilink.exception.SentiLinkException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Utility class that logs a fatal error and echoes a concise message to {@code System.err}.
 *
 * <p>
 * Used by the command-line layer only; pipeline components throw
 * {@link SentiLinkException} subclasses and never print.
 * </p>
 *
 * <ul>
 * <li>Logs the error with its stack trace using SLF4J.</li>
 * <li>Writes {@code ERROR[kind]: message} and the root cause message to {@code System.err}.</li>
 * <li>Does not terminate the JVM by itself (callers decide how to end the process).</li>
 * <li>In tests, callers can switch behavior to throwing an exception via a thread-local flag.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Throw instead of reporting for the current thread (used by tests).
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Restore normal behavior for the current thread.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Logs the message and cause at error level and prints a concise message to
     * {@code System.err}.
     *
     * <p>
     * If reporting is disabled for the current thread, an {@link IllegalStateException} wrapping
     * the cause is thrown instead.
     * </p>
     *
     * @param message message to log
     * @param cause root cause
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        String kind = cause instanceof SentiLinkException
                ? "[" + ((SentiLinkException) cause).getKind() + "]"
                : "";
        System.err.println("ERROR" + kind + ": " + message + "\n"
                + ExceptionUtils.getRootCauseMessage(cause));
    }
}
