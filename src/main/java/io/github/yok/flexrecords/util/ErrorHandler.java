package io.github.yok.flexrecords.util;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports failures of the command-line workflow: a missing option, or a content load that stopped
 * at its first failed record.
 *
 * <p>
 * The JVM is never terminated here; {@code Main} returns and Spring Boot shuts down. Tests switch
 * the current thread to "throw instead of report" to assert on the failure.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ErrorHandler {

    private static final ThreadLocal<Boolean> EXIT_DISABLED =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Makes {@code errorAndExit} throw {@link IllegalStateException} on the current thread.
     */
    public static void disableExitForCurrentThread() {
        EXIT_DISABLED.set(Boolean.TRUE);
    }

    /**
     * Makes {@code errorAndExit} report to the log and {@code System.err} again.
     */
    public static void restoreExitForCurrentThread() {
        EXIT_DISABLED.remove();
    }

    /**
     * Reports a failure that ends a content load.
     *
     * <p>
     * The message and the full stack trace are logged at error level. {@code System.err} receives
     * the message and the innermost cause only, e.g. the SQL error behind a failed write. With exit
     * disabled for the current thread, nothing is printed and an exception is thrown instead.
     * </p>
     *
     * @param message message to report
     * @param cause failure
     * @throws IllegalStateException carrying {@code cause}, if exit is disabled for the current
     *         thread
     */
    public static void errorAndExit(String message, Throwable cause) {
        log.error("{}\n{}", message, ExceptionUtils.getStackTrace(cause));
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message, cause);
        }
        System.err.println("ERROR: " + message + "\n" + ExceptionUtils.getRootCauseMessage(cause));
    }

    /**
     * Reports a usage error that has no underlying exception, such as a missing {@code --load}.
     *
     * <p>
     * The message is logged at error level and printed to {@code System.err} with an
     * {@code ERROR: } prefix. With exit disabled for the current thread, nothing is printed and an
     * exception is thrown instead.
     * </p>
     *
     * @param message message to report
     * @throws IllegalStateException if exit is disabled for the current thread
     */
    public static void errorAndExit(String message) {
        log.error(message);
        if (Boolean.TRUE.equals(EXIT_DISABLED.get())) {
            throw new IllegalStateException(message);
        }
        System.err.println("ERROR: " + message);
    }
}
