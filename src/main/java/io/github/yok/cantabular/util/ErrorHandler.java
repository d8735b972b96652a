package io.github.yok.cantabular.util;

import io.github.yok.cantabular.error.ApiException;
import io.github.yok.cantabular.table.TableCanceledException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.exception.ExceptionUtils;

/**
 * Reports command line failures: invalid arguments and failed exports.
 *
 * <p>
 * Every report is logged and echoed to {@code System.err} as one line starting with
 * {@code ERROR:}. For failed exports the line names the dataset and, when known, the HTTP status
 * returned by Cantabular or the number of rows written before the export was canceled.
 * </p>
 *
 * <p>
 * Tests can make the current thread throw {@link IllegalStateException} after reporting, so that
 * the failure becomes observable.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ErrorHandler {

    static final String USAGE =
            "Usage: --dataset <name> --variables <a,b,...> --output <file.csv> | --health";

    private static final ThreadLocal<Boolean> THROW_ON_ERROR =
            ThreadLocal.withInitial(() -> Boolean.FALSE);

    private ErrorHandler() {}

    /**
     * Makes the reporting methods throw on the current thread.
     */
    public static void throwOnErrorForCurrentThread() {
        THROW_ON_ERROR.set(Boolean.TRUE);
    }

    /**
     * Restores report-only behavior on the current thread.
     */
    public static void resetForCurrentThread() {
        THROW_ON_ERROR.remove();
    }

    /**
     * Reports a missing or invalid command line argument, followed by the usage line.
     *
     * @param message what is wrong with the arguments
     */
    public static void usageError(String message) {
        log.error("Invalid arguments: {}", message);
        System.err.println("ERROR: " + message);
        System.err.println(USAGE);
        if (Boolean.TRUE.equals(THROW_ON_ERROR.get())) {
            throw new IllegalStateException(message);
        }
    }

    /**
     * Reports a failed export of {@code dataset}.
     *
     * @param dataset dataset being exported
     * @param cause failure returned by the export
     */
    public static void exportFailed(String dataset, Throwable cause) {
        String message = describe(dataset, cause);
        log.error(message, cause);
        System.err.println("ERROR: " + message);
        if (Boolean.TRUE.equals(THROW_ON_ERROR.get())) {
            throw new IllegalStateException(message, cause);
        }
    }

    /**
     * Builds the one-line description of a failed export.
     *
     * @param dataset dataset being exported
     * @param cause failure returned by the export
     * @return description naming the dataset and the status or the rows written
     */
    static String describe(String dataset, Throwable cause) {
        TableCanceledException canceled =
                ExceptionUtils.throwableOfType(cause, TableCanceledException.class);
        if (canceled != null) {
            return String.format("Export of dataset [%s] canceled after %d rows: %s", dataset,
                    canceled.getRowsWritten(), ExceptionUtils.getRootCauseMessage(canceled));
        }
        int status = ApiException.statusCodeOf(cause);
        if (status != 0) {
            return String.format("Export of dataset [%s] failed with status %d: %s", dataset,
                    status, cause.getMessage());
        }
        return String.format("Export of dataset [%s] failed: %s", dataset, cause.getMessage());
    }
}
