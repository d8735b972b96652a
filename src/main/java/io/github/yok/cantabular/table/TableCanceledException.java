package io.github.yok.cantabular.table;

import lombok.Getter;

/**
 * Thrown when a {@link CancellationToken} is observed as cancelled during iteration or rendering.
 *
 * <p>
 * The underlying cancellation cause is available through {@link #getCause()}.
 * {@link #getRowsWritten()} reports how many CSV rows (header included) had been written when the
 * cancellation was observed; it is {@code 0} for plain iteration.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class TableCanceledException extends TableException {

    private static final long serialVersionUID = 1L;

    private final long rowsWritten;

    public TableCanceledException(Throwable cause, long rowsWritten) {
        super("context is done: " + (cause == null ? "canceled" : cause.getMessage()), cause);
        this.rowsWritten = rowsWritten;
    }
}
