package io.github.yok.cantabular.table;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal polled by {@link TableIterator#next()} and by the CSV writers
 * before each output row.
 *
 * <p>
 * A token is cancelled either explicitly through {@link #cancel(Throwable)}, possibly from another
 * thread, or implicitly once its deadline has passed. The token never interrupts anything by
 * itself.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CancellationToken {

    /**
     * Token that is never cancelled.
     */
    public static final CancellationToken NONE =
            new CancellationToken(null, Clock.systemUTC(), false);

    private final AtomicReference<Throwable> cause = new AtomicReference<>();
    private final Instant deadline;
    private final Clock clock;
    private final boolean cancellable;

    private CancellationToken(Instant deadline, Clock clock, boolean cancellable) {
        this.deadline = deadline;
        this.clock = clock;
        this.cancellable = cancellable;
    }

    /**
     * Creates a token without a deadline.
     *
     * @return new token
     */
    public static CancellationToken create() {
        return new CancellationToken(null, Clock.systemUTC(), true);
    }

    /**
     * Creates a token that becomes cancelled once {@code clock} reaches {@code deadline}.
     *
     * @param deadline instant after which the token reports cancellation
     * @param clock clock used to read the current time
     * @return new token
     */
    public static CancellationToken withDeadline(Instant deadline, Clock clock) {
        return new CancellationToken(deadline, clock, true);
    }

    /**
     * Creates a token that becomes cancelled after {@code timeout} from now.
     *
     * @param timeout time budget
     * @return new token
     */
    public static CancellationToken withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new CancellationToken(clock.instant().plus(timeout), clock, true);
    }

    /**
     * Cancels the token with the given cause. Only the first cause is kept.
     *
     * @param reason cancellation cause
     * @return {@code true} if this call cancelled the token
     */
    public boolean cancel(Throwable reason) {
        if (!cancellable) {
            throw new UnsupportedOperationException("the NONE token cannot be cancelled");
        }
        return cause.compareAndSet(null,
                reason == null ? new CancellationException("canceled") : reason);
    }

    public boolean cancel() {
        return cancel(new CancellationException("canceled"));
    }

    public boolean isCancelled() {
        return cause() != null;
    }

    /**
     * Returns why the token is cancelled, or {@code null} if it is not.
     *
     * @return explicit cancellation cause, a {@link TimeoutException} once the deadline has passed,
     *         or {@code null}
     */
    public Throwable cause() {
        Throwable explicit = cause.get();
        if (explicit != null) {
            return explicit;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            return new TimeoutException("deadline exceeded");
        }
        return null;
    }

    /**
     * Throws if the token is cancelled.
     *
     * @param rowsWritten rows already produced by the caller, reported in the exception
     * @throws TableCanceledException if the token is cancelled
     */
    public void throwIfCancelled(long rowsWritten) throws TableCanceledException {
        Throwable reason = cause();
        if (reason != null) {
            throw new TableCanceledException(reason, rowsWritten);
        }
    }
}
