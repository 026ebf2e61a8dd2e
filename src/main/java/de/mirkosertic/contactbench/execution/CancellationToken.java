package de.mirkosertic.contactbench.execution;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way cancellation flag with an optional monotonic deadline.
 * <p>
 * Once cancelled a token stays cancelled. Closing a token cancels it, so a token opened in a
 * try-with-resources block is released on every exit path. Safe for use from multiple threads.
 */
public final class CancellationToken implements AutoCloseable {

    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final long deadlineNanos;
    private final boolean hasDeadline;

    private CancellationToken(final long deadlineNanos, final boolean hasDeadline) {
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
    }

    /**
     * A token without deadline. It only ends through {@link #cancel()} or {@link #close()}.
     */
    public static CancellationToken create() {
        return new CancellationToken(NO_DEADLINE, false);
    }

    /**
     * A token that expires {@code timeout} from now. A zero or negative timeout yields an
     * already expired token.
     */
    public static CancellationToken withTimeout(final Duration timeout) {
        return new CancellationToken(System.nanoTime() + saturatedNanos(timeout), true);
    }

    /**
     * Requests cancellation.
     *
     * @return true if this call flipped the flag, false if it was already cancelled
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean hasDeadline() {
        return hasDeadline;
    }

    public boolean isExpired() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * Nanoseconds until the deadline, zero once expired, {@link Long#MAX_VALUE} without deadline.
     */
    public long remainingNanos() {
        if (!hasDeadline) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, deadlineNanos - System.nanoTime());
    }

    public Duration remaining() {
        return hasDeadline ? Duration.ofNanos(remainingNanos()) : Duration.ZERO;
    }

    @Override
    public void close() {
        cancel();
    }

    private static long saturatedNanos(final Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            return 0;
        }
        try {
            return timeout.toNanos();
        } catch (final ArithmeticException e) {
            return Long.MAX_VALUE / 2;
        }
    }

    @Override
    public String toString() {
        return "CancellationToken{cancelled=" + isCancelled()
                + (hasDeadline ? ", remainingMs=" + remainingNanos() / 1_000_000 : "") + "}";
    }
}
