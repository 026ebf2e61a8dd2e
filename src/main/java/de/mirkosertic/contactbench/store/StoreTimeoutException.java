package de.mirkosertic.contactbench.store;

import java.time.Duration;

/**
 * The store's own statement timeout fired before the query completed.
 */
public class StoreTimeoutException extends StoreException {

    private final Duration timeout;

    public StoreTimeoutException(final Duration timeout) {
        super("Statement exceeded timeout of " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public StoreTimeoutException(final Duration timeout, final Throwable cause) {
        super("Statement exceeded timeout of " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
