package de.mirkosertic.contactbench.store;

/**
 * A store failed to execute a query.
 */
public class StoreException extends Exception {

    public StoreException(final String message) {
        super(message);
    }

    public StoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
