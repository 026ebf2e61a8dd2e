package de.mirkosertic.contactbench.schema;

/**
 * Raised while turning raw request parameters into a query plan. Always surfaces before any
 * store access happens.
 */
public class InvalidQueryException extends Exception {

    private final String field;

    public InvalidQueryException(final String field, final String message) {
        super(message);
        this.field = field;
    }

    /**
     * The parameter or field path the problem was found at.
     */
    public String getField() {
        return field;
    }
}
