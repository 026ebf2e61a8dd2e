package de.mirkosertic.contactbench.plan;

import de.mirkosertic.contactbench.schema.InvalidQueryException;

/**
 * A parameter that names a known field but carries an unusable operator or value.
 */
public class ValidationException extends InvalidQueryException {

    private final String reason;

    public ValidationException(final String field, final String reason) {
        super(field, "Invalid value for '" + field + "': " + reason);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
