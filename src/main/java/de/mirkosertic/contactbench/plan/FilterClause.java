package de.mirkosertic.contactbench.plan;

import de.mirkosertic.contactbench.schema.FieldPath;
import de.mirkosertic.contactbench.schema.FieldType;
import de.mirkosertic.contactbench.schema.Operator;

/**
 * One validated filter. {@code value} has the Java type matching {@code type}; for
 * {@link Operator#RANGE} it is a {@link ValueRange}.
 */
public record FilterClause(FieldPath path, FieldType type, Operator operator, Object value) {

    public FilterClause {
        if (operator == Operator.RANGE && !(value instanceof ValueRange)) {
            throw new IllegalArgumentException("range filter requires a ValueRange value");
        }
    }
}
