package de.mirkosertic.contactbench.schema;

/**
 * Value types a schema field can declare.
 * <p>
 * {@link #INTEGER} values are carried as {@link Long}, {@link #DATE} values as
 * {@link java.time.LocalDate} and {@link #TIMESTAMP} values as {@link java.time.Instant}.
 */
public enum FieldType {
    STRING,
    INTEGER,
    DATE,
    TIMESTAMP;

    public boolean isComparable() {
        return this != STRING;
    }
}
