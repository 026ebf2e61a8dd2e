package de.mirkosertic.contactbench.plan;

/**
 * Inclusive bounds of a {@code range} filter, already coerced to the field type.
 */
public record ValueRange(Comparable<?> lower, Comparable<?> upper) {
}
