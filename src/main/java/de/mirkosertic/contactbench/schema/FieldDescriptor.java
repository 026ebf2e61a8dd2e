package de.mirkosertic.contactbench.schema;

import java.util.Set;

/**
 * Declared capabilities of one field of an entity.
 *
 * @param path       the field path relative to the entity
 * @param type       the value type
 * @param operators  filter operators allowed on this field; empty if the field is not filterable
 * @param orderable  whether the field may appear in an ordering
 * @param searchable whether the field takes part in the free-text search
 * @param choices    allowed values for exact matches; empty means unrestricted
 */
public record FieldDescriptor(
        FieldPath path,
        FieldType type,
        Set<Operator> operators,
        boolean orderable,
        boolean searchable,
        Set<String> choices
) {

    public FieldDescriptor {
        operators = Set.copyOf(operators);
        choices = Set.copyOf(choices);
        if (searchable && type != FieldType.STRING) {
            throw new IllegalArgumentException("Only string fields can be searchable: " + path);
        }
        if (operators.contains(Operator.ICONTAINS) && type != FieldType.STRING) {
            throw new IllegalArgumentException("icontains requires a string field: " + path);
        }
    }

    public boolean isFilterable() {
        return !operators.isEmpty();
    }

    public boolean supports(final Operator operator) {
        return operators.contains(operator);
    }
}
