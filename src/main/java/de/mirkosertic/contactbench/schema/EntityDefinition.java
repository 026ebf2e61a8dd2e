package de.mirkosertic.contactbench.schema;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * All declared fields of one entity, in declaration order, plus its default ordering.
 */
public final class EntityDefinition {

    /**
     * Non-operator capability markers accepted by {@link Builder#field}.
     */
    public enum Capability {
        ORDER,
        SEARCH
    }

    private final EntityType type;
    private final Map<FieldPath, FieldDescriptor> fields;
    private final List<FieldDescriptor> orderedFields;
    private final String defaultOrdering;

    private EntityDefinition(final EntityType type, final Map<FieldPath, FieldDescriptor> fields,
                             final String defaultOrdering) {
        this.type = type;
        this.fields = Map.copyOf(fields);
        this.orderedFields = List.copyOf(fields.values());
        this.defaultOrdering = defaultOrdering;
    }

    public static Builder builder(final EntityType type) {
        return new Builder(type);
    }

    public EntityType type() {
        return type;
    }

    /**
     * Returns the descriptor for a path, or null if the entity does not declare it.
     */
    public FieldDescriptor field(final FieldPath path) {
        return fields.get(path);
    }

    /**
     * All fields in declaration order.
     */
    public List<FieldDescriptor> fields() {
        return orderedFields;
    }

    public List<FieldPath> searchableFields() {
        return orderedFields.stream()
                .filter(FieldDescriptor::searchable)
                .map(FieldDescriptor::path)
                .toList();
    }

    /**
     * Ordering used when a request does not supply one, in parameter syntax ({@code -created}).
     */
    public String defaultOrdering() {
        return defaultOrdering;
    }

    public static final class Builder {

        private final EntityType type;
        private final Map<FieldPath, FieldDescriptor> fields = new LinkedHashMap<>();
        private String defaultOrdering = "id";

        private Builder(final EntityType type) {
            this.type = type;
        }

        /**
         * Declares a field. {@code capabilities} may contain single {@link Operator}s, sets of
         * operators such as {@link Operator#COMPARISON}, and the {@link Capability} markers.
         */
        public Builder field(final String path, final FieldType fieldType, final Object... capabilities) {
            return field(path, fieldType, Set.of(), capabilities);
        }

        public Builder field(final String path, final FieldType fieldType, final Collection<String> choices,
                             final Object... capabilities) {
            final Set<Operator> operators = EnumSet.noneOf(Operator.class);
            boolean orderable = false;
            boolean searchable = false;
            for (final Object capability : capabilities) {
                if (capability instanceof Operator operator) {
                    operators.add(operator);
                } else if (capability instanceof Set<?> set) {
                    for (final Object element : set) {
                        operators.add((Operator) element);
                    }
                } else if (capability == Capability.ORDER) {
                    orderable = true;
                } else if (capability == Capability.SEARCH) {
                    searchable = true;
                } else {
                    throw new IllegalArgumentException("Unsupported capability: " + capability);
                }
            }
            final FieldPath fieldPath = FieldPath.of(path);
            if (fields.containsKey(fieldPath)) {
                throw new IllegalStateException("Duplicate field " + path + " on " + type);
            }
            fields.put(fieldPath, new FieldDescriptor(fieldPath, fieldType, operators, orderable, searchable,
                    Set.copyOf(choices)));
            return this;
        }

        public Builder defaultOrdering(final String ordering) {
            this.defaultOrdering = ordering;
            return this;
        }

        public EntityDefinition build() {
            return new EntityDefinition(type, fields, defaultOrdering);
        }
    }
}
