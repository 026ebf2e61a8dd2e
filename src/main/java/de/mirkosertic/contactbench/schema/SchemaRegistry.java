package de.mirkosertic.contactbench.schema;

import java.util.List;

/**
 * Read-only description of what can be filtered, ordered and searched per entity.
 * The plan builder consults nothing else.
 */
public interface SchemaRegistry {

    EntityDefinition entity(EntityType type);

    /**
     * @throws UnknownFieldException if the path is not declared or not filterable
     */
    FieldDescriptor filterableField(EntityType type, FieldPath path) throws UnknownFieldException;

    /**
     * @throws UnknownFieldException if the path is not declared or not orderable
     */
    FieldDescriptor orderableField(EntityType type, FieldPath path) throws UnknownFieldException;

    List<FieldPath> searchableFields(EntityType type);

    default String defaultOrdering(final EntityType type) {
        return entity(type).defaultOrdering();
    }
}
