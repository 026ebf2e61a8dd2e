package de.mirkosertic.contactbench.schema;

/**
 * A field path that the entity does not declare for the requested capability.
 */
public class UnknownFieldException extends InvalidQueryException {

    private final EntityType entity;

    public UnknownFieldException(final EntityType entity, final String field, final String capability) {
        super(field, "Unknown " + capability + " field '" + field + "' for entity " + entity.parameterName());
        this.entity = entity;
    }

    public EntityType getEntity() {
        return entity;
    }
}
