package de.mirkosertic.contactbench.schema;

import java.util.Locale;

/**
 * The three entities of the contacts schema.
 */
public enum EntityType {

    APP_USER("appuser", "appuser"),
    ADDRESS("address", "address"),
    CUSTOMER_RELATIONSHIP("customer_relationship", "customer_relationship");

    private final String parameterName;
    private final String tableName;

    EntityType(final String parameterName, final String tableName) {
        this.parameterName = parameterName;
        this.tableName = tableName;
    }

    public String parameterName() {
        return parameterName;
    }

    public String tableName() {
        return tableName;
    }

    /**
     * Resolves an entity from its parameter name ({@code appuser}) or constant name ({@code APP_USER}).
     *
     * @throws IllegalArgumentException if no entity matches
     */
    public static EntityType fromName(final String name) {
        final String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final EntityType type : values()) {
            if (type.parameterName.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entity: " + name);
    }
}
