package de.mirkosertic.contactbench.schema;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static de.mirkosertic.contactbench.schema.EntityDefinition.Capability.ORDER;
import static de.mirkosertic.contactbench.schema.EntityDefinition.Capability.SEARCH;
import static de.mirkosertic.contactbench.schema.FieldType.DATE;
import static de.mirkosertic.contactbench.schema.FieldType.INTEGER;
import static de.mirkosertic.contactbench.schema.FieldType.STRING;
import static de.mirkosertic.contactbench.schema.FieldType.TIMESTAMP;
import static de.mirkosertic.contactbench.schema.Operator.COMPARISON;
import static de.mirkosertic.contactbench.schema.Operator.EXACT;
import static de.mirkosertic.contactbench.schema.Operator.ICONTAINS;

/**
 * The contacts schema: app users with an optional address and an optional customer relationship.
 * <p>
 * AppUser rows see their address under {@code address.*} and their relationship under
 * {@code relationship.*}. Built once at class initialization and never modified afterwards.
 */
public final class ContactSchemaRegistry implements SchemaRegistry {

    public static final List<String> GENDER_CHOICES = List.of("M", "F", "O");

    public static final ContactSchemaRegistry INSTANCE = new ContactSchemaRegistry();

    private final Map<EntityType, EntityDefinition> entities;

    private ContactSchemaRegistry() {
        final Map<EntityType, EntityDefinition> definitions = new EnumMap<>(EntityType.class);
        definitions.put(EntityType.APP_USER, appUser());
        definitions.put(EntityType.ADDRESS, address());
        definitions.put(EntityType.CUSTOMER_RELATIONSHIP, customerRelationship());
        this.entities = Map.copyOf(definitions);
    }

    private static EntityDefinition appUser() {
        return EntityDefinition.builder(EntityType.APP_USER)
                .field("id", INTEGER, EXACT, ORDER)
                .field("first_name", STRING, ICONTAINS, ORDER, SEARCH)
                .field("last_name", STRING, ICONTAINS, ORDER, SEARCH)
                .field("gender", STRING, GENDER_CHOICES, EXACT, ORDER)
                .field("customer_id", STRING, ICONTAINS, ORDER, SEARCH)
                .field("phone_number", STRING, EXACT, ICONTAINS, ORDER, SEARCH)
                .field("created", TIMESTAMP, COMPARISON, ORDER)
                .field("birthday", DATE, EXACT, Operator.GTE, Operator.LTE, Operator.RANGE, ORDER)
                .field("last_updated", TIMESTAMP, COMPARISON, ORDER)
                .field("address.id", INTEGER, EXACT)
                .field("address.street", STRING, EXACT, ICONTAINS, SEARCH)
                .field("address.street_number", STRING)
                .field("address.city", STRING, EXACT, ICONTAINS, ORDER, SEARCH)
                .field("address.city_code", STRING, EXACT, ICONTAINS, ORDER)
                .field("address.country", STRING, EXACT, ICONTAINS, ORDER, SEARCH)
                .field("relationship.points", INTEGER, COMPARISON, ORDER)
                .field("relationship.created", TIMESTAMP, COMPARISON, ORDER)
                .field("relationship.last_activity", TIMESTAMP, COMPARISON, ORDER)
                .defaultOrdering("-created")
                .build();
    }

    private static EntityDefinition address() {
        return EntityDefinition.builder(EntityType.ADDRESS)
                .field("id", INTEGER, EXACT, ORDER)
                .field("street", STRING, EXACT, ICONTAINS, SEARCH)
                .field("street_number", STRING, EXACT)
                .field("city_code", STRING, EXACT, ICONTAINS, ORDER)
                .field("city", STRING, EXACT, ICONTAINS, ORDER, SEARCH)
                .field("country", STRING, EXACT, ICONTAINS, ORDER, SEARCH)
                .defaultOrdering("id")
                .build();
    }

    private static EntityDefinition customerRelationship() {
        return EntityDefinition.builder(EntityType.CUSTOMER_RELATIONSHIP)
                .field("id", INTEGER, EXACT, ORDER)
                .field("points", INTEGER, COMPARISON, ORDER)
                .field("created", TIMESTAMP, COMPARISON, ORDER)
                .field("last_activity", TIMESTAMP, COMPARISON, ORDER)
                .field("appuser.id", INTEGER, EXACT)
                .field("appuser.customer_id", STRING, EXACT, ICONTAINS, SEARCH)
                .defaultOrdering("id")
                .build();
    }

    @Override
    public EntityDefinition entity(final EntityType type) {
        return entities.get(type);
    }

    @Override
    public FieldDescriptor filterableField(final EntityType type, final FieldPath path) throws UnknownFieldException {
        final FieldDescriptor descriptor = entity(type).field(path);
        if (descriptor == null || !descriptor.isFilterable()) {
            throw new UnknownFieldException(type, path.dotted(), "filterable");
        }
        return descriptor;
    }

    @Override
    public FieldDescriptor orderableField(final EntityType type, final FieldPath path) throws UnknownFieldException {
        final FieldDescriptor descriptor = entity(type).field(path);
        if (descriptor == null || !descriptor.orderable()) {
            throw new UnknownFieldException(type, path.dotted(), "orderable");
        }
        return descriptor;
    }

    @Override
    public List<FieldPath> searchableFields(final EntityType type) {
        return entity(type).searchableFields();
    }
}
