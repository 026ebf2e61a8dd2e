package de.mirkosertic.contactbench.store.lucene;

import de.mirkosertic.contactbench.model.Address;
import de.mirkosertic.contactbench.model.AppUser;
import de.mirkosertic.contactbench.model.CustomerRelationship;
import de.mirkosertic.contactbench.schema.EntityDefinition;
import de.mirkosertic.contactbench.schema.EntityType;
import de.mirkosertic.contactbench.schema.FieldDescriptor;
import de.mirkosertic.contactbench.schema.SchemaRegistry;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes contacts into the index, one document per entity row. AppUser documents carry the
 * fields of their address and relationship so filters and orderings across them need no join.
 * Re-adding a row with the same id replaces the previous document.
 */
public class ContactIndexer {

    private final IndexWriter writer;
    private final SchemaRegistry schema;

    public ContactIndexer(final IndexWriter writer, final SchemaRegistry schema) {
        this.writer = writer;
        this.schema = schema;
    }

    public void addAddress(final Address address) throws IOException {
        final Map<String, Object> values = new HashMap<>();
        putAddress(values, "", address);
        write(EntityType.ADDRESS, address.id(), values);
    }

    /**
     * Indexes an app user together with its optional relationship. The user's address must be
     * added separately through {@link #addAddress(Address)} to be queryable as an address row.
     */
    public void addContact(final AppUser user, final @Nullable CustomerRelationship relationship) throws IOException {
        if (relationship != null && relationship.appUserId() != user.id()) {
            throw new IllegalArgumentException("Relationship " + relationship.id() + " belongs to user "
                    + relationship.appUserId() + ", not " + user.id());
        }

        final Map<String, Object> values = new HashMap<>();
        values.put("id", user.id());
        values.put("first_name", user.firstName());
        values.put("last_name", user.lastName());
        values.put("gender", user.gender());
        values.put("customer_id", user.customerId());
        values.put("phone_number", user.phoneNumber());
        values.put("created", user.created());
        values.put("birthday", user.birthday());
        values.put("last_updated", user.lastUpdated());
        if (user.address() != null) {
            putAddress(values, "address.", user.address());
        }
        if (relationship != null) {
            putRelationship(values, "relationship.", relationship);
        }
        write(EntityType.APP_USER, user.id(), values);

        if (relationship != null) {
            final Map<String, Object> relationshipValues = new HashMap<>();
            putRelationship(relationshipValues, "", relationship);
            relationshipValues.put("appuser.id", user.id());
            relationshipValues.put("appuser.customer_id", user.customerId());
            write(EntityType.CUSTOMER_RELATIONSHIP, relationship.id(), relationshipValues);
        }
    }

    private static void putAddress(final Map<String, Object> values, final String prefix, final Address address) {
        values.put(prefix + "id", address.id());
        values.put(prefix + "street", address.street());
        values.put(prefix + "street_number", address.streetNumber());
        values.put(prefix + "city_code", address.cityCode());
        values.put(prefix + "city", address.city());
        values.put(prefix + "country", address.country());
    }

    private static void putRelationship(final Map<String, Object> values, final String prefix,
                                        final CustomerRelationship relationship) {
        values.put(prefix + "id", relationship.id());
        values.put(prefix + "points", relationship.points());
        values.put(prefix + "created", relationship.created());
        values.put(prefix + "last_activity", relationship.lastActivity());
    }

    private void write(final EntityType type, final long id, final Map<String, Object> values) throws IOException {
        final EntityDefinition entity = schema.entity(type);
        final String key = LuceneFields.key(type.parameterName(), id);

        final Document doc = new Document();
        doc.add(new StringField(LuceneFields.ENTITY, type.parameterName(), Field.Store.NO));
        doc.add(new StringField(LuceneFields.KEY, key, Field.Store.NO));
        for (final FieldDescriptor field : entity.fields()) {
            LuceneFields.add(doc, field, values.get(field.path().dotted()));
        }
        writer.updateDocument(new Term(LuceneFields.KEY, key), doc);
    }
}
