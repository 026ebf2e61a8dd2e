package de.mirkosertic.contactbench.store.lucene;

import de.mirkosertic.contactbench.schema.EntityDefinition;
import de.mirkosertic.contactbench.schema.FieldDescriptor;
import de.mirkosertic.contactbench.schema.FieldPath;
import de.mirkosertic.contactbench.schema.FieldType;
import de.mirkosertic.contactbench.schema.Operator;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.SortedDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.util.BytesRef;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Document layout shared by the indexer and the query translator.
 * <p>
 * Every schema field is indexed under its dotted path. String fields are a stored
 * {@link StringField}, plus a lower-cased copy under {@code <path>#lc} when they take part in
 * case-insensitive matching, plus sorted doc values when orderable. Integer, date and timestamp
 * fields are a {@link LongPoint} with a stored copy and numeric doc values; dates are stored as
 * epoch days and timestamps as epoch milliseconds.
 */
final class LuceneFields {

    static final String ENTITY = "_entity";
    static final String KEY = "_key";

    private static final String LOWERCASE_SUFFIX = "#lc";

    private LuceneFields() {
    }

    static String lowercaseField(final FieldPath path) {
        return path.dotted() + LOWERCASE_SUFFIX;
    }

    static String lowercase(final String value) {
        return value.toLowerCase(Locale.ROOT);
    }

    static String key(final String entity, final long id) {
        return entity + ":" + id;
    }

    static long toLong(final FieldType type, final Object value) {
        return switch (type) {
            case INTEGER -> ((Number) value).longValue();
            case DATE -> ((LocalDate) value).toEpochDay();
            case TIMESTAMP -> ((Instant) value).toEpochMilli();
            case STRING -> throw new IllegalArgumentException("String values have no numeric form");
        };
    }

    static Object fromLong(final FieldType type, final long value) {
        return switch (type) {
            case INTEGER -> value;
            case DATE -> LocalDate.ofEpochDay(value);
            case TIMESTAMP -> Instant.ofEpochMilli(value);
            case STRING -> throw new IllegalArgumentException("String values have no numeric form");
        };
    }

    static void add(final Document doc, final FieldDescriptor field, final @Nullable Object value) {
        if (value == null) {
            return;
        }
        final String name = field.path().dotted();
        if (field.type() == FieldType.STRING) {
            final String text = value.toString();
            doc.add(new StringField(name, text, Field.Store.YES));
            if (field.searchable() || field.supports(Operator.ICONTAINS)) {
                doc.add(new StringField(lowercaseField(field.path()), lowercase(text), Field.Store.NO));
            }
            if (field.orderable()) {
                doc.add(new SortedDocValuesField(name, new BytesRef(text)));
            }
            return;
        }
        final long numeric = toLong(field.type(), value);
        doc.add(new LongPoint(name, numeric));
        doc.add(new StoredField(name, numeric));
        if (field.orderable()) {
            doc.add(new NumericDocValuesField(name, numeric));
        }
    }

    /**
     * Reads the stored fields of a document back into a row keyed by dotted path.
     */
    static Map<String, Object> read(final Document doc, final EntityDefinition entity) {
        final Map<String, Object> row = new LinkedHashMap<>();
        for (final FieldDescriptor field : entity.fields()) {
            final IndexableField stored = doc.getField(field.path().dotted());
            if (stored == null) {
                continue;
            }
            if (field.type() == FieldType.STRING) {
                row.put(field.path().dotted(), stored.stringValue());
            } else {
                row.put(field.path().dotted(), fromLong(field.type(), stored.numericValue().longValue()));
            }
        }
        return row;
    }
}
