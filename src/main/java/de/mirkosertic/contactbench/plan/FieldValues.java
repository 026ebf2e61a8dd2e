package de.mirkosertic.contactbench.plan;

import de.mirkosertic.contactbench.schema.FieldDescriptor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Coerces raw parameter strings into the Java type of a schema field.
 */
public final class FieldValues {

    private FieldValues() {
    }

    /**
     * @throws ValidationException if the value is malformed for the field type or not one of its choices
     */
    public static Comparable<?> coerce(final FieldDescriptor field, final String raw) throws ValidationException {
        final String value = raw.trim();
        final String name = field.path().dotted();
        return switch (field.type()) {
            case STRING -> {
                if (!field.choices().isEmpty() && !field.choices().contains(value)) {
                    throw new ValidationException(name,
                            "Select a valid choice. '" + value + "' is not one of " + field.choices());
                }
                yield value;
            }
            case INTEGER -> {
                try {
                    yield Long.parseLong(value);
                } catch (final NumberFormatException e) {
                    throw new ValidationException(name, "Enter a whole number, got '" + value + "'");
                }
            }
            case DATE -> {
                try {
                    yield LocalDate.parse(value);
                } catch (final DateTimeParseException e) {
                    throw new ValidationException(name, "Enter a date as yyyy-MM-dd, got '" + value + "'");
                }
            }
            case TIMESTAMP -> {
                try {
                    yield parseTimestamp(value);
                } catch (final IllegalArgumentException e) {
                    throw new ValidationException(name, e.getMessage());
                }
            }
        };
    }

    /**
     * Parses an ISO-8601 timestamp. Accepts an instant ({@code 2024-06-15T14:30:00Z}), a local
     * date-time ({@code 2024-06-15T14:30:00}, taken as UTC) or a date ({@code 2024-06-15}, start of
     * day UTC).
     *
     * @throws IllegalArgumentException if none of the formats match
     */
    public static Instant parseTimestamp(final String value) {
        try {
            if (value.indexOf('T') < 0) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            final TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("Cannot parse date '" + value
                    + "'. Use ISO-8601: '2024-01-01', '2024-01-15T10:30:00' or '2024-06-15T14:30:00Z'", e);
        }
    }
}
