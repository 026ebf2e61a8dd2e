package de.mirkosertic.contactbench.schema;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Dotted path locating a field, possibly on a related entity ({@code address.city}).
 */
public record FieldPath(String dotted) {

    private static final Pattern SEGMENT = Pattern.compile("[a-z_][a-z0-9_]*");

    public FieldPath {
        if (dotted == null || dotted.isBlank()) {
            throw new IllegalArgumentException("Field path must not be empty");
        }
        for (final String segment : dotted.split("\\.", -1)) {
            if (!SEGMENT.matcher(segment).matches()) {
                throw new IllegalArgumentException("Malformed field path: " + dotted);
            }
        }
    }

    public static FieldPath of(final String dotted) {
        return new FieldPath(dotted);
    }

    /**
     * Builds a path from parameter segments ({@code ["relationship", "points"]}).
     */
    public static FieldPath ofSegments(final List<String> segments) {
        return new FieldPath(String.join(".", segments));
    }

    public List<String> segments() {
        return List.of(dotted.split("\\."));
    }

    /**
     * The relation this path traverses, or an empty string for a field of the entity itself.
     */
    public String relation() {
        final int lastDot = dotted.lastIndexOf('.');
        return lastDot < 0 ? "" : dotted.substring(0, lastDot);
    }

    /**
     * The field name on the (possibly related) entity.
     */
    public String leaf() {
        final int lastDot = dotted.lastIndexOf('.');
        return lastDot < 0 ? dotted : dotted.substring(lastDot + 1);
    }

    @Override
    public String toString() {
        return dotted;
    }
}
