package de.mirkosertic.contactbench.plan;

import de.mirkosertic.contactbench.schema.FieldPath;

import java.util.List;

/**
 * Free-text search. A row matches when every term occurs, ignoring case, as a substring of at
 * least one of the fields.
 */
public record SearchSpec(List<String> terms, List<FieldPath> fields) {

    public SearchSpec {
        terms = List.copyOf(terms);
        fields = List.copyOf(fields);
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("A search needs at least one term");
        }
    }
}
