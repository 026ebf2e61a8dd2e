package de.mirkosertic.contactbench.plan;

import de.mirkosertic.contactbench.schema.FieldPath;
import de.mirkosertic.contactbench.schema.FieldType;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of sort keys. Each term breaks ties left by the terms before it.
 */
public record OrderSpec(List<Term> terms) {

    public record Term(FieldPath path, FieldType type, SortDirection direction) {

        public String toParameter() {
            return (direction == SortDirection.DESC ? "-" : "") + path.dotted();
        }
    }

    public OrderSpec {
        terms = List.copyOf(terms);
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    /**
     * Renders the spec back into {@code ordering} parameter syntax.
     */
    public String toParameter() {
        return terms.stream().map(Term::toParameter).collect(Collectors.joining(","));
    }
}
