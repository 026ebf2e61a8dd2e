package de.mirkosertic.contactbench.plan;

import de.mirkosertic.contactbench.schema.EntityType;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Validated, immutable description of one query. Filters are AND-combined.
 */
public record QueryPlan(
        EntityType entity,
        List<FilterClause> filters,
        OrderSpec order,
        @Nullable SearchSpec search,
        Pagination pagination
) {

    public QueryPlan {
        filters = List.copyOf(filters);
    }

    /**
     * Same query with another row window.
     */
    public QueryPlan withPagination(final Pagination other) {
        return new QueryPlan(entity, filters, order, search, other);
    }
}
