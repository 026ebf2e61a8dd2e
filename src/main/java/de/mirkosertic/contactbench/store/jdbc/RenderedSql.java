package de.mirkosertic.contactbench.store.jdbc;

import java.util.List;

/**
 * SQL text with positional parameters in binding order.
 */
public record RenderedSql(String sql, List<Object> parameters) {

    public RenderedSql {
        parameters = List.copyOf(parameters);
    }
}
