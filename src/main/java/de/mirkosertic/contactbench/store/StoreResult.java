package de.mirkosertic.contactbench.store;

import java.util.List;
import java.util.Map;

/**
 * Rows of one fetched page plus the total number of rows matching the plan. Each row maps a
 * dotted field path to its value; fields without a value are absent.
 */
public record StoreResult(List<Map<String, Object>> rows, long totalCount) {

    public StoreResult {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
