package de.mirkosertic.contactbench.plan;

import java.util.Set;

/**
 * Names of the raw request parameters that are not filters.
 */
public final class QueryParameters {

    public static final String ORDERING = "ordering";
    public static final String SEARCH = "search";
    public static final String PAGE = "page";
    public static final String PAGE_SIZE = "page_size";
    public static final String LIMIT = "limit";
    public static final String OFFSET = "offset";
    public static final String CANCEL = "_cancel";

    /** Separates path segments and the operator suffix in filter keys. */
    public static final String LOOKUP_SEPARATOR = "__";

    public static final Set<String> RESERVED = Set.of(ORDERING, SEARCH, PAGE, PAGE_SIZE, LIMIT, OFFSET, CANCEL);

    private QueryParameters() {
    }

    public static boolean isReserved(final String name) {
        return RESERVED.contains(name);
    }
}
