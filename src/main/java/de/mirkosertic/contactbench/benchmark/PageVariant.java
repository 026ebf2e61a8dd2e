package de.mirkosertic.contactbench.benchmark;

import java.util.Locale;
import java.util.Random;

/**
 * Which page of a paginated scenario a run fetches.
 */
public enum PageVariant {

    FIRST,
    MIDDLE,
    LAST,
    RANDOM;

    /**
     * Resolves the one-based page number for a result set with {@code lastPage} pages.
     *
     * @param lastPage number of pages, values below one are treated as one
     * @param random   source for {@link #RANDOM}, uniform over {@code [1, lastPage]}
     */
    public long resolve(final long lastPage, final Random random) {
        final long pages = Math.max(1, lastPage);
        return switch (this) {
            case FIRST -> 1;
            case MIDDLE -> (pages + 1) / 2;
            case LAST -> pages;
            case RANDOM -> 1 + random.nextLong(pages);
        };
    }

    public static PageVariant fromName(final String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
