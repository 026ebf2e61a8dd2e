package de.mirkosertic.contactbench.benchmark;

import de.mirkosertic.contactbench.schema.EntityType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A named, repeatable query.
 *
 * @param name         unique name, used as key in reports
 * @param entity       queried entity
 * @param params       raw parameter template in request syntax; the harness sets {@code page} per variant
 * @param repetitions  how often each variant runs
 * @param paginated    false fetches every matching row without a count
 * @param pageVariants pages to visit per repetition; empty runs the template's own page
 */
public record BenchmarkScenario(
        String name,
        EntityType entity,
        Map<String, String> params,
        int repetitions,
        boolean paginated,
        List<PageVariant> pageVariants
) {

    public BenchmarkScenario {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Scenario name must not be empty");
        }
        if (repetitions < 1) {
            throw new IllegalArgumentException("Scenario '" + name + "' needs at least one repetition");
        }
        if (!paginated && !pageVariants.isEmpty()) {
            throw new IllegalArgumentException("Scenario '" + name + "' has page variants but is not paginated");
        }
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        pageVariants = List.copyOf(pageVariants);
    }

    /**
     * Repetitions to run, where a positive {@code repetitionOverride} replaces the scenario's own count.
     */
    public int effectiveRepetitions(final int repetitionOverride) {
        return repetitionOverride > 0 ? repetitionOverride : repetitions;
    }

    /**
     * Number of runs one pass over this scenario produces.
     */
    public int plannedRuns(final int repetitionOverride) {
        return effectiveRepetitions(repetitionOverride) * Math.max(1, pageVariants.size());
    }
}
