package de.mirkosertic.contactbench.report;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Files written by one export.
 */
public record ExportedFiles(Path json, Path csv, @Nullable Path chartSeries, List<Path> paginationReports) {

    public ExportedFiles {
        paginationReports = List.copyOf(paginationReports);
    }
}
