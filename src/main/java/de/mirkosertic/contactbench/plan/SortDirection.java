package de.mirkosertic.contactbench.plan;

public enum SortDirection {
    ASC,
    DESC
}
