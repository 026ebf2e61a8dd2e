package de.mirkosertic.contactbench.execution;

/**
 * Terminal state of one execution.
 */
public enum ExecutionStatus {
    SUCCESS,
    CANCELLED,
    TIMED_OUT,
    EXECUTION_FAILED
}
