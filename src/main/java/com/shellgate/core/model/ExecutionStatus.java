package com.shellgate.core.model;

/**
 * Terminal states of a single execution request.
 */
public enum ExecutionStatus {
    /** Denied by one of the validators; nothing was spawned. */
    REJECTED,
    /** The process ran and exited on its own. */
    COMPLETED,
    /** The deadline expired and the process group was terminated. */
    TIMED_OUT,
    /** The process could not be spawned or managed. */
    FAULTED
}
