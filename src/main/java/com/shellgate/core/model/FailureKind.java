package com.shellgate.core.model;

public enum FailureKind {
    COMMAND_NOT_ALLOWED(ExecutionStatus.REJECTED),
    DIRECTORY_NOT_ALLOWED(ExecutionStatus.REJECTED),
    INJECTION_PATTERN_DETECTED(ExecutionStatus.REJECTED),
    SPAWN_FAILURE(ExecutionStatus.FAULTED),
    TIMEOUT_EXCEEDED(ExecutionStatus.TIMED_OUT),
    INTERNAL_FAULT(ExecutionStatus.FAULTED),
    /** The process ran to completion with a non-zero exit code. */
    NON_ZERO_EXIT(ExecutionStatus.COMPLETED);

    private final ExecutionStatus status;

    FailureKind(ExecutionStatus status) {
        this.status = status;
    }

    public ExecutionStatus status() {
        return status;
    }
}
