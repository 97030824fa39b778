package com.shellgate.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Outcome of one execution request. Serialized as
 * {@code {success, output, error?, exitCode?, truncated, command}}.
 *
 * @param command   the caller's original command, echoed verbatim
 * @param status    terminal state reached
 * @param failure   why the request did not succeed, {@code null} on success
 * @param success   {@code true} only for a completed run with exit code 0
 * @param output    combined stdout/stderr, capped at the policy's output size
 * @param error     denial or fault description, or stderr of a failed run
 * @param exitCode  real exit status; {@code null} if the process never started or was killed
 * @param truncated whether output was discarded to respect the cap
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "output", "error", "exitCode", "truncated", "command"})
public record ExecutionResult(
        String command,
        @JsonIgnore ExecutionStatus status,
        @JsonIgnore FailureKind failure,
        boolean success,
        String output,
        String error,
        Integer exitCode,
        boolean truncated
) {

    public static ExecutionResult rejected(String command, FailureKind kind, String message) {
        return new ExecutionResult(command, ExecutionStatus.REJECTED, kind, false, "", message, null, false);
    }

    public static ExecutionResult completed(String command, int exitCode, String output,
                                            String stderr, boolean truncated) {
        if (exitCode == 0) {
            return new ExecutionResult(command, ExecutionStatus.COMPLETED, null, true, output, null, 0, truncated);
        }
        String error = stderr == null || stderr.isEmpty() ? null : stderr;
        return new ExecutionResult(command, ExecutionStatus.COMPLETED, FailureKind.NON_ZERO_EXIT,
                false, output, error, exitCode, truncated);
    }

    public static ExecutionResult timedOut(String command, String output, String message, boolean truncated) {
        return new ExecutionResult(command, ExecutionStatus.TIMED_OUT, FailureKind.TIMEOUT_EXCEEDED,
                false, output, message, null, truncated);
    }

    public static ExecutionResult faulted(String command, FailureKind kind, String message, String output) {
        return new ExecutionResult(command, ExecutionStatus.FAULTED, kind, false,
                output == null ? "" : output, message, null, false);
    }
}
