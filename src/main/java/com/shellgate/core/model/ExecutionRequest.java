package com.shellgate.core.model;

import java.time.Duration;
import java.util.Optional;

/**
 * One inbound execution call.
 *
 * @param command raw command string, passed to the shell verbatim once approved
 * @param cwd     caller-supplied working directory
 * @param timeout optional wall-clock limit; {@code null} waits for exit unconditionally
 */
public record ExecutionRequest(String command, String cwd, Duration timeout) {

    public ExecutionRequest {
        if (command == null) {
            throw new IllegalArgumentException("command is required");
        }
        if (cwd == null || cwd.isBlank()) {
            throw new IllegalArgumentException("cwd is required");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    public ExecutionRequest(String command, String cwd) {
        this(command, cwd, null);
    }

    /**
     * Builds a request from a timeout expressed in (possibly fractional) seconds.
     */
    public static ExecutionRequest withTimeoutSeconds(String command, String cwd, Double timeoutSeconds) {
        if (timeoutSeconds == null) {
            return new ExecutionRequest(command, cwd, null);
        }
        if (timeoutSeconds.isNaN() || timeoutSeconds.isInfinite() || timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeout must be a positive number of seconds, got " + timeoutSeconds);
        }
        long millis = Math.max(1, Math.round(timeoutSeconds * 1000));
        return new ExecutionRequest(command, cwd, Duration.ofMillis(millis));
    }

    public Optional<Duration> timeoutIfSet() {
        return Optional.ofNullable(timeout);
    }
}
