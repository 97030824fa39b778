package com.shellgate.core.security;

import com.shellgate.core.model.FailureKind;

/**
 * Verdict of a single validator.
 *
 * @param allowed whether the request may proceed
 * @param reason  denial kind, {@code null} when allowed
 * @param message remediation text telling the caller what was rejected and what is allowed
 */
public record ValidationDecision(boolean allowed, FailureKind reason, String message) {

    private static final ValidationDecision ALLOW = new ValidationDecision(true, null, "");

    public static ValidationDecision allow() {
        return ALLOW;
    }

    public static ValidationDecision deny(FailureKind reason, String message) {
        return new ValidationDecision(false, reason, message);
    }

    public boolean denied() {
        return !allowed;
    }
}
