package com.shellgate.core.security;

import com.shellgate.core.model.FailureKind;
import com.shellgate.core.policy.PolicySnapshot;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Rejects shell metacharacters that would let a caller chain, substitute or
 * redirect past the whitelisted base command.
 * <p>
 * Only active when the policy enables strict validation. With it disabled,
 * pipes and redirection reach the shell untouched.
 * <p>
 * The scan is a fixed substring list, not a parser. A lone {@code &} is not on
 * it, so {@code ls & rm x} passes and backgrounds {@code ls} before running
 * {@code rm}; likewise {@code $VAR} expansion, globbing and quoting are left to
 * the shell. Policies that must rule these out should whitelist only commands
 * that are harmless with arbitrary arguments.
 */
@Service
public class InjectionScanner {

    /** Multi-character sequences precede their single-character prefixes. */
    static final List<String> PATTERNS = List.of(";", "&&", "||", "`", "$(", "|", ">", "<", "\n");

    public ValidationDecision scan(PolicySnapshot policy, String command) {
        if (!policy.strictValidation()) {
            return ValidationDecision.allow();
        }
        for (String pattern : PATTERNS) {
            if (command.contains(pattern)) {
                return ValidationDecision.deny(FailureKind.INJECTION_PATTERN_DETECTED,
                        "Potential command injection detected: '%s'. Strict validation forbids %s; run a single command without chaining, substitution or redirection."
                                .formatted(display(pattern), forbiddenList()));
            }
        }
        return ValidationDecision.allow();
    }

    private static String forbiddenList() {
        var names = new StringBuilder();
        for (String pattern : PATTERNS) {
            if (names.length() > 0) {
                names.append(' ');
            }
            names.append(display(pattern));
        }
        return names.toString();
    }

    private static String display(String pattern) {
        return "\n".equals(pattern) ? "\\n" : pattern;
    }
}
