package com.shellgate.core.security;

import com.shellgate.core.model.FailureKind;
import com.shellgate.core.policy.PolicySnapshot;
import org.springframework.stereotype.Service;

import java.util.regex.Pattern;

/**
 * Checks the base command against the whitelist.
 * <p>
 * The base command is the first whitespace-delimited token of the trimmed
 * command string. Quoting, variable-assignment prefixes and the rest of shell
 * grammar are deliberately not interpreted; anything chained after the first
 * token is the {@link InjectionScanner}'s concern.
 */
@Service
public class CommandValidator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public ValidationDecision validate(PolicySnapshot policy, String command) {
        String baseCommand = baseCommand(command);
        if (baseCommand.isEmpty()) {
            return ValidationDecision.deny(FailureKind.COMMAND_NOT_ALLOWED,
                    "Command is empty. Allowed commands: " + allowedList(policy));
        }
        if (policy.isCommandAllowed(baseCommand)) {
            return ValidationDecision.allow();
        }
        return ValidationDecision.deny(FailureKind.COMMAND_NOT_ALLOWED,
                "Command '%s' is not in the allowed commands list. Allowed commands: %s"
                        .formatted(baseCommand, allowedList(policy)));
    }

    public static String baseCommand(String command) {
        if (command == null) {
            return "";
        }
        String trimmed = command.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return WHITESPACE.split(trimmed, 2)[0];
    }

    private static String allowedList(PolicySnapshot policy) {
        if (policy.allowedCommands().isEmpty()) {
            return "(none)";
        }
        return String.join(", ", policy.allowedCommands());
    }
}
