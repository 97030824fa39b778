package com.shellgate.core.security;

import com.shellgate.core.model.FailureKind;
import com.shellgate.core.policy.PolicySnapshot;
import org.springframework.stereotype.Service;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Checks the working directory against the allowed directories.
 * <p>
 * Matching is by whole path segments ({@link Path#startsWith(Path)}), so
 * {@code /home2/x} does not fall under {@code /home}. Symlinks are not
 * resolved: a link inside an allowed directory pointing elsewhere is accepted.
 */
@Service
public class DirectoryValidator {

    public ValidationDecision validate(PolicySnapshot policy, String cwd) {
        Optional<Path> normalized = normalize(cwd);
        if (normalized.isEmpty()) {
            return ValidationDecision.deny(FailureKind.DIRECTORY_NOT_ALLOWED,
                    "Directory '%s' is not a valid path. %s".formatted(cwd, allowedList(policy)));
        }
        Path dir = normalized.get();
        for (Path allowed : policy.allowedDirectories()) {
            if (dir.startsWith(allowed)) {
                return ValidationDecision.allow();
            }
        }
        return ValidationDecision.deny(FailureKind.DIRECTORY_NOT_ALLOWED,
                "Directory '%s' is not in the allowed directories list. %s".formatted(cwd, allowedList(policy)));
    }

    /**
     * Absolute, lexically normalized form of {@code cwd}; relative paths resolve
     * against the gateway's own working directory.
     */
    public static Optional<Path> normalize(String cwd) {
        if (cwd == null || cwd.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(cwd).toAbsolutePath().normalize());
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
    }

    private static String allowedList(PolicySnapshot policy) {
        if (policy.allowedDirectories().isEmpty()) {
            return "No directories are allowed.";
        }
        return "Allowed directories (subdirectories are permitted): " + String.join(", ", policy.directoryNames());
    }
}
