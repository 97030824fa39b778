package com.shellgate.core.policy;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable point-in-time view of the execution policy.
 * <p>
 * A policy change never mutates a snapshot; {@link PolicyStore} installs a
 * wholly new instance instead, so a request that captured a snapshot keeps
 * validating against it even if a reload lands mid-flight.
 *
 * @param allowedCommands    exact-match, case-sensitive base command names
 * @param allowedDirectories normalized absolute directories (no trailing separator,
 *                           symlinks not resolved); subdirectories are implied
 * @param strictValidation   whether the injection scanner is active
 * @param maxOutputSize      cap on captured output, in bytes
 * @param source             description of where the policy was read from
 * @param loadedAt           when the snapshot was built
 */
public record PolicySnapshot(
        SortedSet<String> allowedCommands,
        SortedSet<Path> allowedDirectories,
        boolean strictValidation,
        int maxOutputSize,
        String source,
        Instant loadedAt
) {

    public PolicySnapshot {
        if (maxOutputSize <= 0) {
            throw new IllegalArgumentException("maxOutputSize must be positive, got " + maxOutputSize);
        }
        allowedCommands = Collections.unmodifiableSortedSet(new TreeSet<>(allowedCommands));
        var dirs = new TreeSet<Path>();
        for (Path dir : allowedDirectories) {
            if (!dir.isAbsolute()) {
                throw new IllegalArgumentException("Allowed directory must be absolute: " + dir);
            }
            dirs.add(dir.normalize());
        }
        allowedDirectories = Collections.unmodifiableSortedSet(dirs);
    }

    public static PolicySnapshot of(Set<String> commands, Set<Path> directories,
                                    boolean strictValidation, int maxOutputSize) {
        return new PolicySnapshot(new TreeSet<>(commands), new TreeSet<>(directories),
                strictValidation, maxOutputSize, "inline", Instant.now());
    }

    public boolean isCommandAllowed(String baseCommand) {
        return allowedCommands.contains(baseCommand);
    }

    /** Allowed directories rendered as strings, in sorted order. */
    public List<String> directoryNames() {
        var names = new ArrayList<String>(allowedDirectories.size());
        for (Path dir : allowedDirectories) {
            names.add(dir.toString());
        }
        return names;
    }
}
