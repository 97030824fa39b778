package com.shellgate.core.policy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Policy document stored in a file on the local filesystem.
 */
public record FilePolicySource(Path path) implements PolicySource {

    @Override
    public byte[] read() throws IOException {
        return Files.readAllBytes(path);
    }

    @Override
    public String describe() {
        return path.toAbsolutePath().toString();
    }
}
