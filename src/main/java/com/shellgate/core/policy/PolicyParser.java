package com.shellgate.core.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Turns a JSON policy document into a {@link PolicySnapshot}.
 *
 * <pre>
 * {
 *   "allowedCommands": ["ls", "pwd"],
 *   "allowedDirectories": ["/tmp"],
 *   "validateCommandsStrictly": true,
 *   "maxOutputSize": 1048576
 * }
 * </pre>
 *
 * The two lists are required. {@code validateCommandsStrictly} defaults to
 * {@code true} and {@code maxOutputSize} to 1 MiB when absent.
 */
public class PolicyParser {

    static final String ALLOWED_COMMANDS = "allowedCommands";
    static final String ALLOWED_DIRECTORIES = "allowedDirectories";
    static final String STRICT = "validateCommandsStrictly";
    static final String MAX_OUTPUT_SIZE = "maxOutputSize";

    public static final int DEFAULT_MAX_OUTPUT_SIZE = 1024 * 1024;

    private final ObjectMapper objectMapper;

    public PolicyParser() {
        this(new ObjectMapper());
    }

    public PolicyParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Reads and parses the policy from the given source.
     *
     * @throws PolicyConfigException if the source is unreadable or the document is malformed
     */
    public PolicySnapshot load(PolicySource source) {
        byte[] raw;
        try {
            raw = source.read();
        } catch (IOException e) {
            throw new PolicyConfigException("Cannot read policy from " + source.describe() + ": " + e.getMessage(), e);
        }
        return parse(raw, source.describe());
    }

    public PolicySnapshot parse(byte[] raw, String sourceName) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new PolicyConfigException("Policy " + sourceName + " is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PolicyConfigException("Cannot parse policy " + sourceName + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PolicyConfigException("Policy " + sourceName + " must be a JSON object");
        }

        var commands = new TreeSet<>(stringList(root, ALLOWED_COMMANDS, sourceName));
        var directories = new TreeSet<Path>();
        for (String dir : stringList(root, ALLOWED_DIRECTORIES, sourceName)) {
            directories.add(absoluteDirectory(dir, sourceName));
        }

        return new PolicySnapshot(commands, directories,
                strictFlag(root, sourceName), maxOutputSize(root, sourceName),
                sourceName, Instant.now());
    }

    private static List<String> stringList(JsonNode root, String field, String sourceName) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new PolicyConfigException("Policy " + sourceName + " is missing required field '" + field + "'");
        }
        if (!node.isArray()) {
            throw new PolicyConfigException("Policy field '" + field + "' must be a list of strings");
        }
        var values = new ArrayList<String>(node.size());
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new PolicyConfigException("Policy field '" + field
                        + "' must be a list of strings, found " + element.getNodeType());
            }
            String value = element.asText().strip();
            if (value.isEmpty()) {
                throw new PolicyConfigException("Policy field '" + field + "' contains a blank entry");
            }
            values.add(value);
        }
        return values;
    }

    private static Path absoluteDirectory(String dir, String sourceName) {
        Path path;
        try {
            path = Path.of(dir);
        } catch (InvalidPathException e) {
            throw new PolicyConfigException("Allowed directory '" + dir + "' in " + sourceName + " is not a valid path", e);
        }
        if (!path.isAbsolute()) {
            throw new PolicyConfigException("Allowed directory '" + dir + "' in " + sourceName + " must be an absolute path");
        }
        return path.normalize();
    }

    private static boolean strictFlag(JsonNode root, String sourceName) {
        JsonNode node = root.get(STRICT);
        if (node == null || node.isNull()) {
            return true;
        }
        if (!node.isBoolean()) {
            throw new PolicyConfigException("Policy field '" + STRICT + "' in " + sourceName + " must be a boolean");
        }
        return node.booleanValue();
    }

    private static int maxOutputSize(JsonNode root, String sourceName) {
        JsonNode node = root.get(MAX_OUTPUT_SIZE);
        if (node == null || node.isNull()) {
            return DEFAULT_MAX_OUTPUT_SIZE;
        }
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new PolicyConfigException("Policy field '" + MAX_OUTPUT_SIZE + "' in " + sourceName
                    + " must be a positive integer");
        }
        long value = node.longValue();
        if (value <= 0 || value > Integer.MAX_VALUE) {
            throw new PolicyConfigException("Policy field '" + MAX_OUTPUT_SIZE + "' must be between 1 and "
                    + Integer.MAX_VALUE + ", got " + value);
        }
        return (int) value;
    }
}
