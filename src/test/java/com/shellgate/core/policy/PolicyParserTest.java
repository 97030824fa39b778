package com.shellgate.core.policy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PolicyParserTest {

    private final PolicyParser parser = new PolicyParser();

    private PolicySnapshot parse(String json) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8), "test.json");
    }

    @Nested
    @DisplayName("valid documents")
    class Valid {

        @Test
        @DisplayName("parses all four fields")
        void parsesAllFields() {
            var policy = parse("""
                    {
                      "allowedCommands": ["pwd", "ls"],
                      "allowedDirectories": ["/tmp", "/home/"],
                      "validateCommandsStrictly": false,
                      "maxOutputSize": 4096
                    }
                    """);

            assertEquals(List.of("ls", "pwd"), List.copyOf(policy.allowedCommands()));
            assertEquals(List.of("/home", "/tmp"), policy.directoryNames());
            assertFalse(policy.strictValidation());
            assertEquals(4096, policy.maxOutputSize());
            assertEquals("test.json", policy.source());
        }

        @Test
        @DisplayName("defaults strict validation to true and output size to 1 MiB")
        void appliesDefaults() {
            var policy = parse("""
                    {"allowedCommands": ["ls"], "allowedDirectories": ["/tmp"]}
                    """);

            assertTrue(policy.strictValidation());
            assertEquals(PolicyParser.DEFAULT_MAX_OUTPUT_SIZE, policy.maxOutputSize());
        }

        @Test
        @DisplayName("normalizes directories without resolving them")
        void normalizesDirectories() {
            var policy = parse("""
                    {"allowedCommands": [], "allowedDirectories": ["/srv/app/../data/./logs/"]}
                    """);

            assertEquals(List.of("/srv/data/logs"), policy.directoryNames());
        }

        @Test
        @DisplayName("loads from a file source")
        void loadsFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("policy.json");
            Files.writeString(file, """
                    {"allowedCommands": ["git"], "allowedDirectories": ["/repo"], "maxOutputSize": 10}
                    """);

            var policy = parser.load(new FilePolicySource(file));

            assertTrue(policy.isCommandAllowed("git"));
            assertEquals(10, policy.maxOutputSize());
            assertEquals(file.toAbsolutePath().toString(), policy.source());
        }
    }

    @Nested
    @DisplayName("malformed documents")
    class Malformed {

        @Test
        @DisplayName("rejects invalid JSON")
        void rejectsInvalidJson() {
            var e = assertThrows(PolicyConfigException.class, () -> parse("{not json"));
            assertTrue(e.getMessage().contains("not valid JSON"));
        }

        @Test
        @DisplayName("rejects a non-object root")
        void rejectsArrayRoot() {
            assertThrows(PolicyConfigException.class, () -> parse("[\"ls\"]"));
        }

        @Test
        @DisplayName("rejects missing allowedCommands")
        void rejectsMissingCommands() {
            var e = assertThrows(PolicyConfigException.class,
                    () -> parse("{\"allowedDirectories\": [\"/tmp\"]}"));
            assertTrue(e.getMessage().contains("allowedCommands"));
        }

        @Test
        @DisplayName("rejects missing allowedDirectories")
        void rejectsMissingDirectories() {
            var e = assertThrows(PolicyConfigException.class,
                    () -> parse("{\"allowedCommands\": [\"ls\"]}"));
            assertTrue(e.getMessage().contains("allowedDirectories"));
        }

        @Test
        @DisplayName("rejects a list field that is a string")
        void rejectsScalarList() {
            var e = assertThrows(PolicyConfigException.class,
                    () -> parse("{\"allowedCommands\": \"ls\", \"allowedDirectories\": [\"/tmp\"]}"));
            assertTrue(e.getMessage().contains("list of strings"));
        }

        @Test
        @DisplayName("rejects non-string list entries")
        void rejectsNonStringEntries() {
            assertThrows(PolicyConfigException.class,
                    () -> parse("{\"allowedCommands\": [\"ls\", 3], \"allowedDirectories\": [\"/tmp\"]}"));
        }

        @Test
        @DisplayName("rejects relative allowed directories")
        void rejectsRelativeDirectory() {
            var e = assertThrows(PolicyConfigException.class,
                    () -> parse("{\"allowedCommands\": [\"ls\"], \"allowedDirectories\": [\"tmp\"]}"));
            assertTrue(e.getMessage().contains("absolute"));
        }

        @Test
        @DisplayName("rejects zero, negative, fractional and textual maxOutputSize")
        void rejectsBadMaxOutputSize() {
            for (String value : List.of("0", "-5", "1.5", "\"1024\"", "true", "99999999999")) {
                String json = "{\"allowedCommands\": [\"ls\"], \"allowedDirectories\": [\"/tmp\"], \"maxOutputSize\": "
                        + value + "}";
                assertThrows(PolicyConfigException.class, () -> parse(json), "maxOutputSize=" + value);
            }
        }

        @Test
        @DisplayName("rejects a non-boolean strict flag")
        void rejectsNonBooleanStrict() {
            assertThrows(PolicyConfigException.class, () -> parse(
                    "{\"allowedCommands\": [\"ls\"], \"allowedDirectories\": [\"/tmp\"], \"validateCommandsStrictly\": \"yes\"}"));
        }

        @Test
        @DisplayName("reports an unreadable file as a config error")
        void rejectsMissingFile(@TempDir Path dir) {
            var source = new FilePolicySource(dir.resolve("absent.json"));
            var e = assertThrows(PolicyConfigException.class, () -> parser.load(source));
            assertTrue(e.getMessage().startsWith("Cannot read policy"));
        }
    }
}
