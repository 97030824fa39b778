package com.shellgate.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellgate.core.gateway.CommandGateway;
import com.shellgate.core.model.ExecutionRequest;
import com.shellgate.core.model.ExecutionResult;
import com.shellgate.core.model.FailureKind;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ExecuteCommandToolTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private CommandGateway gateway;
    private ExecuteCommandTool tool;

    @BeforeEach
    void setUp() {
        gateway = mock(CommandGateway.class);
        tool = new ExecuteCommandTool(gateway);
    }

    private static String text(McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    @Test
    @DisplayName("tool is advertised as execute_command with command and cwd required")
    void specification() throws Exception {
        var spec = tool.specification();

        assertEquals("execute_command", spec.tool().name());
        JsonNode schema = mapper.readTree(ExecuteCommandTool.INPUT_SCHEMA);
        assertEquals("command", schema.get("required").get(0).asText());
        assertEquals("cwd", schema.get("required").get(1).asText());
        assertEquals("number", schema.get("properties").get("timeout").get("type").asText());
    }

    @Nested
    @DisplayName("results")
    class Results {

        @Test
        @DisplayName("successful run is returned as pretty JSON without an error field")
        void success() throws Exception {
            when(gateway.execute(any())).thenReturn(ExecutionResult.completed("pwd", 0, "/tmp\n", "", false));

            var result = tool.call(Map.of("command", "pwd", "cwd", "/tmp"));

            assertFalse(result.isError());
            JsonNode json = mapper.readTree(text(result));
            assertTrue(json.get("success").asBoolean());
            assertEquals("/tmp\n", json.get("output").asText());
            assertEquals(0, json.get("exitCode").asInt());
            assertFalse(json.has("error"));
            assertTrue(text(result).contains("\n"), "pretty printed");
        }

        @Test
        @DisplayName("denials are ordinary results, not tool errors")
        void denialIsNotToolError() throws Exception {
            when(gateway.execute(any())).thenReturn(
                    ExecutionResult.rejected("rm x", FailureKind.COMMAND_NOT_ALLOWED, "Command 'rm' is not in the allowed commands list."));

            var result = tool.call(Map.of("command", "rm x", "cwd", "/tmp"));

            assertFalse(result.isError());
            JsonNode json = mapper.readTree(text(result));
            assertFalse(json.get("success").asBoolean());
            assertFalse(json.has("exitCode"));
            assertTrue(json.get("error").asText().contains("'rm'"));
        }

        @Test
        @DisplayName("timeout argument is passed through in seconds")
        void timeoutPassedThrough() {
            when(gateway.execute(any())).thenReturn(ExecutionResult.completed("ls", 0, "", "", false));

            tool.call(Map.of("command", "ls", "cwd", "/tmp", "timeout", 2.5));

            var captor = ArgumentCaptor.forClass(ExecutionRequest.class);
            verify(gateway).execute(captor.capture());
            assertEquals(Duration.ofMillis(2500), captor.getValue().timeout());
        }
    }

    @Nested
    @DisplayName("argument errors")
    class ArgumentErrors {

        @Test
        @DisplayName("missing arguments")
        void missingArguments() {
            var result = tool.call(Map.of());

            assertTrue(result.isError());
            assertEquals("Invalid arguments: Missing arguments", text(result));
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("missing cwd")
        void missingCwd() {
            var result = tool.call(Map.of("command", "ls"));

            assertTrue(result.isError());
            assertTrue(text(result).contains("Missing required command or cwd parameter"));
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("empty command")
        void emptyCommand() {
            var result = tool.call(Map.of("command", "", "cwd", "/tmp"));

            assertTrue(result.isError());
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("non-string command")
        void nonStringCommand() {
            var result = tool.call(Map.of("command", 42, "cwd", "/tmp"));

            assertTrue(result.isError());
            assertTrue(text(result).contains("'command' must be a string"));
        }

        @Test
        @DisplayName("non-positive timeout")
        void negativeTimeout() {
            var result = tool.call(Map.of("command", "ls", "cwd", "/tmp", "timeout", -1));

            assertTrue(result.isError());
            verifyNoInteractions(gateway);
        }

        @Test
        @DisplayName("non-numeric timeout")
        void textTimeout() {
            var arguments = new HashMap<String, Object>(Map.of("command", "ls", "cwd", "/tmp"));
            arguments.put("timeout", "soon");

            var result = tool.call(arguments);

            assertTrue(result.isError());
            assertTrue(text(result).contains("'timeout'"));
        }

        @Test
        @DisplayName("numeric timeout given as text is accepted")
        void numericTextTimeout() {
            var request = ExecuteCommandTool.toRequest(Map.of("command", "ls", "cwd", "/tmp", "timeout", "3"));

            assertEquals(Duration.ofSeconds(3), request.timeout());
        }
    }
}
