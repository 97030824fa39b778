package com.shellgate.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellgate.core.gateway.CommandGateway;
import com.shellgate.core.model.ExecutionRequest;
import com.shellgate.core.model.ExecutionResult;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * The {@code execute_command} MCP tool: maps tool arguments onto an
 * {@link ExecutionRequest}, runs it through the {@link CommandGateway} and
 * returns the {@link ExecutionResult} as pretty-printed JSON text.
 * <p>
 * Denials, timeouts and failed commands are ordinary results. Only malformed
 * arguments are reported as tool errors.
 */
@Component
public class ExecuteCommandTool {

    private static final Logger log = LoggerFactory.getLogger(ExecuteCommandTool.class);

    public static final String NAME = "execute_command";
    static final String DESCRIPTION = "Execute a bash command in a secure environment";
    static final String INPUT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "command": {"type": "string", "description": "The bash command to execute"},
                "cwd": {"type": "string", "description": "Working directory for the command"},
                "timeout": {"type": "number", "description": "Optional timeout in seconds"}
              },
              "required": ["command", "cwd"]
            }
            """;

    private final CommandGateway gateway;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ExecuteCommandTool(CommandGateway gateway) {
        this.gateway = gateway;
    }

    public McpServerFeatures.SyncToolSpecification specification() {
        var tool = new McpSchema.Tool(NAME, DESCRIPTION, INPUT_SCHEMA);
        return new McpServerFeatures.SyncToolSpecification(tool, (exchange, arguments) -> call(arguments));
    }

    McpSchema.CallToolResult call(Map<String, Object> arguments) {
        ExecutionRequest request;
        try {
            request = toRequest(arguments);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid {} arguments: {}", NAME, e.getMessage());
            return textResult("Invalid arguments: " + e.getMessage(), true);
        }
        ExecutionResult result = gateway.execute(request);
        try {
            return textResult(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result), false);
        } catch (JsonProcessingException e) {
            log.error("Cannot serialize result for {}", NAME, e);
            return textResult("Cannot serialize result: " + e.getOriginalMessage(), true);
        }
    }

    static ExecutionRequest toRequest(Map<String, Object> arguments) {
        if (arguments == null || arguments.isEmpty()) {
            throw new IllegalArgumentException("Missing arguments");
        }
        String command = stringArgument(arguments, "command");
        String cwd = stringArgument(arguments, "cwd");
        if (command == null || command.isEmpty() || cwd == null || cwd.isEmpty()) {
            throw new IllegalArgumentException("Missing required command or cwd parameter");
        }
        return ExecutionRequest.withTimeoutSeconds(command, cwd, timeoutArgument(arguments.get("timeout")));
    }

    private static String stringArgument(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException("'" + name + "' must be a string");
        }
        return text;
    }

    private static Double timeoutArgument(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.valueOf(text.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("'timeout' must be a number of seconds, got '" + text + "'");
            }
        }
        throw new IllegalArgumentException("'timeout' must be a number of seconds");
    }

    private static McpSchema.CallToolResult textResult(String text, boolean isError) {
        List<McpSchema.Content> content = List.of(new McpSchema.TextContent(text));
        return new McpSchema.CallToolResult(content, isError);
    }
}
