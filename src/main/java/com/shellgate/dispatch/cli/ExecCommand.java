package com.shellgate.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shellgate.core.gateway.CommandGateway;
import com.shellgate.core.model.ExecutionRequest;
import com.shellgate.core.model.ExecutionResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: shellgate exec --cwd DIR [--timeout SECONDS] COMMAND...
 * <p>
 * Runs one request through the full gateway, exactly as an MCP call would,
 * and prints the JSON result. Handy for checking a policy by hand.
 */
@Command(name = "exec", mixinStandardHelpOptions = true,
        description = "Run one command through the policy gateway and print the result")
@Component
public class ExecCommand implements Callable<Integer> {

    private final CommandGateway gateway;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Option(names = "--cwd", required = true, description = "Working directory")
    String cwd;

    @Option(names = "--timeout", description = "Timeout in seconds")
    Double timeout;

    @Parameters(arity = "1..*", paramLabel = "COMMAND", description = "Command line; joined with spaces")
    List<String> command;

    public ExecCommand(CommandGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Integer call() {
        ExecutionRequest request;
        try {
            request = ExecutionRequest.withTimeoutSeconds(String.join(" ", command), cwd, timeout);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
        ExecutionResult result = gateway.execute(request);
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Cannot render result: " + e.getOriginalMessage());
            return 2;
        }
        return result.success() ? 0 : 1;
    }
}
