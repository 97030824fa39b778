package com.shellgate.dispatch.cli;

import com.shellgate.mcp.McpStdioServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: shellgate serve
 * <p>
 * Starts the MCP server on stdin/stdout and blocks until the client closes
 * stdin or the JVM shuts down. Nothing may be printed to stdout here: it
 * carries the protocol.
 * <p>
 * Configure the policy file via: {@code SHELLGATE_POLICY_PATH=/etc/shellgate/policy.json shellgate serve}
 */
@Command(name = "serve", mixinStandardHelpOptions = true,
        description = "Serve the execute_command tool over MCP stdio")
@Component
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    private final McpStdioServer server;

    public ServeCommand(McpStdioServer server) {
        this.server = server;
    }

    @Override
    public Integer call() {
        server.start();
        try {
            server.awaitTermination();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Serve interrupted, shutting down");
        } finally {
            server.stop();
        }
        return 0;
    }
}
