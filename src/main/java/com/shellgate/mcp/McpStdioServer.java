package com.shellgate.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CountDownLatch;

/**
 * Serves the {@code execute_command} tool over MCP on stdin/stdout.
 * <p>
 * stdout belongs to the transport from {@link #start()} on; logging goes to
 * stderr (see {@code logback-spring.xml}). The server stops when the client
 * closes stdin or the application shuts down, whichever comes first.
 */
@Component
public class McpStdioServer {

    private static final Logger log = LoggerFactory.getLogger(McpStdioServer.class);

    private final ExecuteCommandTool executeCommandTool;
    private final McpProperties props;
    private final InputStream in;
    private final OutputStream out;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private McpSyncServer server;

    @Autowired
    public McpStdioServer(ExecuteCommandTool executeCommandTool, McpProperties props) {
        this(executeCommandTool, props, System.in, System.out);
    }

    McpStdioServer(ExecuteCommandTool executeCommandTool, McpProperties props, InputStream in, OutputStream out) {
        this.executeCommandTool = executeCommandTool;
        this.props = props;
        this.in = in;
        this.out = out;
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        var transport = new StdioServerTransportProvider(new ObjectMapper(),
                new EndOfInputStream(in, this::onEndOfInput), out);
        server = McpServer.sync(transport)
                .serverInfo(props.getServerName(), props.getServerVersion())
                .capabilities(McpSchema.ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .tools(executeCommandTool.specification())
                .build();
        log.info("MCP server '{}' {} listening on stdio with tool '{}'",
                props.getServerName(), props.getServerVersion(), ExecuteCommandTool.NAME);
    }

    /** Blocks until the client closes stdin or {@link #stop()} runs. */
    public void awaitTermination() throws InterruptedException {
        stopped.await();
    }

    /** Whether {@link #awaitTermination()} would return immediately. */
    public boolean isTerminated() {
        return stopped.getCount() == 0;
    }

    // runs on the transport's reader thread; the server itself is closed by stop() on the caller's side
    private void onEndOfInput() {
        log.info("MCP client closed stdin, shutting down");
        stopped.countDown();
    }

    @PreDestroy
    public synchronized void stop() {
        if (server != null) {
            try {
                server.closeGracefully();
                log.info("MCP server stopped");
            } catch (Exception e) {
                log.debug("Error closing MCP server: {}", e.getMessage());
            }
            server = null;
        }
        stopped.countDown();
    }
}
