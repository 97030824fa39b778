package com.shellgate.mcp;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Identity the stdio MCP server advertises during initialization.
 *
 * <pre>
 * shellgate:
 *   mcp:
 *     server-name: shellgate
 *     server-version: 0.1.0
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "shellgate.mcp")
public class McpProperties {

    private String serverName = "shellgate";
    private String serverVersion = "0.1.0";

    public String getServerName() { return serverName; }
    public void setServerName(String serverName) { this.serverName = serverName; }
    public String getServerVersion() { return serverVersion; }
    public void setServerVersion(String serverVersion) { this.serverVersion = serverVersion; }
}
