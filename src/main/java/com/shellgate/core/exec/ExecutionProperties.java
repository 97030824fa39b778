package com.shellgate.core.exec;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * How approved commands are spawned and torn down.
 *
 * <pre>
 * shellgate:
 *   exec:
 *     shell: /bin/bash
 *     shell-args: [-c]
 *     isolate-process-group: true
 *     kill-grace-period: 2s
 *     drain-timeout: 1s
 *     environment:
 *       JAVA_HOME: /opt/jdk
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "shellgate.exec")
public class ExecutionProperties {

    private String shell = "/bin/bash";
    private List<String> shellArgs = new ArrayList<>(List.of("-c"));
    private boolean isolateProcessGroup = true;
    private Duration killGracePeriod = Duration.ofSeconds(2);
    private Duration drainTimeout = Duration.ofSeconds(1);
    private Map<String, String> environment = new HashMap<>();

    public String getShell() { return shell; }
    public void setShell(String shell) { this.shell = shell; }
    public List<String> getShellArgs() { return shellArgs; }
    public void setShellArgs(List<String> shellArgs) { this.shellArgs = shellArgs; }
    public boolean isIsolateProcessGroup() { return isolateProcessGroup; }
    public void setIsolateProcessGroup(boolean isolateProcessGroup) { this.isolateProcessGroup = isolateProcessGroup; }
    public Duration getKillGracePeriod() { return killGracePeriod; }
    public void setKillGracePeriod(Duration killGracePeriod) { this.killGracePeriod = killGracePeriod; }
    public Duration getDrainTimeout() { return drainTimeout; }
    public void setDrainTimeout(Duration drainTimeout) { this.drainTimeout = drainTimeout; }
    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }
}
