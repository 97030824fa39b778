package com.shellgate.core.health;

import com.shellgate.core.exec.CommandExecutor;
import com.shellgate.core.policy.PolicySnapshot;
import com.shellgate.core.policy.PolicyStore;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final PolicyStore policyStore;
    private final CommandExecutor executor;

    public HealthCheckService(
            @Autowired(required = false) PolicyStore policyStore,
            @Autowired(required = false) CommandExecutor executor) {
        this.policyStore = policyStore;
        this.executor = executor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPolicy());
        results.add(checkShell());
        results.add(checkProcessGroup());
        return results;
    }

    private HealthStatus checkPolicy() {
        if (policyStore == null) {
            return new HealthStatus("policy", HealthStatus.Status.DOWN,
                    "No policy loaded", Map.of());
        }
        PolicySnapshot policy = policyStore.get();
        return new HealthStatus("policy", HealthStatus.Status.UP,
                "%d command(s), %d directory(ies), strict=%s".formatted(
                        policy.allowedCommands().size(), policy.allowedDirectories().size(),
                        policy.strictValidation()),
                Map.of("source", policy.source(),
                        "loadedAt", policy.loadedAt().toString(),
                        "maxOutputSize", String.valueOf(policy.maxOutputSize())));
    }

    private HealthStatus checkShell() {
        if (executor == null) {
            return new HealthStatus("shell", HealthStatus.Status.DOWN,
                    "No executor configured", Map.of());
        }
        Path shell = Path.of(executor.shell());
        if (Files.isExecutable(shell)) {
            return new HealthStatus("shell", HealthStatus.Status.UP,
                    shell + " is executable", Map.of());
        }
        return new HealthStatus("shell", HealthStatus.Status.DOWN,
                shell + " is missing or not executable", Map.of());
    }

    private HealthStatus checkProcessGroup() {
        if (executor == null) {
            return new HealthStatus("process-group", HealthStatus.Status.DOWN,
                    "No executor configured", Map.of());
        }
        if (executor.isProcessGroupIsolated()) {
            return new HealthStatus("process-group", HealthStatus.Status.UP,
                    "Commands run in their own process group", Map.of());
        }
        return new HealthStatus("process-group", HealthStatus.Status.DEGRADED,
                "setsid unavailable or disabled; timeouts terminate the process tree only", Map.of());
    }
}
