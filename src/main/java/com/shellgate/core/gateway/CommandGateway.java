package com.shellgate.core.gateway;

import com.shellgate.core.exec.CommandExecutor;
import com.shellgate.core.logging.MdcContext;
import com.shellgate.core.metrics.GatewayMetrics;
import com.shellgate.core.model.ExecutionRequest;
import com.shellgate.core.model.ExecutionResult;
import com.shellgate.core.policy.PolicySnapshot;
import com.shellgate.core.policy.PolicyStore;
import com.shellgate.core.security.CommandValidator;
import com.shellgate.core.security.DirectoryValidator;
import com.shellgate.core.security.InjectionScanner;
import com.shellgate.core.security.ValidationDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Single entry point for execution requests.
 * <p>
 * Captures the current policy snapshot once, runs the command whitelist, the
 * injection scan and the directory whitelist against it, and hands approved
 * requests to the {@link CommandExecutor}. A policy reload that lands after the
 * snapshot was taken does not affect the request. Every outcome, including
 * denials and process faults, comes back as an {@link ExecutionResult}.
 */
@Service
public class CommandGateway {

    private static final Logger log = LoggerFactory.getLogger(CommandGateway.class);

    private final PolicyStore policyStore;
    private final CommandValidator commandValidator;
    private final DirectoryValidator directoryValidator;
    private final InjectionScanner injectionScanner;
    private final CommandExecutor executor;
    private final GatewayMetrics metrics;

    public CommandGateway(PolicyStore policyStore,
                          CommandValidator commandValidator,
                          DirectoryValidator directoryValidator,
                          InjectionScanner injectionScanner,
                          CommandExecutor executor,
                          GatewayMetrics metrics) {
        this.policyStore = policyStore;
        this.commandValidator = commandValidator;
        this.directoryValidator = directoryValidator;
        this.injectionScanner = injectionScanner;
        this.executor = executor;
        this.metrics = metrics;
    }

    public ExecutionResult execute(ExecutionRequest request) {
        String requestId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRequest(requestId, CommandValidator.baseCommand(request.command()));
        try {
            PolicySnapshot policy = policyStore.get();
            ExecutionResult result = run(request, policy);
            metrics.recordResult(result);
            return result;
        } finally {
            MdcContext.clear();
        }
    }

    private ExecutionResult run(ExecutionRequest request, PolicySnapshot policy) {
        String command = request.command();

        ValidationDecision decision = commandValidator.validate(policy, command);
        if (decision.allowed()) {
            decision = injectionScanner.scan(policy, command);
        }
        if (decision.allowed()) {
            decision = directoryValidator.validate(policy, request.cwd());
        }
        if (decision.denied()) {
            log.warn("Rejected request in '{}': {}", request.cwd(), decision.message());
            metrics.recordRejection(decision.reason());
            return ExecutionResult.rejected(command, decision.reason(), decision.message());
        }

        // the directory validator accepted it, so normalization cannot fail here
        Path workingDirectory = DirectoryValidator.normalize(request.cwd()).orElseThrow();
        log.info("Executing in {} (timeout={})", workingDirectory,
                request.timeoutIfSet().map(Object::toString).orElse("none"));

        long start = System.nanoTime();
        ExecutionResult result = executor.execute(request, workingDirectory, policy.maxOutputSize());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        metrics.recordExecution(elapsedMs);
        log.info("Finished with status {} exitCode={} in {} ms", result.status(), result.exitCode(), elapsedMs);
        return result;
    }
}
