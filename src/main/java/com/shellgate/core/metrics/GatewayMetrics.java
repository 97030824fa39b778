package com.shellgate.core.metrics;

import com.shellgate.core.model.ExecutionResult;
import com.shellgate.core.model.FailureKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for the command gateway.
 */
@Service
public class GatewayMetrics {

    private final MeterRegistry registry;

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordResult(ExecutionResult result) {
        Counter.builder("shellgate.requests.total")
                .tag("status", tagValue(result.status().name()))
                .register(registry)
                .increment();
        if (result.truncated()) {
            Counter.builder("shellgate.output.truncated")
                    .description("Executions whose output exceeded maxOutputSize")
                    .register(registry)
                    .increment();
        }
    }

    public void recordRejection(FailureKind reason) {
        Counter.builder("shellgate.rejections.total")
                .tag("reason", tagValue(reason.name()))
                .register(registry)
                .increment();
    }

    public void recordExecution(long ms) {
        Timer.builder("shellgate.execution.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPolicyReload(boolean applied) {
        Counter.builder("shellgate.policy.reloads")
                .tag("result", applied ? "applied" : "rejected")
                .register(registry)
                .increment();
    }

    private static String tagValue(String enumName) {
        return enumName.toLowerCase(Locale.ROOT);
    }
}
