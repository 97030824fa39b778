package com.shellgate.core.policy;

import com.shellgate.core.metrics.GatewayMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Loads the policy at startup. A malformed or missing policy file fails
 * context startup, so the service never runs without a valid policy.
 */
@Configuration
public class PolicyConfiguration {

    @Bean
    public PolicySource policySource(PolicyProperties properties) {
        return new FilePolicySource(Path.of(properties.getPath()));
    }

    @Bean
    public PolicyParser policyParser() {
        return new PolicyParser();
    }

    @Bean
    public PolicyStore policyStore(PolicyParser parser, PolicySource source, GatewayMetrics metrics) {
        PolicyStore store = PolicyStore.load(parser, source);
        store.onReload(metrics::recordPolicyReload);
        return store;
    }
}
