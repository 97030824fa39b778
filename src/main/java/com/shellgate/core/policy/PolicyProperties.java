package com.shellgate.core.policy;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Where the policy document lives and how it is watched.
 *
 * <pre>
 * shellgate:
 *   policy:
 *     path: /etc/shellgate/policy.json
 *     watch:
 *       enabled: true
 *       interval-ms: 2000
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "shellgate.policy")
public class PolicyProperties {

    private String path = "config.json";
    private Watch watch = new Watch();

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public Watch getWatch() { return watch; }
    public void setWatch(Watch watch) { this.watch = watch; }

    public static class Watch {
        private boolean enabled = true;
        private long intervalMs = 2000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }
}
