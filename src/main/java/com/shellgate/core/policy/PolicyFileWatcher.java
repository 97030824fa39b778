package com.shellgate.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;

/**
 * Polls the policy file and triggers {@link PolicyStore#reload} when its
 * modification time or size changes.
 * <p>
 * Polling keeps the watcher independent of editor save strategies (rename,
 * truncate-and-write) that confuse native file-change notifications.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "shellgate.policy.watch", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PolicyFileWatcher {

    private static final Logger log = LoggerFactory.getLogger(PolicyFileWatcher.class);

    private final PolicyStore store;
    private final Path path;

    private Observation lastSeen;

    public PolicyFileWatcher(PolicyStore store, PolicyProperties properties) {
        this.store = store;
        this.path = Path.of(properties.getPath());
        this.lastSeen = observe();
        log.info("Watching policy file {} every {} ms", path.toAbsolutePath(), properties.getWatch().getIntervalMs());
    }

    @Scheduled(fixedDelayString = "${shellgate.policy.watch.interval-ms:2000}",
            initialDelayString = "${shellgate.policy.watch.interval-ms:2000}")
    public void poll() {
        Observation now = observe();
        if (Objects.equals(now, lastSeen)) {
            return;
        }
        lastSeen = now;
        if (now == null) {
            log.warn("Policy file {} disappeared, keeping current policy", path.toAbsolutePath());
            return;
        }
        log.info("Policy file {} changed, reloading", path.toAbsolutePath());
        store.reload(new FilePolicySource(path));
    }

    private Observation observe() {
        try {
            return new Observation(Files.getLastModifiedTime(path), Files.size(path));
        } catch (NoSuchFileException e) {
            return null;
        } catch (IOException e) {
            log.warn("Cannot stat policy file {}: {}", path.toAbsolutePath(), e.getMessage());
            return lastSeen;
        }
    }

    private record Observation(FileTime modified, long size) {}
}
