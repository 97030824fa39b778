package com.shellgate.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Holds the current {@link PolicySnapshot}.
 * <p>
 * Reads are a single volatile load and never block. {@link #reload} is the
 * only writer: it parses a complete candidate first and swaps it in with one
 * reference write, so readers see either the whole old policy or the whole new
 * one. A malformed candidate is logged and discarded.
 */
public class PolicyStore {

    private static final Logger log = LoggerFactory.getLogger(PolicyStore.class);

    private final PolicyParser parser;
    private final AtomicReference<PolicySnapshot> current;
    private final Object writeLock = new Object();
    private volatile Consumer<Boolean> reloadListener = applied -> { };

    public PolicyStore(PolicyParser parser, PolicySnapshot initial) {
        this.parser = parser;
        this.current = new AtomicReference<>(initial);
    }

    /**
     * Builds a store from the initial policy.
     *
     * @throws PolicyConfigException if the initial policy is unreadable or malformed
     */
    public static PolicyStore load(PolicyParser parser, PolicySource source) {
        PolicySnapshot initial = parser.load(source);
        log.info("Loaded policy from {}: {} command(s), {} directory(ies), strict={}, maxOutputSize={}",
                source.describe(), initial.allowedCommands().size(), initial.allowedDirectories().size(),
                initial.strictValidation(), initial.maxOutputSize());
        return new PolicyStore(parser, initial);
    }

    public PolicySnapshot get() {
        return current.get();
    }

    /**
     * Re-reads the policy and installs it if valid.
     *
     * @return {@code true} if a new snapshot was installed, {@code false} if the
     *         candidate was rejected and the previous snapshot kept
     */
    public boolean reload(PolicySource source) {
        synchronized (writeLock) {
            PolicySnapshot candidate;
            try {
                candidate = parser.load(source);
            } catch (PolicyConfigException e) {
                log.warn("Policy reload from {} rejected, keeping previous policy: {}",
                        source.describe(), e.getMessage());
                reloadListener.accept(false);
                return false;
            }
            PolicySnapshot previous = current.getAndSet(candidate);
            log.info("Policy reloaded from {}: {} command(s) (was {}), {} directory(ies) (was {}), strict={}, maxOutputSize={}",
                    source.describe(),
                    candidate.allowedCommands().size(), previous.allowedCommands().size(),
                    candidate.allowedDirectories().size(), previous.allowedDirectories().size(),
                    candidate.strictValidation(), candidate.maxOutputSize());
            reloadListener.accept(true);
            return true;
        }
    }

    public boolean reload(Path path) {
        return reload(new FilePolicySource(path));
    }

    /** Registers a callback notified with the outcome of every reload attempt. */
    public void onReload(Consumer<Boolean> listener) {
        this.reloadListener = listener;
    }
}
