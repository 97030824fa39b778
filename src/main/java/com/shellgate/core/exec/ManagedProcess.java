package com.shellgate.core.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Sole owner of one spawned child.
 * <p>
 * {@link #close()} is the single cleanup routine for every exit path: anything
 * still alive in the child's process group (or, without a group, its process
 * tree) is terminated, the child is reaped and its pipes are closed. A group
 * outlives its leader, so members detached from the pipes are found even
 * after the shell has exited. Without a group, descendants are recorded while
 * the child runs, because they can no longer be traced once it is reaped.
 */
final class ManagedProcess implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ManagedProcess.class);

    private static final Duration FORCE_KILL_WAIT = Duration.ofSeconds(2);
    private static final long SIGNAL_TIMEOUT_MS = 1000;
    private static final long POLL_INTERVAL_MS = 20;
    private static final long WAIT_SLICE_MS = 50;

    private final Process process;
    private final boolean groupLeader;
    private final Duration gracePeriod;
    private final Set<ProcessHandle> seenDescendants = ConcurrentHashMap.newKeySet();
    private boolean terminated;

    /**
     * @param groupLeader whether the child was started as leader of its own process
     *                    group (pgid == pid), so the whole group can be signalled
     */
    ManagedProcess(Process process, boolean groupLeader, Duration gracePeriod) {
        this.process = process;
        this.groupLeader = groupLeader;
        this.gracePeriod = gracePeriod;
    }

    long pid() {
        return process.pid();
    }

    /**
     * Waits for the child to exit. Durations too long to express in nanoseconds
     * wait without a deadline.
     */
    boolean waitFor(Duration timeout) throws InterruptedException {
        long budget = saturatedNanos(timeout);
        long start = System.nanoTime();
        while (true) {
            long remaining = budget - (System.nanoTime() - start);
            if (remaining <= 0) {
                return !process.isAlive();
            }
            long slice = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(WAIT_SLICE_MS));
            if (process.waitFor(slice, TimeUnit.NANOSECONDS)) {
                return true;
            }
            recordDescendants();
        }
    }

    int waitFor() throws InterruptedException {
        while (!process.waitFor(WAIT_SLICE_MS, TimeUnit.MILLISECONDS)) {
            recordDescendants();
        }
        return process.exitValue();
    }

    boolean isTerminated() {
        return terminated;
    }

    /**
     * Sends SIGTERM to the group, waits out the grace period, then SIGKILLs survivors.
     */
    void terminate() {
        if (terminated) {
            return;
        }
        terminated = true;
        recordDescendants();
        List<ProcessHandle> tree = new ArrayList<>(seenDescendants);
        log.debug("Terminating process {} ({} known descendant(s), group={})", pid(), tree.size(), groupLeader);

        boolean signalled = groupLeader && signalGroup("TERM");
        if (!signalled) {
            process.destroy();
            tree.forEach(ProcessHandle::destroy);
        }

        if (!awaitExit(tree, gracePeriod)) {
            log.warn("Process {} still alive {} after SIGTERM, killing", pid(), gracePeriod);
            if (groupLeader) {
                signalGroup("KILL");
            }
            process.destroyForcibly();
            tree.forEach(ProcessHandle::destroyForcibly);
            if (!awaitExit(tree, FORCE_KILL_WAIT)) {
                log.error("Process {} survived SIGKILL", pid());
            }
        }
    }

    @Override
    public void close() {
        if (!terminated && hasSurvivors()) {
            log.debug("Process {} left members behind, cleaning up", pid());
            terminate();
        }
        closeQuietly(process.getInputStream(), "stdout");
        closeQuietly(process.getErrorStream(), "stderr");
        closeQuietly(process.getOutputStream(), "stdin");
    }

    private boolean hasSurvivors() {
        if (process.isAlive()) {
            return true;
        }
        if (groupLeader) {
            return groupHasMembers();
        }
        recordDescendants();
        return seenDescendants.stream().anyMatch(ProcessHandle::isAlive);
    }

    private void recordDescendants() {
        if (process.isAlive()) {
            process.descendants().forEach(seenDescendants::add);
        }
    }

    private boolean awaitExit(List<ProcessHandle> tree, Duration timeout) {
        long budget = saturatedNanos(timeout);
        long start = System.nanoTime();
        try {
            if (!process.waitFor(budget, TimeUnit.NANOSECONDS)) {
                return false;
            }
            while (tree.stream().anyMatch(ProcessHandle::isAlive) || (groupLeader && groupHasMembers())) {
                if (System.nanoTime() - start >= budget) {
                    return false;
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Whether any process still belongs to the child's group; signal 0 only probes. */
    private boolean groupHasMembers() {
        return signalGroup("0");
    }

    /**
     * Signals every member of the child's process group via {@code kill -SIG -- -pgid}.
     *
     * @return {@code true} if at least one member received the signal
     */
    private boolean signalGroup(String signal) {
        try {
            Process kill = new ProcessBuilder("kill", "-" + signal, "--", "-" + pid())
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!kill.waitFor(SIGNAL_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                kill.destroyForcibly();
                log.warn("kill -{} for process group {} did not finish", signal, pid());
                return false;
            }
            return kill.exitValue() == 0;
        } catch (IOException e) {
            log.warn("Cannot signal process group {} with {}: {}", pid(), signal, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private void closeQuietly(Closeable stream, String name) {
        try {
            stream.close();
        } catch (IOException e) {
            log.debug("Error closing {} of process {}: {}", name, pid(), e.getMessage());
        }
    }
}
