package com.shellgate.core.exec;

import com.shellgate.core.model.ExecutionRequest;
import com.shellgate.core.model.ExecutionResult;
import com.shellgate.core.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs approved commands through the shell and turns their fate into an
 * {@link ExecutionResult}.
 * <p>
 * Each call owns its child exclusively: the process is started as leader of a
 * new process group (via {@code setsid}, when available) with stdin on the
 * null device and a scrubbed, non-interactive environment. stdout and stderr
 * are drained concurrently into one capped buffer; stderr is also kept apart
 * for the {@code error} field. The child and anything it spawned are torn down
 * by {@link ManagedProcess#close()} whichever way the call ends.
 */
@Service
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private static final File NULL_DEVICE = new File("/dev/null");
    private static final List<Path> SETSID_CANDIDATES = List.of(Path.of("/usr/bin/setsid"), Path.of("/bin/setsid"));
    private static final String DEFAULT_PATH = "/usr/local/sbin:/usr/local/bin:/usr/sbin:/usr/bin:/sbin:/bin";

    private final ExecutionProperties properties;
    private final Path setsid;
    private final Map<String, String> environment;

    public CommandExecutor(ExecutionProperties properties) {
        this.properties = properties;
        this.setsid = properties.isIsolateProcessGroup() ? findSetsid().orElse(null) : null;
        this.environment = Collections.unmodifiableMap(sanitizedEnvironment(properties.getEnvironment()));
        if (properties.isIsolateProcessGroup() && setsid == null) {
            log.warn("setsid not found; timeouts will terminate the process tree instead of a process group");
        }
    }

    /**
     * Spawns {@code request.command()} in {@code workingDirectory}.
     *
     * @param request          an approved request
     * @param workingDirectory the normalized, validated working directory
     * @param maxOutputSize    output cap in bytes from the policy snapshot the request was validated against
     */
    public ExecutionResult execute(ExecutionRequest request, Path workingDirectory, int maxOutputSize) {
        String command = request.command();
        ProcessBuilder builder = new ProcessBuilder(commandLine(command))
                .directory(workingDirectory.toFile())
                .redirectInput(ProcessBuilder.Redirect.from(NULL_DEVICE));
        builder.environment().clear();
        builder.environment().putAll(environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Failed to start command in {}: {}", workingDirectory, e.getMessage());
            return ExecutionResult.faulted(command, FailureKind.SPAWN_FAILURE,
                    "Failed to start command: " + e.getMessage(), "");
        }

        var combined = new OutputBuffer(maxOutputSize);
        var stderr = new OutputBuffer(maxOutputSize);
        try (var managed = new ManagedProcess(process, setsid != null, properties.getKillGracePeriod())) {
            log.debug("Started process {} in {}", managed.pid(), workingDirectory);
            StreamPump out = StreamPump.start(process.getInputStream(), "shellgate-stdout-" + managed.pid(), combined);
            StreamPump err = StreamPump.start(process.getErrorStream(), "shellgate-stderr-" + managed.pid(), combined, stderr);
            try {
                Optional<Duration> timeout = request.timeoutIfSet();
                if (timeout.isPresent()) {
                    if (!managed.waitFor(timeout.get())) {
                        managed.terminate();
                        drain(out, err);
                        String seconds = formatSeconds(timeout.get());
                        log.warn("Process {} timed out after {}s, process group terminated", managed.pid(), seconds);
                        return ExecutionResult.timedOut(command, combined.toUtf8String(),
                                "Command execution timed out after " + seconds + " seconds", combined.isTruncated());
                    }
                } else {
                    managed.waitFor();
                }
                int exitCode = process.exitValue();

                if (!drain(out, err)) {
                    log.warn("Output of process {} still open after exit, terminating leftover group members", managed.pid());
                    managed.terminate();
                    drain(out, err);
                }
                if (!managed.isTerminated()) {
                    out.rethrowFailure();
                    err.rethrowFailure();
                }
                log.debug("Process {} exited with {} ({} byte(s) captured{})", managed.pid(), exitCode,
                        combined.size(), combined.isTruncated() ? ", truncated" : "");
                return ExecutionResult.completed(command, exitCode, combined.toUtf8String(),
                        stderr.toUtf8String(), combined.isTruncated());
            } catch (IOException e) {
                log.error("I/O failure while managing process {}", managed.pid(), e);
                return ExecutionResult.faulted(command, FailureKind.INTERNAL_FAULT,
                        "Error executing command: " + e.getMessage(), combined.toUtf8String());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.error("Interrupted while waiting for process {}", managed.pid());
                return ExecutionResult.faulted(command, FailureKind.INTERNAL_FAULT,
                        "Error executing command: interrupted", combined.toUtf8String());
            } catch (RuntimeException e) {
                log.error("Unexpected failure while managing process {}", managed.pid(), e);
                return ExecutionResult.faulted(command, FailureKind.INTERNAL_FAULT,
                        "Error executing command: " + e.getMessage(), combined.toUtf8String());
            }
        }
    }

    /** Whether timeouts signal a whole process group rather than walking the process tree. */
    public boolean isProcessGroupIsolated() {
        return setsid != null;
    }

    public String shell() {
        return properties.getShell();
    }

    List<String> commandLine(String command) {
        var line = new ArrayList<String>();
        if (setsid != null) {
            line.add(setsid.toString());
        }
        line.add(properties.getShell());
        line.addAll(properties.getShellArgs());
        line.add(command);
        return line;
    }

    Map<String, String> environment() {
        return environment;
    }

    private boolean drain(StreamPump out, StreamPump err) throws InterruptedException {
        Duration timeout = properties.getDrainTimeout();
        boolean outDone = out.await(timeout);
        boolean errDone = err.await(timeout);
        return outDone && errDone;
    }

    private static Optional<Path> findSetsid() {
        return SETSID_CANDIDATES.stream().filter(Files::isExecutable).findFirst();
    }

    static Map<String, String> sanitizedEnvironment(Map<String, String> extra) {
        var env = new LinkedHashMap<String, String>();
        String path = System.getenv("PATH");
        env.put("PATH", path == null || path.isBlank() ? DEFAULT_PATH : path);
        env.put("HOME", System.getProperty("user.home"));
        env.put("LANG", "C.UTF-8");
        env.put("TERM", "dumb");
        env.put("NO_COLOR", "1");
        env.put("CI", "true");
        env.put("PAGER", "cat");
        env.put("GIT_PAGER", "cat");
        env.put("GIT_TERMINAL_PROMPT", "0");
        env.put("DEBIAN_FRONTEND", "noninteractive");
        if (extra != null) {
            env.putAll(extra);
        }
        return env;
    }

    static String formatSeconds(Duration duration) {
        return BigDecimal.valueOf(duration.toMillis()).movePointLeft(3).stripTrailingZeros().toPlainString();
    }
}
