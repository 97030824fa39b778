package com.shellgate.core.gateway;

import com.shellgate.core.exec.CommandExecutor;
import com.shellgate.core.exec.ExecutionProperties;
import com.shellgate.core.metrics.GatewayMetrics;
import com.shellgate.core.model.ExecutionRequest;
import com.shellgate.core.model.ExecutionResult;
import com.shellgate.core.model.ExecutionStatus;
import com.shellgate.core.model.FailureKind;
import com.shellgate.core.policy.PolicyParser;
import com.shellgate.core.policy.PolicySnapshot;
import com.shellgate.core.policy.PolicyStore;
import com.shellgate.core.security.CommandValidator;
import com.shellgate.core.security.DirectoryValidator;
import com.shellgate.core.security.InjectionScanner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CommandGatewayTest {

    private SimpleMeterRegistry registry;
    private GatewayMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new GatewayMetrics(registry);
    }

    private CommandGateway gateway(PolicyStore store, CommandExecutor executor) {
        return new CommandGateway(store, new CommandValidator(), new DirectoryValidator(),
                new InjectionScanner(), executor, metrics);
    }

    private static PolicyStore store(boolean strict, String... commands) {
        return new PolicyStore(new PolicyParser(),
                PolicySnapshot.of(Set.of(commands), Set.of(Path.of("/tmp")), strict, 1024 * 1024));
    }

    private double rejections(FailureKind kind) {
        var counter = registry.find("shellgate.rejections.total")
                .tag("reason", kind.name().toLowerCase())
                .counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        private CommandExecutor executor;
        private CommandGateway gateway;

        @BeforeEach
        void setUp() {
            executor = mock(CommandExecutor.class);
            gateway = gateway(store(true, "ls", "pwd"), executor);
        }

        @Test
        @DisplayName("command outside the whitelist is rejected without spawning")
        void commandNotAllowed() {
            var result = gateway.execute(new ExecutionRequest("rm -rf /", "/tmp"));

            assertEquals(ExecutionStatus.REJECTED, result.status());
            assertEquals(FailureKind.COMMAND_NOT_ALLOWED, result.failure());
            assertFalse(result.success());
            assertEquals("", result.output());
            assertNull(result.exitCode());
            assertEquals("rm -rf /", result.command());
            assertTrue(result.error().contains("'rm'"));
            assertTrue(result.error().contains("ls, pwd"));
            assertEquals(1.0, rejections(FailureKind.COMMAND_NOT_ALLOWED));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("directory outside the whitelist is rejected")
        void directoryNotAllowed() {
            var result = gateway.execute(new ExecutionRequest("ls", "/etc"));

            assertEquals(FailureKind.DIRECTORY_NOT_ALLOWED, result.failure());
            assertTrue(result.error().contains("/tmp"));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("traversal out of an allowed directory is rejected after normalization")
        void traversalRejected() {
            var result = gateway.execute(new ExecutionRequest("ls", "/tmp/../etc"));

            assertEquals(FailureKind.DIRECTORY_NOT_ALLOWED, result.failure());
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("injection pattern is rejected in strict mode")
        void injectionRejected() {
            var result = gateway.execute(new ExecutionRequest("ls ; rm -rf /", "/tmp"));

            assertEquals(FailureKind.INJECTION_PATTERN_DETECTED, result.failure());
            assertTrue(result.error().contains("';'"));
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("command check runs before the injection scan")
        void commandCheckedFirst() {
            var result = gateway.execute(new ExecutionRequest("cat /etc/passwd | ls", "/etc"));

            assertEquals(FailureKind.COMMAND_NOT_ALLOWED, result.failure());
        }

        @Test
        @DisplayName("injection scan runs before the directory check")
        void injectionCheckedBeforeDirectory() {
            var result = gateway.execute(new ExecutionRequest("ls && pwd", "/etc"));

            assertEquals(FailureKind.INJECTION_PATTERN_DETECTED, result.failure());
        }

        @Test
        @DisplayName("rejections count towards the rejected request total")
        void rejectionMetrics() {
            gateway.execute(new ExecutionRequest("rm x", "/tmp"));
            gateway.execute(new ExecutionRequest("ls", "/etc"));

            var counter = registry.find("shellgate.requests.total").tag("status", "rejected").counter();
            assertNotNull(counter);
            assertEquals(2.0, counter.count());
        }
    }

    @Nested
    @DisplayName("strict mode off")
    class Lenient {

        @Test
        @DisplayName("metacharacters pass through to the executor")
        void metacharactersAllowed() {
            var executor = mock(CommandExecutor.class);
            when(executor.execute(any(), any(), anyInt()))
                    .thenReturn(ExecutionResult.completed("ls | wc -l", 0, "3\n", "", false));
            var gateway = gateway(store(false, "ls"), executor);

            var result = gateway.execute(new ExecutionRequest("ls | wc -l", "/tmp"));

            assertTrue(result.success());
            verify(executor).execute(any(), eq(Path.of("/tmp")), eq(1024 * 1024));
        }

        @Test
        @DisplayName("base command is still enforced")
        void baseCommandStillChecked() {
            var executor = mock(CommandExecutor.class);
            var gateway = gateway(store(false, "ls"), executor);

            var result = gateway.execute(new ExecutionRequest("rm -rf / ; ls", "/tmp"));

            assertEquals(FailureKind.COMMAND_NOT_ALLOWED, result.failure());
            verifyNoInteractions(executor);
        }
    }

    @Nested
    @DisplayName("policy reload")
    class Reload {

        @TempDir
        Path dir;

        @Test
        @DisplayName("an in-flight request keeps the snapshot it was validated against")
        void inFlightRequestUnaffected() throws Exception {
            Path file = dir.resolve("policy.json");
            var store = new PolicyStore(new PolicyParser(),
                    PolicySnapshot.of(Set.of("ls"), Set.of(Path.of("/tmp")), true, 4096));
            var executor = mock(CommandExecutor.class);
            when(executor.execute(any(), any(), anyInt())).thenAnswer(invocation -> {
                Files.writeString(file, """
                        {"allowedCommands": ["pwd"], "allowedDirectories": ["/tmp"], "maxOutputSize": 8}
                        """);
                assertTrue(store.reload(file));
                return ExecutionResult.completed("ls", 0, "a\n", "", false);
            });
            var gateway = gateway(store, executor);

            var first = gateway.execute(new ExecutionRequest("ls", "/tmp"));
            var second = gateway.execute(new ExecutionRequest("ls", "/tmp"));

            assertTrue(first.success());
            verify(executor).execute(any(), eq(Path.of("/tmp")), eq(4096));
            assertEquals(FailureKind.COMMAND_NOT_ALLOWED, second.failure());
            assertTrue(second.error().contains("pwd"));
        }
    }

    @Nested
    @EnabledOnOs(OS.LINUX)
    @DisplayName("end to end")
    class EndToEnd {

        private CommandGateway gateway;

        @BeforeEach
        void setUp() {
            gateway = gateway(store(true, "pwd", "echo", "sleep", "ls"), new CommandExecutor(new ExecutionProperties()));
        }

        @Test
        @DisplayName("pwd in /tmp prints /tmp")
        void pwd() {
            var result = gateway.execute(new ExecutionRequest("pwd", "/tmp"));

            assertTrue(result.success());
            assertEquals(0, result.exitCode());
            assertEquals("/tmp\n", result.output());
            assertNull(result.error());
            assertFalse(result.truncated());
        }

        @Test
        @DisplayName("subdirectory of an allowed directory is accepted")
        void subdirectory() throws Exception {
            Path sub = Files.createTempDirectory(Path.of("/tmp"), "shellgate-gw");
            try {
                var result = gateway.execute(new ExecutionRequest("pwd", sub.toString()));

                assertTrue(result.success());
                assertEquals(sub + "\n", result.output());
            } finally {
                Files.deleteIfExists(sub);
            }
        }

        @Test
        @DisplayName("timeout is reported as a failure without exit code")
        void timeout() {
            var result = gateway.execute(ExecutionRequest.withTimeoutSeconds("sleep 30", "/tmp", 0.5));

            assertEquals(ExecutionStatus.TIMED_OUT, result.status());
            assertNull(result.exitCode());
            assertTrue(result.error().contains("timed out"));
        }

        @Test
        @DisplayName("allowed but nonexistent subdirectory is a spawn failure")
        void missingDirectory() {
            var result = gateway.execute(new ExecutionRequest("ls", "/tmp/shellgate-missing-" + System.nanoTime()));

            assertEquals(FailureKind.SPAWN_FAILURE, result.failure());
            assertNull(result.exitCode());
        }
    }
}
