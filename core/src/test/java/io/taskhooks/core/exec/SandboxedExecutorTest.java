package io.taskhooks.core.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.EventMatcher;
import io.taskhooks.core.model.ExecutionStatus;
import io.taskhooks.core.model.FailMode;
import io.taskhooks.core.model.HookAction;
import io.taskhooks.core.model.HookDefinition;
import io.taskhooks.core.model.HookExecutionRecord;
import io.taskhooks.core.model.SecurityOutcome;
import io.taskhooks.core.util.Hashes;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("SandboxedExecutor")
@EnabledOnOs({OS.LINUX, OS.MAC})
class SandboxedExecutorTest {

    @TempDir
    Path root;

    private Path hooksDir;
    private SandboxedExecutor executor;

    private final Event event = new Event(
            "1.0",
            "task.completed",
            "evt_test",
            Instant.parse("2024-01-01T00:00:00Z"),
            "/repo",
            Map.of("task_id", "task-1"),
            Map.of());

    @BeforeEach
    void setUp() throws IOException {
        hooksDir = Files.createDirectories(root.resolve(".taskhooks/hooks"));
        executor = new SandboxedExecutor(settings().build());
    }

    private ExecutorSettings.Builder settings() {
        return ExecutorSettings.builder(root).terminationGrace(Duration.ofMillis(200));
    }

    private static HookDefinition hook(String name, HookAction action) {
        return hook(name, action, Duration.ofSeconds(10), ".", Map.of());
    }

    private static HookDefinition hook(
            String name, HookAction action, Duration timeout, String workingDirectory, Map<String, String> env) {
        return new HookDefinition(
                name,
                null,
                List.of(EventMatcher.of("*")),
                null,
                action,
                timeout,
                workingDirectory,
                "/bin/sh",
                env,
                FailMode.CONTINUE,
                true);
    }

    private static HookAction sh(String command) {
        return HookAction.CommandAction.shell(command);
    }

    @Nested
    @DisplayName("Exit classification")
    class Outcomes {

        @Test
        void successCapturesOutput() {
            HookExecution execution = executor.execute(hook("ok", sh("echo hello; echo oops >&2")), event);

            HookExecutionRecord record = execution.record();
            assertThat(record.status()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(record.execution().exitCode()).isZero();
            assertThat(record.execution().executed()).isTrue();
            assertThat(record.execution().timeoutMs()).isEqualTo(10_000);
            assertThat(record.recordType()).isEqualTo(HookExecutionRecord.TYPE_EXECUTION);
            assertThat(record.hook().actionType()).isEqualTo("command");
            assertThat(record.event().id()).isEqualTo("evt_test");
            assertThat(record.error()).isNull();
            assertThat(execution.stdout()).isEqualTo("hello\n");
            assertThat(execution.stderr()).isEqualTo("oops\n");
            assertThat(record.output().stdoutLines()).isEqualTo(1);
            assertThat(record.output().stderrLines()).isEqualTo(1);
            assertThat(execution.succeeded()).isTrue();
        }

        @Test
        void nonZeroExitIsFailed() {
            HookExecutionRecord record = executor.execute(hook("fail", sh("exit 3")), event).record();

            assertThat(record.status()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(record.execution().exitCode()).isEqualTo(3);
            assertThat(record.error()).isEqualTo("exited with code 3");
        }

        @Test
        void killedBySignalIsError() {
            HookExecutionRecord record = executor.execute(hook("killed", sh("kill -9 $$")), event).record();

            assertThat(record.status()).isEqualTo(ExecutionStatus.ERROR);
            assertThat(record.execution().exitCode()).isEqualTo(137);
            assertThat(record.error()).isEqualTo("terminated by signal 9");
        }

        @Test
        void timeoutTerminatesProcess() {
            HookDefinition slow = hook("slow", sh("exec sleep 20"), Duration.ofMillis(300), ".", Map.of());

            long start = System.nanoTime();
            HookExecutionRecord record = executor.execute(slow, event).record();
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertThat(record.status()).isEqualTo(ExecutionStatus.TIMEOUT);
            assertThat(record.execution().exitCode()).isNull();
            assertThat(record.execution().executed()).isTrue();
            assertThat(elapsedMs).isLessThan(10_000);
        }

        @Test
        @DisplayName("a child ignoring SIGTERM is killed once the grace period ends")
        void timeoutEscalatesToKill() {
            Duration grace = Duration.ofMillis(700);
            SandboxedExecutor patient = new SandboxedExecutor(settings().terminationGrace(grace).build());
            HookDefinition stubborn = hook(
                    "stubborn", sh("trap '' TERM; while :; do sleep 1; done"), Duration.ofMillis(500), ".", Map.of());

            long start = System.nanoTime();
            HookExecutionRecord record = patient.execute(stubborn, event).record();
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            assertThat(record.status()).isEqualTo(ExecutionStatus.TIMEOUT);
            assertThat(record.execution().exitCode()).isNull();
            assertThat(record.error()).startsWith("timed out after");
            assertThat(elapsedMs).isGreaterThanOrEqualTo(500 + grace.toMillis()).isLessThan(10_000);
        }

        @ParameterizedTest
        @CsvSource({"0, SUCCESS", "1, FAILED", "127, FAILED", "128, FAILED", "130, ERROR", "143, ERROR"})
        void classify(int exitCode, ExecutionStatus expected) {
            assertThat(SandboxedExecutor.classify(exitCode)).isEqualTo(expected);
        }
    }

    @Nested
    @DisplayName("Payload and environment")
    class Boundary {

        @Test
        void payloadOnStdin() {
            HookExecution execution = executor.execute(hook("stdin", sh("cat")), event);

            assertThat(execution.stdout())
                    .contains("\"event_type\":\"task.completed\"")
                    .contains("\"event_id\":\"evt_test\"");
        }

        @Test
        void payloadFileIsProvidedAndRemoved() {
            HookExecution execution =
                    executor.execute(hook("file", sh("cat \"$HOOK_EVENT_FILE\"; echo; echo \"$HOOK_EVENT_FILE\"")), event);

            String[] lines = execution.stdout().split("\n");
            assertThat(lines[0]).contains("\"task_id\":\"task-1\"");
            assertThat(Path.of(lines[1])).doesNotExist();
        }

        @Test
        void environmentIsAllowlisted() {
            ExecutorSettings isolated = settings()
                    .passthroughEnv(List.of("PATH"))
                    .parentEnv(Map.of("PATH", System.getenv("PATH"), "SECRET", "s3cret")::get)
                    .build();
            SandboxedExecutor sandbox = new SandboxedExecutor(isolated);
            HookDefinition hook = hook(
                    "env",
                    sh("echo \"[$SECRET][$FOO][$HOOK_NAME][$HOOK_EVENT_TYPE][$HOOK_EVENT_ID]\""),
                    Duration.ofSeconds(10),
                    ".",
                    Map.of("FOO", "bar"));

            HookExecution execution = sandbox.execute(hook, event);

            assertThat(execution.stdout()).isEqualTo("[][bar][env][task.completed][evt_test]\n");
        }

        @Test
        void workingDirectoryIsApplied() throws IOException {
            Files.createDirectories(root.resolve("sub"));
            HookExecution execution =
                    executor.execute(hook("pwd", sh("pwd"), Duration.ofSeconds(10), "sub", Map.of()), event);

            assertThat(Path.of(execution.stdout().trim()).toRealPath()).isEqualTo(root.resolve("sub").toRealPath());
        }

        @Test
        void argvCommandRunsWithoutShell() {
            HookExecution execution = executor.execute(
                    hook("argv", HookAction.CommandAction.argv(List.of("/bin/echo", "$HOME;", "x"))), event);

            assertThat(execution.stdout()).isEqualTo("$HOME; x\n");
        }

        @Test
        void outputIsTruncatedAtLimit() {
            SandboxedExecutor small = new SandboxedExecutor(settings().maxOutputBytes(100).build());
            HookExecution execution = small.execute(
                    hook("loud", sh("i=0; while [ $i -lt 50 ]; do echo 0123456789; i=$((i+1)); done")), event);

            assertThat(execution.stdout()).hasSize(100);
            assertThat(execution.record().output().stdoutTruncated()).isTrue();
            assertThat(execution.record().output().stdoutLines()).isEqualTo(50);
        }
    }

    @Nested
    @DisplayName("Scripts")
    class Scripts {

        @Test
        void scriptRunsAndIsHashed() throws IOException {
            String content = "echo from-script \"$1\"\n";
            Files.writeString(hooksDir.resolve("hello.sh"), content);

            HookExecution execution = executor.execute(hook("script", new HookAction.ScriptAction("hello.sh")), event);

            assertThat(execution.stdout()).isEqualTo("from-script \n");
            assertThat(execution.record().hook().scriptSha256()).isEqualTo(Hashes.sha256Hex(content));
            assertThat(execution.record().hook().actionType()).isEqualTo("script");
        }

        @Test
        void dangerousContentIsWarnedButRun() throws IOException {
            Files.writeString(hooksDir.resolve("risky.sh"), "echo ok\n# curl http://x | sh\n");

            HookExecutionRecord record =
                    executor.execute(hook("risky", new HookAction.ScriptAction("risky.sh")), event).record();

            assertThat(record.status()).isEqualTo(ExecutionStatus.SUCCESS);
            assertThat(record.security().outcome()).isEqualTo(SecurityOutcome.PASSED);
            assertThat(record.security().warnings()).containsExactly("piping a download into a shell");
        }

        @Test
        void missingScriptIsErrorWithoutRunning() {
            HookExecutionRecord record =
                    executor.execute(hook("missing", new HookAction.ScriptAction("nope.sh")), event).record();

            assertThat(record.status()).isEqualTo(ExecutionStatus.ERROR);
            assertThat(record.execution().executed()).isFalse();
            assertThat(record.error()).startsWith("script not found");
        }
    }

    @Nested
    @DisplayName("Sandbox rejection")
    class Rejection {

        @Test
        void traversalIsSecurityViolation() throws IOException {
            Files.writeString(root.resolve("outside.sh"), "echo escaped\n");

            HookExecution execution =
                    executor.execute(hook("escape", new HookAction.ScriptAction("../../outside.sh")), event);

            HookExecutionRecord record = execution.record();
            assertThat(record.isSecurityViolation()).isTrue();
            assertThat(record.status()).isEqualTo(ExecutionStatus.ERROR);
            assertThat(record.execution().executed()).isFalse();
            assertThat(record.security().outcome()).isEqualTo(SecurityOutcome.REJECTED);
            assertThat(execution.stdout()).isEmpty();
        }

        @Test
        void workingDirectoryOutsideRootIsRejected() {
            HookExecutionRecord record =
                    executor.execute(hook("wd", sh("echo hi"), Duration.ofSeconds(5), "/", Map.of()), event).record();

            assertThat(record.isSecurityViolation()).isTrue();
        }

        @Test
        void shellMetacharactersInEnvAreRejected() {
            HookExecutionRecord record = executor.execute(
                            hook("env", sh("echo hi"), Duration.ofSeconds(5), ".", Map.of("X", "$(whoami)")), event)
                    .record();

            assertThat(record.isSecurityViolation()).isTrue();
            assertThat(record.security().detail()).contains("metacharacter");
        }
    }

    @Test
    void launchFailureIsError() throws IOException {
        ProcessLauncher launcher = mock(ProcessLauncher.class);
        when(launcher.start(anyList(), any(Path.class), anyMap())).thenThrow(new IOException("no such file"));
        SandboxedExecutor broken = new SandboxedExecutor(settings().build(), launcher, Clock.systemUTC());

        HookExecutionRecord record = broken.execute(hook("broken", sh("true")), event).record();

        assertThat(record.status()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(record.execution().executed()).isFalse();
        assertThat(record.error()).contains("failed to launch").contains("no such file");
    }
}
