package io.taskhooks.core.exec;

import io.taskhooks.core.error.SecurityViolationException;
import io.taskhooks.core.event.EventCodec;
import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.ExecutionStatus;
import io.taskhooks.core.model.HookAction;
import io.taskhooks.core.model.HookDefinition;
import io.taskhooks.core.model.HookExecutionRecord;
import io.taskhooks.core.model.HookExecutionRecord.EventRef;
import io.taskhooks.core.model.HookExecutionRecord.Execution;
import io.taskhooks.core.model.HookExecutionRecord.HookRef;
import io.taskhooks.core.model.HookExecutionRecord.Output;
import io.taskhooks.core.model.HookExecutionRecord.Security;
import io.taskhooks.core.model.HookExecutionRecord.Tool;
import io.taskhooks.core.util.Hashes;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one hook action in a constrained child process and produces its audit record.
 *
 * <p>
 * Before anything is spawned the script path, working directory and declared environment are
 * checked; a violation yields a {@code security.violation} record with nothing executed. The
 * child then gets:
 * <ul>
 * <li>an argument vector, never a command line assembled from event data
 * <li>the event JSON on stdin and in a temp file named by {@code HOOK_EVENT_FILE}
 * <li>a cleared environment plus the passthrough variables, the hook's {@code env} and
 * {@code HOOK_NAME}, {@code HOOK_EVENT_TYPE}, {@code HOOK_EVENT_ID}, {@code HOOK_WORKSPACE}
 * </ul>
 *
 * <p>
 * When the hook's timeout elapses the process receives SIGTERM, then SIGKILL after the grace
 * period, and the status is {@link ExecutionStatus#TIMEOUT}. Exit 0 is SUCCESS, exits above 128
 * (termination by signal) are ERROR, other non-zero exits are FAILED.
 *
 * <p>
 * Never throws for hook failures: every outcome becomes a record.
 */
public final class SandboxedExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(SandboxedExecutor.class);

    static final int SIGNAL_EXIT_THRESHOLD = 128;
    private static final long READER_JOIN_MILLIS = 2_000;

    private final ExecutorSettings settings;
    private final ProcessLauncher launcher;
    private final Clock clock;
    private final EventCodec codec;
    private final ScriptPathGuard scriptGuard;
    private final WorkingDirectoryGuard workingDirectoryGuard;

    public SandboxedExecutor(ExecutorSettings settings) {
        this(settings, new DefaultProcessLauncher(), Clock.systemUTC());
    }

    public SandboxedExecutor(ExecutorSettings settings, ProcessLauncher launcher, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.launcher = Objects.requireNonNull(launcher, "launcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.codec = new EventCodec();
        this.scriptGuard = new ScriptPathGuard(settings.hooksDirectory());
        this.workingDirectoryGuard = new WorkingDirectoryGuard(settings.projectRoot());
    }

    public ExecutorSettings settings() {
        return settings;
    }

    public HookExecution execute(HookDefinition hook, Event event) {
        Objects.requireNonNull(hook, "hook must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Attempt attempt = new Attempt(hook, event, clock.instant(), System.nanoTime());

        Path workingDirectory;
        List<String> argv;
        try {
            workingDirectory = workingDirectoryGuard.resolve(hook.name(), hook.workingDirectory());
            EnvironmentGuard.check(hook.name(), hook.env());
            argv = prepareAction(hook, attempt);
        } catch (SecurityViolationException e) {
            LOG.error("Security violation in hook '{}': {}", hook.name(), e.getMessage());
            return attempt.rejected(e.getMessage());
        }
        if (argv == null) {
            return attempt.notRun(workingDirectory, attempt.error);
        }
        if (!Files.isDirectory(workingDirectory)) {
            return attempt.notRun(workingDirectory, "working directory does not exist: " + workingDirectory);
        }

        String payload = codec.toJson(event);
        Path eventFile = null;
        try {
            eventFile = Files.createTempFile("taskhooks-event-", ".json");
            Files.writeString(eventFile, payload, StandardCharsets.UTF_8);
            return run(attempt, argv, workingDirectory, environment(hook, event, eventFile), payload);
        } catch (IOException e) {
            LOG.error("Failed to prepare event payload for hook '{}': {}", hook.name(), e.getMessage());
            return attempt.notRun(workingDirectory, "failed to write event payload: " + e.getMessage());
        } finally {
            if (eventFile != null) {
                try {
                    Files.deleteIfExists(eventFile);
                } catch (IOException e) {
                    LOG.warn("Could not delete event payload file {}: {}", eventFile, e.getMessage());
                }
            }
        }
    }

    // Returns null (with attempt.error set) when the action cannot run for a non-security reason.
    private List<String> prepareAction(HookDefinition hook, Attempt attempt) {
        if (hook.action() instanceof HookAction.ScriptAction script) {
            Path path = scriptGuard.resolve(hook.name(), script.path());
            if (!Files.isRegularFile(path)) {
                attempt.error = "script not found: " + path;
                LOG.error("Hook '{}': {}", hook.name(), attempt.error);
                return null;
            }
            try {
                byte[] content = Files.readAllBytes(path);
                attempt.scriptSha256 = Hashes.sha256Hex(content);
                attempt.warnings.addAll(ScriptContentScanner.scan(new String(content, StandardCharsets.UTF_8)));
                for (String warning : attempt.warnings) {
                    LOG.warn("Hook '{}' script {} contains a dangerous pattern: {}", hook.name(), script.path(), warning);
                }
            } catch (IOException e) {
                attempt.error = "cannot read script " + path + ": " + e.getMessage();
                LOG.error("Hook '{}': {}", hook.name(), attempt.error);
                return null;
            }
            return Files.isExecutable(path) ? List.of(path.toString()) : List.of(hook.shell(), path.toString());
        }
        HookAction.CommandAction command = (HookAction.CommandAction) hook.action();
        return command.usesShell() ? List.of(hook.shell(), "-c", command.shellCommand()) : command.argv();
    }

    private Map<String, String> environment(HookDefinition hook, Event event, Path eventFile) {
        Map<String, String> env = new LinkedHashMap<>();
        for (String key : settings.passthroughEnv()) {
            String value = settings.parentEnv().apply(key);
            if (value != null) {
                env.put(key, value);
            }
        }
        env.putAll(hook.env());
        env.put("HOOK_NAME", hook.name());
        env.put("HOOK_EVENT_TYPE", event.eventType());
        env.put("HOOK_EVENT_ID", event.eventId());
        env.put("HOOK_WORKSPACE", settings.projectRoot().toString());
        env.put("HOOK_EVENT_FILE", eventFile.toString());
        return env;
    }

    private HookExecution run(
            Attempt attempt, List<String> argv, Path workingDirectory, Map<String, String> env, String payload) {
        HookDefinition hook = attempt.hook;
        Process process;
        try {
            process = launcher.start(argv, workingDirectory, env);
        } catch (IOException e) {
            LOG.error("Failed to launch hook '{}': {}", hook.name(), e.getMessage());
            return attempt.notRun(workingDirectory, "failed to launch: " + e.getMessage());
        }
        LOG.debug("Started hook '{}' (pid {}) in {}", hook.name(), process.pid(), workingDirectory);

        OutputCollector stdout = new OutputCollector(
                process.getInputStream(), settings.maxOutputBytes(), "hook-" + hook.name() + "-stdout");
        OutputCollector stderr = new OutputCollector(
                process.getErrorStream(), settings.maxOutputBytes(), "hook-" + hook.name() + "-stderr");
        stdout.start();
        stderr.start();
        writePayload(process, payload, hook.name());

        ExecutionStatus status;
        Integer exitCode = null;
        String error = null;
        try {
            if (process.waitFor(hook.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                exitCode = process.exitValue();
                status = classify(exitCode);
                if (status == ExecutionStatus.FAILED) {
                    error = "exited with code " + exitCode;
                } else if (status == ExecutionStatus.ERROR) {
                    error = "terminated by signal " + (exitCode - SIGNAL_EXIT_THRESHOLD);
                }
            } else {
                terminate(process, hook.name());
                status = ExecutionStatus.TIMEOUT;
                error = "timed out after " + hook.timeout().toSeconds() + "s";
            }
            stdout.await(READER_JOIN_MILLIS);
            stderr.await(READER_JOIN_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            status = ExecutionStatus.ERROR;
            error = "interrupted while waiting for hook";
        }

        Output output = new Output(stdout.lines(), stderr.lines(), stdout.truncated(), stderr.truncated());
        HookExecutionRecord record = attempt.finish(status, exitCode, workingDirectory, true, output, error);
        logOutcome(record);
        return new HookExecution(record, stdout.text(), stderr.text());
    }

    private void terminate(Process process, String hookName) throws InterruptedException {
        LOG.warn("Hook '{}' exceeded its timeout, sending SIGTERM", hookName);
        process.destroy();
        if (!process.waitFor(settings.terminationGrace().toMillis(), TimeUnit.MILLISECONDS)) {
            LOG.warn("Hook '{}' ignored SIGTERM, sending SIGKILL", hookName);
            process.destroyForcibly();
            process.waitFor(settings.terminationGrace().toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private static void writePayload(Process process, String payload, String hookName) {
        Thread writer = new Thread(
                () -> {
                    try (OutputStream stdin = process.getOutputStream()) {
                        stdin.write(payload.getBytes(StandardCharsets.UTF_8));
                    } catch (IOException e) {
                        LOG.debug("Hook '{}' did not consume its stdin payload: {}", hookName, e.getMessage());
                    }
                },
                "hook-" + hookName + "-stdin");
        writer.setDaemon(true);
        writer.start();
    }

    static ExecutionStatus classify(int exitCode) {
        if (exitCode == 0) {
            return ExecutionStatus.SUCCESS;
        }
        return exitCode > SIGNAL_EXIT_THRESHOLD ? ExecutionStatus.ERROR : ExecutionStatus.FAILED;
    }

    private static void logOutcome(HookExecutionRecord record) {
        Execution execution = record.execution();
        if (execution.status().isSuccess()) {
            LOG.info("Hook '{}' succeeded in {} ms", record.hook().name(), execution.durationMs());
        } else {
            LOG.info(
                    "Hook '{}' finished with {} in {} ms: {}",
                    record.hook().name(),
                    execution.status(),
                    execution.durationMs(),
                    record.error());
        }
    }

    /** Mutable state of one attempt; produces exactly one record. */
    private final class Attempt {
        private final HookDefinition hook;
        private final Event event;
        private final Instant startedAt;
        private final long startNanos;
        private final List<String> warnings = new ArrayList<>();
        private String scriptSha256;
        private String error;
        private boolean finished;

        Attempt(HookDefinition hook, Event event, Instant startedAt, long startNanos) {
            this.hook = hook;
            this.event = event;
            this.startedAt = startedAt;
            this.startNanos = startNanos;
        }

        HookExecution rejected(String detail) {
            HookExecutionRecord record = build(
                    HookExecutionRecord.TYPE_SECURITY_VIOLATION,
                    ExecutionStatus.ERROR,
                    null,
                    null,
                    false,
                    Output.NONE,
                    Security.rejected(detail),
                    detail);
            return new HookExecution(record, "", "");
        }

        HookExecution notRun(Path workingDirectory, String reason) {
            return new HookExecution(
                    finish(ExecutionStatus.ERROR, null, workingDirectory, false, Output.NONE, reason), "", "");
        }

        HookExecutionRecord finish(
                ExecutionStatus status, Integer exitCode, Path workingDirectory, boolean executed, Output output,
                String errorDetail) {
            return build(
                    HookExecutionRecord.TYPE_EXECUTION,
                    status,
                    exitCode,
                    workingDirectory,
                    executed,
                    output,
                    Security.passed(warnings),
                    errorDetail);
        }

        private HookExecutionRecord build(
                String recordType,
                ExecutionStatus status,
                Integer exitCode,
                Path workingDirectory,
                boolean executed,
                Output output,
                Security security,
                String errorDetail) {
            if (finished) {
                throw new IllegalStateException("Execution record for hook '" + hook.name() + "' already finalized");
            }
            finished = true;
            Instant completedAt = clock.instant();
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            return new HookExecutionRecord(
                    recordType,
                    completedAt,
                    new HookRef(
                            hook.name(), hook.action().type(), hook.action().describe(), scriptSha256, hook.failMode()),
                    EventRef.of(event),
                    new Execution(
                            status,
                            exitCode,
                            durationMs,
                            startedAt,
                            completedAt,
                            hook.timeout().toMillis(),
                            workingDirectory != null ? workingDirectory.toString() : null,
                            executed),
                    output,
                    security,
                    Tool.current(),
                    errorDetail);
        }
    }
}
