package io.taskhooks.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable audit record of one hook execution attempt (or one rejected attempt).
 *
 * <p>
 * Produced exactly once per attempt by the executor and appended to the audit log. Hash-chain
 * fields are added by the log itself and are not part of this value.
 *
 * @param recordType {@link #TYPE_EXECUTION} or {@link #TYPE_SECURITY_VIOLATION}
 * @param timestamp  when the record was finalized
 * @param hook       hook identification
 * @param event      triggering event identification
 * @param execution  process outcome
 * @param output     captured output summary
 * @param security   pre-spawn check outcome
 * @param tool       producing tool
 * @param error      error detail for non-success outcomes, or null
 */
public record HookExecutionRecord(
        String recordType,
        Instant timestamp,
        HookRef hook,
        EventRef event,
        Execution execution,
        Output output,
        Security security,
        Tool tool,
        String error) {

    public static final String SCHEMA_VERSION = "1.0";
    public static final String TYPE_EXECUTION = "hook.execution";
    public static final String TYPE_SECURITY_VIOLATION = "security.violation";

    public HookExecutionRecord {
        Objects.requireNonNull(recordType, "recordType must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        Objects.requireNonNull(hook, "hook must not be null");
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(execution, "execution must not be null");
        output = output != null ? output : Output.NONE;
        Objects.requireNonNull(security, "security must not be null");
        tool = tool != null ? tool : Tool.current();
    }

    public ExecutionStatus status() {
        return execution.status();
    }

    public boolean isSecurityViolation() {
        return TYPE_SECURITY_VIOLATION.equals(recordType);
    }

    /**
     * @param name         hook name
     * @param actionType   {@code script} or {@code command}
     * @param action       script path or command description
     * @param scriptSha256 SHA-256 of the script content, or null
     * @param failMode     configured fail mode
     */
    public record HookRef(String name, String actionType, String action, String scriptSha256, FailMode failMode) {
        public HookRef {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(failMode, "failMode must not be null");
        }
    }

    public record EventRef(String id, String type) {
        public EventRef {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(type, "type must not be null");
        }

        public static EventRef of(Event event) {
            return new EventRef(event.eventId(), event.eventType());
        }
    }

    /**
     * @param exitCode  process exit code, or null when the process never ran or was killed
     * @param executed  false when nothing was spawned
     */
    public record Execution(
            ExecutionStatus status,
            Integer exitCode,
            long durationMs,
            Instant startedAt,
            Instant completedAt,
            long timeoutMs,
            String workingDirectory,
            boolean executed) {
        public Execution {
            Objects.requireNonNull(status, "status must not be null");
            Objects.requireNonNull(startedAt, "startedAt must not be null");
            Objects.requireNonNull(completedAt, "completedAt must not be null");
        }
    }

    public record Output(int stdoutLines, int stderrLines, boolean stdoutTruncated, boolean stderrTruncated) {
        public static final Output NONE = new Output(0, 0, false, false);
    }

    public record Security(SecurityOutcome outcome, String detail, List<String> warnings) {
        public Security {
            Objects.requireNonNull(outcome, "outcome must not be null");
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }

        public static Security passed(List<String> warnings) {
            return new Security(SecurityOutcome.PASSED, null, warnings);
        }

        public static Security rejected(String detail) {
            return new Security(SecurityOutcome.REJECTED, detail, List.of());
        }
    }

    public record Tool(String name, String version) {
        public static Tool current() {
            return new Tool(ToolInfo.NAME, ToolInfo.version());
        }
    }
}
