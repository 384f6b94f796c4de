package io.taskhooks.core.exec;

import io.taskhooks.core.model.HookExecutionRecord;
import java.util.Objects;

/**
 * Outcome of one {@link SandboxedExecutor#execute} call: the audit record plus the captured
 * (possibly truncated) output, which is not part of the audit trail.
 */
public record HookExecution(HookExecutionRecord record, String stdout, String stderr) {

    public HookExecution {
        Objects.requireNonNull(record, "record must not be null");
        stdout = stdout != null ? stdout : "";
        stderr = stderr != null ? stderr : "";
    }

    public boolean succeeded() {
        return record.status().isSuccess();
    }
}
