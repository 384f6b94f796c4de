package io.taskhooks.core.testkit;

import io.taskhooks.core.model.ExecutionStatus;
import io.taskhooks.core.model.FailMode;
import io.taskhooks.core.model.HookExecutionRecord;
import io.taskhooks.core.model.HookExecutionRecord.EventRef;
import io.taskhooks.core.model.HookExecutionRecord.Execution;
import io.taskhooks.core.model.HookExecutionRecord.HookRef;
import io.taskhooks.core.model.HookExecutionRecord.Output;
import io.taskhooks.core.model.HookExecutionRecord.Security;
import java.time.Instant;
import java.util.List;

/** Builds execution records without running anything. */
public final class ExecutionRecords {

    public static final long TIMEOUT_MS = 30_000;

    private ExecutionRecords() {}

    public static HookExecutionRecord record(
            String hookName, String eventType, ExecutionStatus status, long durationMs, Instant at) {
        boolean ok = status == ExecutionStatus.SUCCESS;
        Integer exitCode = exitCodeFor(status);
        return new HookExecutionRecord(
                HookExecutionRecord.TYPE_EXECUTION,
                at,
                new HookRef(hookName, "command", "echo " + hookName, null, FailMode.CONTINUE),
                new EventRef("evt_" + hookName + "_" + at.toEpochMilli(), eventType),
                new Execution(status, exitCode, durationMs, at.minusMillis(durationMs), at, TIMEOUT_MS, "/repo", true),
                new Output(1, 0, false, false),
                Security.passed(List.of()),
                null,
                ok ? null : "exited with code " + exitCode);
    }

    public static HookExecutionRecord success(String hookName, long durationMs, Instant at) {
        return record(hookName, "task.completed", ExecutionStatus.SUCCESS, durationMs, at);
    }

    private static Integer exitCodeFor(ExecutionStatus status) {
        if (status == ExecutionStatus.SUCCESS) {
            return 0;
        }
        if (status == ExecutionStatus.FAILED) {
            return 1;
        }
        return status == ExecutionStatus.ERROR ? 137 : null;
    }
}
