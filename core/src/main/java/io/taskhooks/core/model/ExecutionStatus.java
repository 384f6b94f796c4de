package io.taskhooks.core.model;

import java.util.Locale;

/** Terminal status of one hook execution. */
public enum ExecutionStatus {
    /** Exit code 0. */
    SUCCESS,
    /** Non-zero exit code below the signal range. */
    FAILED,
    /** Wall-clock limit exceeded; the process was terminated. */
    TIMEOUT,
    /** Could not run or was killed by a signal, including security rejections. */
    ERROR;

    /** Lower-case name used in audit records and CLI filters. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExecutionStatus fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
