package io.taskhooks.core.model;

/**
 * What a hook failure means for the triggering operation.
 *
 * <ul>
 * <li>{@link #CONTINUE}: fail-open. Log a warning, run the remaining hooks, let the operation
 * succeed.
 * <li>{@link #STOP}: fail-stop. Skip the remaining hooks for the event and fail the operation.
 * </ul>
 */
public enum FailMode {
    CONTINUE("continue"),
    STOP("stop");

    private final String configValue;

    FailMode(String configValue) {
        this.configValue = configValue;
    }

    /** The value used in {@code hooks.yaml}. */
    public String configValue() {
        return configValue;
    }

    /**
     * Parses a configuration value.
     *
     * @throws IllegalArgumentException for anything other than {@code continue} or {@code stop}
     */
    public static FailMode fromConfig(String value) {
        for (FailMode mode : values()) {
            if (mode.configValue.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("fail_mode must be 'continue' or 'stop', got: '" + value + "'");
    }
}
