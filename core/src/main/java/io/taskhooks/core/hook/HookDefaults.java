package io.taskhooks.core.hook;

import io.taskhooks.core.model.FailMode;
import java.time.Duration;
import java.util.Objects;

/**
 * The {@code defaults} block of {@code hooks.yaml}, merged into every hook that does not override
 * a value.
 *
 * @param timeout          default execution limit (30 s)
 * @param workingDirectory default working directory relative to the project root ({@code .})
 * @param shell            shell for string commands ({@code /bin/sh})
 * @param failMode         default fail mode ({@code continue})
 * @param enabled          whether hooks are enabled unless stated otherwise
 */
public record HookDefaults(
        Duration timeout, String workingDirectory, String shell, FailMode failMode, boolean enabled) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration MAX_TIMEOUT = Duration.ofSeconds(600);
    public static final String DEFAULT_WORKING_DIRECTORY = ".";
    public static final String DEFAULT_SHELL = "/bin/sh";

    private static final HookDefaults STANDARD = new HookDefaults(
            DEFAULT_TIMEOUT, DEFAULT_WORKING_DIRECTORY, DEFAULT_SHELL, FailMode.CONTINUE, true);

    public HookDefaults {
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(workingDirectory, "workingDirectory must not be null");
        Objects.requireNonNull(shell, "shell must not be null");
        Objects.requireNonNull(failMode, "failMode must not be null");
    }

    public static HookDefaults standard() {
        return STANDARD;
    }
}
