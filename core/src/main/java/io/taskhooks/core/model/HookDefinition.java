package io.taskhooks.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A fully resolved hook: configuration defaults already merged in.
 *
 * @param name             unique name ({@code [a-z0-9-]+})
 * @param description      free text, or null
 * @param matchers         event patterns with optional per-pattern filters; at least one
 * @param filter           hook-level filter applied in addition to any matcher filter
 * @param action           what to run
 * @param timeout          wall-clock limit for one execution
 * @param workingDirectory working directory relative to the project root, or null for the root
 * @param shell            shell used for string commands
 * @param env              additional environment variables exposed to the action
 * @param failMode         whether a failure blocks the triggering operation
 * @param enabled          disabled hooks never match
 */
public record HookDefinition(
        String name,
        String description,
        List<EventMatcher> matchers,
        ContextFilter filter,
        HookAction action,
        Duration timeout,
        String workingDirectory,
        String shell,
        Map<String, String> env,
        FailMode failMode,
        boolean enabled) {

    public HookDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(shell, "shell must not be null");
        Objects.requireNonNull(failMode, "failMode must not be null");
        matchers = matchers != null ? List.copyOf(matchers) : List.of();
        if (matchers.isEmpty()) {
            throw new IllegalArgumentException("Hook '" + name + "' must declare at least one event matcher");
        }
        filter = filter != null ? filter : ContextFilter.empty();
        env = env != null ? Collections.unmodifiableMap(new LinkedHashMap<>(env)) : Map.of();
    }

    /**
     * Returns {@code true} if this hook is enabled, any matcher accepts the event and the
     * hook-level filter holds.
     */
    public boolean matches(Event event) {
        if (!enabled || !filter.matches(event.context())) {
            return false;
        }
        for (EventMatcher matcher : matchers) {
            if (matcher.matches(event)) {
                return true;
            }
        }
        return false;
    }
}
