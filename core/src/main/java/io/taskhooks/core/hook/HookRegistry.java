package io.taskhooks.core.hook;

import io.taskhooks.core.model.HookDefinition;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable set of configured hooks in declaration order.
 *
 * <p>
 * Built once per run by {@link HooksConfigParser} and never mutated afterwards. Thread-safe: all
 * fields are final and the hook list is unmodifiable.
 */
public final class HookRegistry {

    private static final HookRegistry EMPTY = new HookRegistry("1.0", HookDefaults.standard(), List.of(), null);

    private final String version;
    private final HookDefaults defaults;
    private final List<HookDefinition> hooks;
    private final String source;

    private HookRegistry(String version, HookDefaults defaults, List<HookDefinition> hooks, String source) {
        this.version = version;
        this.defaults = defaults;
        this.hooks = List.copyOf(hooks);
        this.source = source;
    }

    /** A registry with no hooks; every event dispatches to nothing. */
    public static HookRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String version() {
        return version;
    }

    public HookDefaults defaults() {
        return defaults;
    }

    /** All hooks, enabled or not, in declaration order. */
    public List<HookDefinition> hooks() {
        return hooks;
    }

    public Optional<HookDefinition> find(String name) {
        for (HookDefinition hook : hooks) {
            if (hook.name().equals(name)) {
                return Optional.of(hook);
            }
        }
        return Optional.empty();
    }

    /** Where the registry was loaded from, or null for programmatic registries. */
    public String source() {
        return source;
    }

    public int size() {
        return hooks.size();
    }

    public boolean isEmpty() {
        return hooks.isEmpty();
    }

    /**
     * Builder for incremental construction. Rejects duplicate hook names.
     */
    public static final class Builder {

        private String version = "1.0";
        private HookDefaults defaults = HookDefaults.standard();
        private final List<HookDefinition> hooks = new ArrayList<>();
        private String source;

        private Builder() {}

        public Builder version(String version) {
            this.version = Objects.requireNonNull(version, "version must not be null");
            return this;
        }

        public Builder defaults(HookDefaults defaults) {
            this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a hook with the same name was already added
         */
        public Builder hook(HookDefinition hook) {
            Objects.requireNonNull(hook, "hook must not be null");
            for (HookDefinition existing : hooks) {
                if (existing.name().equals(hook.name())) {
                    throw new IllegalArgumentException("Duplicate hook name: '" + hook.name() + "'");
                }
            }
            hooks.add(hook);
            return this;
        }

        public HookRegistry build() {
            return new HookRegistry(version, defaults, hooks, source);
        }
    }
}
