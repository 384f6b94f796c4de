package io.taskhooks.core.exec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Sandbox settings for {@link SandboxedExecutor}.
 *
 * <p>
 * Use {@link #builder(Path)} to construct with sensible defaults.
 *
 * @param projectRoot      absolute project root; working directories must stay inside it
 * @param hooksDirectory   base directory scripts are resolved against
 * @param passthroughEnv   parent environment variables copied into the child
 * @param maxOutputBytes   captured bytes per stream before truncation
 * @param terminationGrace wait between SIGTERM and SIGKILL after a timeout
 * @param parentEnv        lookup for the parent environment (usually {@link System#getenv(String)})
 */
public record ExecutorSettings(
        Path projectRoot,
        Path hooksDirectory,
        List<String> passthroughEnv,
        int maxOutputBytes,
        Duration terminationGrace,
        Function<String, String> parentEnv) {

    public static final List<String> DEFAULT_PASSTHROUGH = List.of("PATH", "HOME", "USER", "LANG", "LC_ALL");
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 1024 * 1024;
    public static final Duration DEFAULT_TERMINATION_GRACE = Duration.ofSeconds(5);
    public static final String DEFAULT_HOOKS_DIRECTORY = ".taskhooks/hooks";

    public ExecutorSettings {
        Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        Objects.requireNonNull(hooksDirectory, "hooksDirectory must not be null");
        Objects.requireNonNull(terminationGrace, "terminationGrace must not be null");
        Objects.requireNonNull(parentEnv, "parentEnv must not be null");
        projectRoot = projectRoot.toAbsolutePath().normalize();
        hooksDirectory = projectRoot.resolve(hooksDirectory).normalize();
        passthroughEnv = passthroughEnv != null ? List.copyOf(passthroughEnv) : DEFAULT_PASSTHROUGH;
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be positive, got: " + maxOutputBytes);
        }
    }

    public static Builder builder(Path projectRoot) {
        return new Builder(projectRoot);
    }

    /** Builder for {@link ExecutorSettings}. */
    public static final class Builder {
        private final Path projectRoot;
        private Path hooksDirectory = Path.of(DEFAULT_HOOKS_DIRECTORY);
        private List<String> passthroughEnv = DEFAULT_PASSTHROUGH;
        private int maxOutputBytes = DEFAULT_MAX_OUTPUT_BYTES;
        private Duration terminationGrace = DEFAULT_TERMINATION_GRACE;
        private Function<String, String> parentEnv = System::getenv;

        private Builder(Path projectRoot) {
            this.projectRoot = projectRoot;
        }

        /** Relative paths are resolved against the project root. */
        public Builder hooksDirectory(Path hooksDirectory) {
            this.hooksDirectory = hooksDirectory;
            return this;
        }

        public Builder passthroughEnv(List<String> passthroughEnv) {
            this.passthroughEnv = passthroughEnv;
            return this;
        }

        public Builder maxOutputBytes(int maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
            return this;
        }

        public Builder terminationGrace(Duration terminationGrace) {
            this.terminationGrace = terminationGrace;
            return this;
        }

        public Builder parentEnv(Function<String, String> parentEnv) {
            this.parentEnv = parentEnv;
            return this;
        }

        public ExecutorSettings build() {
            return new ExecutorSettings(
                    projectRoot, hooksDirectory, passthroughEnv, maxOutputBytes, terminationGrace, parentEnv);
        }
    }
}
