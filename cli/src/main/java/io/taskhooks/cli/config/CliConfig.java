package io.taskhooks.cli.config;

import io.taskhooks.core.audit.JsonlAuditLog;
import io.taskhooks.core.detect.ChangeDetector;
import io.taskhooks.core.exec.ExecutorSettings;
import io.taskhooks.core.metrics.HealthCheck;
import io.taskhooks.core.snapshot.SnapshotParser;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Root configuration of the {@code taskhooks} command line.
 *
 * <p>
 * Every field has a default. Use {@link #builder()} to construct instances. Relative paths are
 * resolved against {@code projectRoot} with {@link #resolve(String)}.
 *
 * @param projectRoot        repository root (default {@code .})
 * @param tasksDir           directory holding work-item documents, relative to the root
 * @param trackedPrefix      identifier prefix of tracked work items
 * @param terminalStatus     status that marks a work item completed
 * @param hooksConfig        hooks configuration file
 * @param scriptsDir         base directory for hook scripts
 * @param passthroughEnv     parent environment variables exposed to hooks
 * @param terminationGraceMs wait between SIGTERM and SIGKILL for timed-out hooks
 * @param maxOutputBytes     captured output per stream
 * @param auditFile          audit log file
 * @param auditMaxBytes      rotation threshold
 * @param auditMaxGenerations rotated files kept
 * @param metricsDir         metrics window directory
 * @param metricsPeriodMinutes metrics window length
 * @param minSuccessRate     health threshold
 * @param nearTimeoutRatio   health threshold
 * @param loggingFormat      {@code text} or {@code json}
 * @param loggingLevel       root log level
 */
public record CliConfig(
        String projectRoot,
        String tasksDir,
        String trackedPrefix,
        String terminalStatus,
        String hooksConfig,
        String scriptsDir,
        List<String> passthroughEnv,
        long terminationGraceMs,
        int maxOutputBytes,
        String auditFile,
        long auditMaxBytes,
        int auditMaxGenerations,
        String metricsDir,
        int metricsPeriodMinutes,
        double minSuccessRate,
        double nearTimeoutRatio,
        String loggingFormat,
        String loggingLevel) {

    public CliConfig {
        Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        passthroughEnv = List.copyOf(passthroughEnv);
    }

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    public Path projectRootPath() {
        return Path.of(projectRoot).toAbsolutePath().normalize();
    }

    /** Resolves a configured path against the project root. */
    public Path resolve(String path) {
        return projectRootPath().resolve(path).normalize();
    }

    /** Builder for {@link CliConfig}. */
    public static final class Builder {

        private String projectRoot = ".";
        private String tasksDir = "backlog/tasks";
        private String trackedPrefix = SnapshotParser.DEFAULT_PREFIX;
        private String terminalStatus = ChangeDetector.DEFAULT_TERMINAL_STATUS;
        private String hooksConfig = ".taskhooks/hooks/hooks.yaml";
        private String scriptsDir = ExecutorSettings.DEFAULT_HOOKS_DIRECTORY;
        private List<String> passthroughEnv = ExecutorSettings.DEFAULT_PASSTHROUGH;
        private long terminationGraceMs = ExecutorSettings.DEFAULT_TERMINATION_GRACE.toMillis();
        private int maxOutputBytes = ExecutorSettings.DEFAULT_MAX_OUTPUT_BYTES;
        private String auditFile = ".taskhooks/audit/audit.log";
        private long auditMaxBytes = JsonlAuditLog.DEFAULT_MAX_BYTES;
        private int auditMaxGenerations = JsonlAuditLog.DEFAULT_MAX_GENERATIONS;
        private String metricsDir = ".taskhooks/metrics";
        private int metricsPeriodMinutes = 60;
        private double minSuccessRate = HealthCheck.DEFAULT_MIN_SUCCESS_RATE;
        private double nearTimeoutRatio = HealthCheck.DEFAULT_NEAR_TIMEOUT_RATIO;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        private Builder() {}

        public Builder projectRoot(String projectRoot) {
            this.projectRoot = projectRoot;
            return this;
        }

        public Builder tasksDir(String tasksDir) {
            this.tasksDir = tasksDir;
            return this;
        }

        public Builder trackedPrefix(String trackedPrefix) {
            this.trackedPrefix = trackedPrefix;
            return this;
        }

        public Builder terminalStatus(String terminalStatus) {
            this.terminalStatus = terminalStatus;
            return this;
        }

        public Builder hooksConfig(String hooksConfig) {
            this.hooksConfig = hooksConfig;
            return this;
        }

        public Builder scriptsDir(String scriptsDir) {
            this.scriptsDir = scriptsDir;
            return this;
        }

        public Builder passthroughEnv(List<String> passthroughEnv) {
            this.passthroughEnv = passthroughEnv;
            return this;
        }

        public Builder terminationGraceMs(long terminationGraceMs) {
            this.terminationGraceMs = terminationGraceMs;
            return this;
        }

        public Builder maxOutputBytes(int maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
            return this;
        }

        public Builder auditFile(String auditFile) {
            this.auditFile = auditFile;
            return this;
        }

        public Builder auditMaxBytes(long auditMaxBytes) {
            this.auditMaxBytes = auditMaxBytes;
            return this;
        }

        public Builder auditMaxGenerations(int auditMaxGenerations) {
            this.auditMaxGenerations = auditMaxGenerations;
            return this;
        }

        public Builder metricsDir(String metricsDir) {
            this.metricsDir = metricsDir;
            return this;
        }

        public Builder metricsPeriodMinutes(int metricsPeriodMinutes) {
            this.metricsPeriodMinutes = metricsPeriodMinutes;
            return this;
        }

        public Builder minSuccessRate(double minSuccessRate) {
            this.minSuccessRate = minSuccessRate;
            return this;
        }

        public Builder nearTimeoutRatio(double nearTimeoutRatio) {
            this.nearTimeoutRatio = nearTimeoutRatio;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CliConfig build() {
            return new CliConfig(
                    projectRoot,
                    tasksDir,
                    trackedPrefix,
                    terminalStatus,
                    hooksConfig,
                    scriptsDir,
                    passthroughEnv,
                    terminationGraceMs,
                    maxOutputBytes,
                    auditFile,
                    auditMaxBytes,
                    auditMaxGenerations,
                    metricsDir,
                    metricsPeriodMinutes,
                    minSuccessRate,
                    nearTimeoutRatio,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
