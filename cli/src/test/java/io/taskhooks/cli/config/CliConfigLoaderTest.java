package io.taskhooks.cli.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("CliConfigLoader")
class CliConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(CliConfigLoaderTest.class.getClassLoader().getResource("config/" + name).toURI());
    }

    @Nested
    @DisplayName("YAML file")
    class YamlFile {

        @Test
        void minimalConfigGetsDefaults() throws Exception {
            CliConfig config = CliConfigLoader.load(fixture("minimal-config.yaml"), true, NO_ENV::get);

            assertThat(config.tasksDir()).isEqualTo("tickets");
            assertThat(config.projectRoot()).isEqualTo(".");
            assertThat(config.trackedPrefix()).isEqualTo("task");
            assertThat(config.terminalStatus()).isEqualTo("Done");
            assertThat(config.hooksConfig()).isEqualTo(".taskhooks/hooks/hooks.yaml");
            assertThat(config.scriptsDir()).isEqualTo(".taskhooks/hooks");
            assertThat(config.passthroughEnv()).containsExactly("PATH", "HOME", "USER", "LANG", "LC_ALL");
            assertThat(config.auditFile()).isEqualTo(".taskhooks/audit/audit.log");
            assertThat(config.metricsDir()).isEqualTo(".taskhooks/metrics");
            assertThat(config.metricsPeriodMinutes()).isEqualTo(60);
            assertThat(config.minSuccessRate()).isEqualTo(0.95);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
        }

        @Test
        void fullConfigMapsEveryKey() throws Exception {
            CliConfig config = CliConfigLoader.load(fixture("full-config.yaml"), true, NO_ENV::get);

            assertThat(config.projectRoot()).isEqualTo("/srv/repo");
            assertThat(config.tasksDir()).isEqualTo("work/items");
            assertThat(config.trackedPrefix()).isEqualTo("story");
            assertThat(config.terminalStatus()).isEqualTo("Shipped");
            assertThat(config.hooksConfig()).isEqualTo("config/hooks.yaml");
            assertThat(config.scriptsDir()).isEqualTo("config/scripts");
            assertThat(config.passthroughEnv()).containsExactly("PATH", "TZ");
            assertThat(config.terminationGraceMs()).isEqualTo(1500);
            assertThat(config.maxOutputBytes()).isEqualTo(4096);
            assertThat(config.auditFile()).isEqualTo("var/audit.log");
            assertThat(config.auditMaxBytes()).isEqualTo(2048);
            assertThat(config.auditMaxGenerations()).isEqualTo(3);
            assertThat(config.metricsDir()).isEqualTo("var/metrics");
            assertThat(config.metricsPeriodMinutes()).isEqualTo(15);
            assertThat(config.minSuccessRate()).isEqualTo(0.9);
            assertThat(config.nearTimeoutRatio()).isEqualTo(0.5);
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.resolve("var/audit.log")).isEqualTo(Path.of("/srv/repo/var/audit.log"));
        }

        @Test
        void missingOptionalFileUsesDefaults(@TempDir Path dir) {
            CliConfig config = CliConfigLoader.load(dir.resolve("taskhooks.yaml"), false, NO_ENV::get);

            assertThat(config.tasksDir()).isEqualTo("backlog/tasks");
        }

        @Test
        void missingRequiredFileFails(@TempDir Path dir) {
            assertThatThrownBy(() -> CliConfigLoader.load(dir.resolve("nope.yaml"), true, NO_ENV::get))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessageStartingWith("Configuration file not found");
        }

        @Test
        void nonNumericValueFails(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("bad.yaml"), "audit:\n  max-bytes: lots\n");

            assertThatThrownBy(() -> CliConfigLoader.load(file, true, NO_ENV::get))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessageContaining("max-bytes");
        }

        @Test
        void scalarRootFails(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("bad.yaml"), "just a string\n");

            assertThatThrownBy(() -> CliConfigLoader.load(file, true, NO_ENV::get))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessageContaining("must be a mapping");
        }

        @Test
        void brokenYamlFails(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("bad.yaml"), "project: [unclosed\n");

            assertThatThrownBy(() -> CliConfigLoader.load(file, true, NO_ENV::get))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvOverlay {

        @Test
        void environmentWinsOverFile() throws Exception {
            Map<String, String> env = new HashMap<>();
            env.put("TASKHOOKS_TASKS_DIR", "from-env");
            env.put("TASKHOOKS_PASSTHROUGH_ENV", "PATH, HOME ,,");
            env.put("TASKHOOKS_AUDIT_MAX_GENERATIONS", " 9 ");
            env.put("TASKHOOKS_MIN_SUCCESS_RATE", "0.5");
            env.put("TASKHOOKS_LOG_LEVEL", "INFO");

            CliConfig config = CliConfigLoader.load(fixture("full-config.yaml"), true, env::get);

            assertThat(config.tasksDir()).isEqualTo("from-env");
            assertThat(config.passthroughEnv()).containsExactly("PATH", "HOME");
            assertThat(config.auditMaxGenerations()).isEqualTo(9);
            assertThat(config.minSuccessRate()).isEqualTo(0.5);
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.trackedPrefix()).isEqualTo("story");
        }

        @Test
        void blankVariablesAreIgnored() throws Exception {
            Map<String, String> env = Map.of("TASKHOOKS_TASKS_DIR", "   ", "TASKHOOKS_MAX_OUTPUT_BYTES", "");

            CliConfig config = CliConfigLoader.load(fixture("full-config.yaml"), true, env::get);

            assertThat(config.tasksDir()).isEqualTo("work/items");
            assertThat(config.maxOutputBytes()).isEqualTo(4096);
        }

        @Test
        void invalidNumberFails(@TempDir Path dir) {
            Map<String, String> env = Map.of("TASKHOOKS_METRICS_PERIOD_MINUTES", "hourly");

            assertThatThrownBy(() -> CliConfigLoader.load(dir.resolve("x.yaml"), false, env::get))
                    .isInstanceOf(CliConfigException.class)
                    .hasMessageContaining("TASKHOOKS_");
        }
    }

    @Nested
    @DisplayName("--config argument")
    class ConfigArgument {

        @Test
        void defaultsToTaskhooksYaml() {
            assertThat(CliConfigLoader.resolveConfigPath(new String[] {"run"})).isEqualTo(Path.of("taskhooks.yaml"));
            assertThat(CliConfigLoader.hasExplicitConfig(new String[] {"run"})).isFalse();
        }

        @Test
        void explicitPath() {
            String[] args = {"--config", "ci/taskhooks.yaml", "run"};

            assertThat(CliConfigLoader.resolveConfigPath(args)).isEqualTo(Path.of("ci/taskhooks.yaml"));
            assertThat(CliConfigLoader.hasExplicitConfig(args)).isTrue();
        }

        @Test
        void missingValueIsRejected() {
            assertThatThrownBy(() -> CliConfigLoader.resolveConfigPath(new String[] {"run", "--config"}))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void builderDefaultsMatchLoaderDefaults() {
        assertThat(CliConfig.builder().build().passthroughEnv()).isEqualTo(List.of("PATH", "HOME", "USER", "LANG", "LC_ALL"));
    }
}
