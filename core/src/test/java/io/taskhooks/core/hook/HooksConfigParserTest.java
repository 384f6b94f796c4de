package io.taskhooks.core.hook;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.taskhooks.core.error.ConfigurationException;
import io.taskhooks.core.model.FailMode;
import io.taskhooks.core.model.HookAction;
import io.taskhooks.core.model.HookDefinition;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("HooksConfigParser")
class HooksConfigParserTest {

    private final HooksConfigParser parser = new HooksConfigParser();

    @Nested
    @DisplayName("Valid documents")
    class Valid {

        @Test
        void fullDocument() {
            HookRegistry registry = parser.parse(
                    """
                    version: "1.0"
                    defaults:
                      timeout: 20
                      fail_mode: stop
                      shell: /bin/bash
                    hooks:
                      - name: notify-done
                        description: Notify on completion
                        events:
                          - type: task.completed
                            filter:
                              labels_any: [backend]
                          - task.ac_checked
                        script: notify.sh
                        env:
                          CHANNEL: builds
                          RETRIES: 3
                      - name: lint
                        events: ["*"]
                        command: [make, lint]
                        timeout: 90
                        fail_mode: continue
                        enabled: false
                      - name: echo
                        events: ["task.*"]
                        command: echo hi
                    """,
                    "hooks.yaml");

            assertThat(registry.size()).isEqualTo(3);
            assertThat(registry.version()).isEqualTo("1.0");
            assertThat(registry.defaults().timeout()).isEqualTo(Duration.ofSeconds(20));

            HookDefinition notify = registry.find("notify-done").orElseThrow();
            assertThat(notify.description()).isEqualTo("Notify on completion");
            assertThat(notify.action()).isEqualTo(new HookAction.ScriptAction("notify.sh"));
            assertThat(notify.matchers()).hasSize(2);
            assertThat(notify.matchers().get(0).filter().isEmpty()).isFalse();
            assertThat(notify.timeout()).isEqualTo(Duration.ofSeconds(20));
            assertThat(notify.failMode()).isEqualTo(FailMode.STOP);
            assertThat(notify.shell()).isEqualTo("/bin/bash");
            assertThat(notify.env()).containsEntry("CHANNEL", "builds").containsEntry("RETRIES", "3");

            HookDefinition lint = registry.find("lint").orElseThrow();
            assertThat(lint.action()).isEqualTo(HookAction.CommandAction.argv(List.of("make", "lint")));
            assertThat(lint.timeout()).isEqualTo(Duration.ofSeconds(90));
            assertThat(lint.failMode()).isEqualTo(FailMode.CONTINUE);
            assertThat(lint.enabled()).isFalse();

            HookDefinition echo = registry.find("echo").orElseThrow();
            assertThat(((HookAction.CommandAction) echo.action()).usesShell()).isTrue();
        }

        @Test
        void defaultsApplyWhenOmitted() {
            HookDefinition hook = parser.parse(
                            "hooks:\n  - name: a\n    events: [task.created]\n    command: [\"true\"]\n", "inline")
                    .hooks()
                    .get(0);

            assertThat(hook.timeout()).isEqualTo(HookDefaults.DEFAULT_TIMEOUT);
            assertThat(hook.failMode()).isEqualTo(FailMode.CONTINUE);
            assertThat(hook.shell()).isEqualTo("/bin/sh");
            assertThat(hook.workingDirectory()).isEqualTo(".");
            assertThat(hook.enabled()).isTrue();
        }

        @Test
        void emptyDocumentIsEmptyRegistry() {
            assertThat(parser.parse("", "empty.yaml").isEmpty()).isTrue();
            assertThat(parser.parse("hooks:\n", "empty.yaml").isEmpty()).isTrue();
        }

        @Test
        void missingFileIsEmptyRegistry(@TempDir Path dir) {
            assertThat(parser.load(dir.resolve("hooks.yaml")).isEmpty()).isTrue();
        }

        @Test
        void loadReadsFile(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("hooks.yaml");
            Files.writeString(file, "hooks:\n  - name: a\n    events: [\"*\"]\n    command: echo\n");
            HookRegistry registry = parser.load(file);
            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.source()).isEqualTo(file.toString());
        }
    }

    @Nested
    @DisplayName("Invalid documents")
    class Invalid {

        @Test
        void malformedYaml() {
            assertThatThrownBy(() -> parser.parse("hooks: [unclosed", "bad.yaml"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Malformed YAML")
                    .satisfies(e -> assertThat(((ConfigurationException) e).source()).isEqualTo("bad.yaml"));
        }

        @Test
        void nonMappingRoot() {
            assertThatThrownBy(() -> parser.parse("- a\n- b\n", "list.yaml"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("mapping");
        }

        @Test
        void schemaViolationsAreCollected() {
            ConfigurationException e = catchConfig(
                    """
                    hooks:
                      - name: Bad_Name
                        events: []
                        command: echo
                        timeout: 900
                        fail_mode: sometimes
                    """);

            assertThat(e.errors()).hasSizeGreaterThanOrEqualTo(4);
            assertThat(e.errors()).anyMatch(m -> m.contains("timeout"));
            assertThat(e.errors()).anyMatch(m -> m.contains("name"));
        }

        @Test
        void unknownKeyIsRejected() {
            ConfigurationException e = catchConfig(
                    "hooks:\n  - name: a\n    events: [\"*\"]\n    command: echo\n    retries: 3\n");
            assertThat(e.errors()).anyMatch(m -> m.contains("retries"));
        }

        @Test
        void duplicateNames() {
            ConfigurationException e = catchConfig(
                    """
                    hooks:
                      - name: same
                        events: ["*"]
                        command: echo
                      - name: same
                        events: ["*"]
                        command: echo
                    """);
            assertThat(e.errors()).containsExactly("hooks[1]: duplicate hook name 'same'");
        }

        @Test
        void bothScriptAndCommand() {
            ConfigurationException e = catchConfig(
                    "hooks:\n  - name: a\n    events: [\"*\"]\n    command: echo\n    script: a.sh\n");
            assertThat(e.errors()).singleElement().asString().contains("exactly one of 'script' or 'command'");
        }

        @Test
        void neitherScriptNorCommand() {
            ConfigurationException e = catchConfig("hooks:\n  - name: a\n    events: [\"*\"]\n");
            assertThat(e.errors()).singleElement().asString().contains("exactly one");
        }

        @Test
        void badPatternIsReported() {
            ConfigurationException e = catchConfig(
                    "hooks:\n  - name: a\n    events: [\"ta*k.created\"]\n    command: echo\n");
            assertThat(e.errors()).singleElement().asString().contains("events[0]").contains("wildcard");
        }

        private ConfigurationException catchConfig(String yaml) {
            try {
                parser.parse(yaml, "hooks.yaml");
            } catch (ConfigurationException e) {
                assertThat(e.phase()).isEqualTo(ConfigurationException.Phase.LOAD);
                return e;
            }
            throw new AssertionError("expected ConfigurationException");
        }
    }
}
