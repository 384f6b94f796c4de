package io.taskhooks.cli.scaffold;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a starter hooks configuration, example scripts and a README from the bundled
 * {@code /scaffold/} templates.
 *
 * <p>
 * Existing files are never overwritten, so running it twice is harmless.
 */
public final class HookScaffolder {

    private static final Logger LOG = LoggerFactory.getLogger(HookScaffolder.class);

    static final String TEMPLATE_ROOT = "/scaffold/";
    static final String CONFIG_TEMPLATE = "hooks.yaml";
    static final List<String> SCRIPT_TEMPLATES =
            List.of("log-event.sh", "run-tests.sh", "update-changelog.sh", "quality-gate.sh");
    static final String README_TEMPLATE = "README.md";

    private final Path hooksFile;
    private final Path scriptsDirectory;

    /**
     * @param hooksFile        where the configuration goes
     * @param scriptsDirectory where the example scripts and README go
     */
    public HookScaffolder(Path hooksFile, Path scriptsDirectory) {
        this.hooksFile = Objects.requireNonNull(hooksFile, "hooksFile must not be null");
        this.scriptsDirectory = Objects.requireNonNull(scriptsDirectory, "scriptsDirectory must not be null");
    }

    /**
     * Writes whatever is missing.
     *
     * @param enabled {@code false} writes every example hook disabled
     * @return the files created, in write order; empty if everything already existed
     * @throws UncheckedIOException if a file cannot be written
     */
    public List<Path> scaffold(boolean enabled) {
        List<Path> created = new ArrayList<>();
        String config = template(CONFIG_TEMPLATE);
        if (!enabled) {
            config = config.replace("enabled: true", "enabled: false");
        }
        write(hooksFile, config, false, created);
        for (String script : SCRIPT_TEMPLATES) {
            write(scriptsDirectory.resolve(script), template(script), true, created);
        }
        write(scriptsDirectory.resolve(README_TEMPLATE), template(README_TEMPLATE), false, created);
        return created;
    }

    private static void write(Path target, String content, boolean executable, List<Path> created) {
        if (Files.exists(target)) {
            LOG.info("Keeping existing {}", target);
            return;
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
            if (executable && FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rwxr-xr-x"));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        LOG.debug("Created {}", target);
        created.add(target);
    }

    static String template(String name) {
        String resource = TEMPLATE_ROOT + name;
        try (InputStream in = HookScaffolder.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Bundled template not found on classpath: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled template " + resource, e);
        }
    }
}
