package io.taskhooks.core.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists metrics windows as one JSON document per window ({@code metrics-<start>.json}).
 *
 * <p>
 * The open window is rewritten on each refresh. A completed window is left alone once its file
 * matches the aggregate, so a file last written while its window was still open (or by a refresh
 * that failed part way) is brought up to date the next time it is seen.
 */
public final class MetricsStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsStore.class);

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
    private static final String PREFIX = "metrics-";
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final MetricsCodec codec = new MetricsCodec(mapper);

    public MetricsStore(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public Path directory() {
        return directory;
    }

    /**
     * Writes the given windows.
     *
     * @return number of files written
     */
    public int refresh(List<MetricsWindow> windows) {
        Instant now = clock.instant();
        int written = 0;
        try {
            Files.createDirectories(directory);
            for (MetricsWindow window : windows) {
                Path target = fileFor(window.periodStart());
                if (window.isCompleteAt(now) && window.equals(stored(target))) {
                    continue;
                }
                Path temp = Files.createTempFile(directory, PREFIX, ".tmp");
                mapper.writeValue(temp.toFile(), codec.toNode(window));
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                written++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write metrics to " + directory, e);
        }
        LOG.debug("Metrics refresh wrote {} window file(s) to {}", written, directory);
        return written;
    }

    // null when absent or unreadable
    private MetricsWindow stored(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return codec.fromNode(mapper.readTree(file.toFile()));
        } catch (IOException | RuntimeException e) {
            LOG.warn("Rewriting unreadable metrics file {}: {}", file, e.getMessage());
            return null;
        }
    }

    /** Removes every stored window, for a full rebuild from the audit log. */
    public void clear() {
        for (Path file : files()) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete " + file, e);
            }
        }
    }

    /** All stored windows, oldest first. Unreadable files are skipped with a warning. */
    public List<MetricsWindow> load() {
        List<MetricsWindow> windows = new ArrayList<>();
        for (Path file : files()) {
            try {
                windows.add(codec.fromNode(mapper.readTree(file.toFile())));
            } catch (IOException | RuntimeException e) {
                LOG.warn("Skipping unreadable metrics file {}: {}", file, e.getMessage());
            }
        }
        windows.sort(Comparator.comparing(MetricsWindow::periodStart));
        return windows;
    }

    /** The most recent {@code count} stored windows, oldest first. */
    public List<MetricsWindow> history(int count) {
        List<MetricsWindow> all = load();
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    Path fileFor(Instant periodStart) {
        return directory.resolve(PREFIX + FILE_STAMP.format(periodStart) + SUFFIX);
    }

    private List<Path> files() {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, PREFIX + "*" + SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list metrics directory " + directory, e);
        }
        files.sort(Comparator.naturalOrder());
        return files;
    }
}
