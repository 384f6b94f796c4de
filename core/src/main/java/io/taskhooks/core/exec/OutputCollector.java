package io.taskhooks.core.exec;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains one child output stream on a daemon thread. Counts every line but keeps at most
 * {@code limit} bytes of text.
 */
final class OutputCollector implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(OutputCollector.class);

    private final InputStream stream;
    private final int limit;
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private final Thread thread;

    private int lines;
    private boolean truncated;
    private boolean pendingLine;

    OutputCollector(InputStream stream, int limit, String name) {
        this.stream = stream;
        this.limit = limit;
        this.thread = new Thread(this, name);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    /** Waits for the stream to reach EOF; returns false if it is still open after the wait. */
    boolean await(long millis) throws InterruptedException {
        thread.join(millis);
        return !thread.isAlive();
    }

    @Override
    public void run() {
        byte[] buffer = new byte[8192];
        try (InputStream in = stream) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                consume(buffer, read);
            }
        } catch (IOException e) {
            LOG.debug("Output stream closed early: {}", e.getMessage());
        }
        synchronized (this) {
            if (pendingLine) {
                lines++;
                pendingLine = false;
            }
        }
    }

    private synchronized void consume(byte[] buffer, int length) {
        for (int i = 0; i < length; i++) {
            if (buffer[i] == '\n') {
                lines++;
                pendingLine = false;
            } else {
                pendingLine = true;
            }
        }
        int room = limit - captured.size();
        if (room >= length) {
            captured.write(buffer, 0, length);
        } else {
            if (room > 0) {
                captured.write(buffer, 0, room);
            }
            truncated = true;
        }
    }

    synchronized String text() {
        return captured.toString(StandardCharsets.UTF_8);
    }

    synchronized int lines() {
        return pendingLine ? lines + 1 : lines;
    }

    synchronized boolean truncated() {
        return truncated;
    }
}
