package io.taskhooks.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code taskhooks} command. Delegates to {@link TaskHooksCli} and exits with
 * its exit code; unexpected failures are logged and exit 1.
 */
public final class TaskHooksMain {

    private static final Logger LOG = LoggerFactory.getLogger(TaskHooksMain.class);

    private TaskHooksMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config taskhooks.yaml run})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new TaskHooksCli(System.out, System.err).run(args);
        } catch (Exception e) {
            LOG.error("taskhooks failed: {}", e.getMessage(), e);
            exitCode = 1;
        }
        System.exit(exitCode);
    }
}
