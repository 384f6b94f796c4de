package io.taskhooks.cli.command;

/** Process exit codes of the {@code taskhooks} command. */
public final class ExitCodes {

    public static final int OK = 0;

    /** Validation failure, unhealthy status, failed hook test or usage error. */
    public static final int FAILURE = 1;

    /** A fail-stop hook blocked the triggering operation. */
    public static final int BLOCKED = 2;

    /** Configuration could not be loaded. */
    public static final int CONFIGURATION_ERROR = 3;

    private ExitCodes() {}
}
