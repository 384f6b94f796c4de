package io.taskhooks.cli.command;

/** Thrown for malformed command lines. The CLI prints the message and usage, then exits 1. */
public final class UsageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public UsageException(String message) {
        super(message);
    }
}
