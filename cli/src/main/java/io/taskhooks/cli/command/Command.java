package io.taskhooks.cli.command;

import java.util.List;

/** One {@code taskhooks} sub-command. */
public interface Command {

    /** Name used on the command line. */
    String name();

    /** One-line synopsis for the usage text. */
    String synopsis();

    /**
     * Runs the command.
     *
     * @param args    arguments after the command name
     * @param context shared configuration and factories
     * @return process exit code
     * @throws UsageException on malformed arguments
     */
    int execute(List<String> args, CommandContext context);
}
