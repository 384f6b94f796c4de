package io.taskhooks.cli.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parsed arguments of one command: positionals, valued options ({@code --name value} or
 * {@code --name=value}, repeatable) and boolean flags. Unknown options are rejected.
 */
public final class CommandArgs {

    private final List<String> positionals;
    private final Map<String, List<String>> options;
    private final Set<String> flags;

    private CommandArgs(List<String> positionals, Map<String, List<String>> options, Set<String> flags) {
        this.positionals = Collections.unmodifiableList(positionals);
        this.options = options;
        this.flags = Collections.unmodifiableSet(flags);
    }

    /**
     * Parses a command's arguments.
     *
     * @param args          arguments after the command name
     * @param valuedOptions option names that take a value, including the leading {@code --}
     * @param flagOptions   option names that take no value
     * @throws UsageException on unknown options or a missing value
     */
    public static CommandArgs parse(List<String> args, Set<String> valuedOptions, Set<String> flagOptions) {
        List<String> positionals = new ArrayList<>();
        Map<String, List<String>> options = new LinkedHashMap<>();
        Set<String> flags = new HashSet<>();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (!arg.startsWith("--")) {
                positionals.add(arg);
                continue;
            }
            String name = arg;
            String value = null;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                name = arg.substring(0, eq);
                value = arg.substring(eq + 1);
            }
            if (flagOptions.contains(name)) {
                if (value != null) {
                    throw new UsageException(name + " does not take a value");
                }
                flags.add(name);
            } else if (valuedOptions.contains(name)) {
                if (value == null) {
                    if (i + 1 >= args.size()) {
                        throw new UsageException(name + " requires a value");
                    }
                    value = args.get(++i);
                }
                options.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            } else {
                throw new UsageException("Unknown option: " + name);
            }
        }
        return new CommandArgs(positionals, options, flags);
    }

    public List<String> positionals() {
        return positionals;
    }

    /** Positional at {@code index}; throws a {@link UsageException} naming it when absent. */
    public String requirePositional(int index, String name) {
        if (index >= positionals.size()) {
            throw new UsageException("Missing argument <" + name + ">");
        }
        return positionals.get(index);
    }

    public boolean flag(String name) {
        return flags.contains(name);
    }

    /** Last value given for the option, or {@code defaultValue}. */
    public String option(String name, String defaultValue) {
        List<String> values = options.get(name);
        return values == null ? defaultValue : values.get(values.size() - 1);
    }

    /** All values of a repeatable option, in order. */
    public List<String> options(String name) {
        return options.getOrDefault(name, List.of());
    }

    public int intOption(String name, int defaultValue) {
        String value = option(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(name + " expects an integer, got: " + value);
        }
    }

    public double doubleOption(String name, double defaultValue) {
        String value = option(name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException(name + " expects a number, got: " + value);
        }
    }
}
