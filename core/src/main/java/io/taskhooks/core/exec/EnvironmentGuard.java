package io.taskhooks.core.exec;

import io.taskhooks.core.error.SecurityViolationException;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Validates hook-declared environment variables. Names must be plain identifiers and values must
 * not contain shell metacharacters ({@code ; | & $ ` ( ) < >}).
 */
public final class EnvironmentGuard {

    private static final Pattern NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
    private static final String METACHARACTERS = ";|&$`()<>";

    private EnvironmentGuard() {}

    /** @throws SecurityViolationException on the first offending entry */
    public static void check(String hookName, Map<String, String> env) {
        for (Map.Entry<String, String> entry : env.entrySet()) {
            if (!NAME.matcher(entry.getKey()).matches()) {
                throw new SecurityViolationException(
                        "Invalid environment variable name '" + entry.getKey() + "'", hookName, entry.getKey());
            }
            String value = entry.getValue();
            if (value == null) {
                continue;
            }
            for (int i = 0; i < value.length(); i++) {
                if (METACHARACTERS.indexOf(value.charAt(i)) >= 0) {
                    throw new SecurityViolationException(
                            String.format(
                                    "Environment variable '%s' contains shell metacharacter '%c'",
                                    entry.getKey(), value.charAt(i)),
                            hookName,
                            value);
                }
            }
        }
    }
}
