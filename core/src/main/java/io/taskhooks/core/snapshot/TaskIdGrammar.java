package io.taskhooks.core.snapshot;

import java.util.Comparator;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strict work-item identifier grammar: {@code <prefix>-<n>} or {@code <prefix>-<n>.<m>}.
 *
 * <p>
 * The prefix starts with a letter and is alphanumeric; numeric parts are decimal digits. The
 * whole string must match. {@code task-1}, {@code task-12.3} are valid; {@code task--1},
 * {@code task-1..2}, {@code task-1a}, {@code task-x} are not.
 *
 * <p>
 * {@link #ORDER} sorts identifiers by prefix and then numerically, so {@code task-2} sorts before
 * {@code task-10}, which sorts before {@code task-10.1}. Identifiers that differ only in prefix
 * case or leading zeros fall back to plain string order, so distinct ids never compare equal.
 */
public final class TaskIdGrammar {

    private static final Pattern ID = Pattern.compile("^([A-Za-z][A-Za-z0-9]*)-(\\d+)(?:\\.(\\d+))?$");

    /** Ascending identifier order with numeric segment comparison. */
    public static final Comparator<String> ORDER = TaskIdGrammar::compare;

    private TaskIdGrammar() {}

    /** Returns {@code true} if the identifier matches the grammar, whatever its prefix. */
    public static boolean isValid(String id) {
        return id != null && ID.matcher(id).matches();
    }

    /**
     * Returns {@code true} if the identifier matches the grammar and carries the given prefix
     * (case-insensitive).
     */
    public static boolean isTracked(String id, String prefix) {
        if (id == null) {
            return false;
        }
        Matcher m = ID.matcher(id);
        return m.matches() && m.group(1).equalsIgnoreCase(prefix);
    }

    static int compare(String a, String b) {
        Matcher ma = ID.matcher(a);
        Matcher mb = ID.matcher(b);
        if (!ma.matches() || !mb.matches()) {
            return a.compareTo(b);
        }
        int byPrefix = ma.group(1).toLowerCase(Locale.ROOT).compareTo(mb.group(1).toLowerCase(Locale.ROOT));
        if (byPrefix != 0) {
            return byPrefix;
        }
        int byMajor = compareDigits(ma.group(2), mb.group(2));
        if (byMajor != 0) {
            return byMajor;
        }
        String minorA = ma.group(3);
        String minorB = mb.group(3);
        if (minorA == null || minorB == null) {
            if (minorA != minorB) {
                return minorA == null ? -1 : 1;
            }
        } else {
            int byMinor = compareDigits(minorA, minorB);
            if (byMinor != 0) {
                return byMinor;
            }
        }
        // task-1, task-01 and Task-1 are distinct ids; keep the order consistent with equals
        return a.compareTo(b);
    }

    // Digit strings of arbitrary length, compared without overflow.
    private static int compareDigits(String a, String b) {
        String x = stripLeadingZeros(a);
        String y = stripLeadingZeros(b);
        if (x.length() != y.length()) {
            return Integer.compare(x.length(), y.length());
        }
        return x.compareTo(y);
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }
}
