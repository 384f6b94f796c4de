package io.taskhooks.core.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Flags well-known dangerous shell constructs in hook scripts. Findings are warnings only; they
 * never prevent execution.
 */
public final class ScriptContentScanner {

    private record Rule(Pattern pattern, String description) {}

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("(?m)rm\\s+-[a-zA-Z]*r[a-zA-Z]*f?[a-zA-Z]*\\s+/(\\s|$|\\*)"), "recursive delete of /"),
            new Rule(Pattern.compile(":\\(\\)\\s*\\{\\s*:\\s*\\|\\s*:\\s*&\\s*}\\s*;\\s*:"), "fork bomb"),
            new Rule(Pattern.compile("(curl|wget)[^|\\n]*\\|\\s*(ba|z|da)?sh\\b"), "piping a download into a shell"),
            new Rule(Pattern.compile("\\bdd\\s+[^\\n]*of=/dev/(sd|hd|nvme|disk)"), "raw disk write"),
            new Rule(Pattern.compile("\\bmkfs(\\.\\w+)?\\s"), "filesystem format"),
            new Rule(Pattern.compile("(?m)chmod\\s+(-R\\s+)?777\\s+/(\\s|$)"), "world-writable root"),
            new Rule(Pattern.compile(">\\s*/dev/(sd|hd|nvme)"), "overwriting a block device"),
            new Rule(Pattern.compile("\\beval\\s+\"?\\$\\("), "eval of command substitution"));

    private ScriptContentScanner() {}

    /** Returns one description per matched rule, in rule order. */
    public static List<String> scan(String content) {
        List<String> warnings = new ArrayList<>();
        for (Rule rule : RULES) {
            if (rule.pattern().matcher(content).find()) {
                warnings.add(rule.description());
            }
        }
        return warnings;
    }
}
