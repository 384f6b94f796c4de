package io.taskhooks.core.audit;

import java.util.List;

/**
 * Result of {@link AuditLogReader#verify()}.
 *
 * @param entriesChecked number of lines examined
 * @param problems       one message per broken link, tampered entry or malformed line
 */
public record ChainVerification(int entriesChecked, List<String> problems) {

    public ChainVerification {
        problems = List.copyOf(problems);
    }

    public boolean intact() {
        return problems.isEmpty();
    }
}
