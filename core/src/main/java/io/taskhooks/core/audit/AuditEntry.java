package io.taskhooks.core.audit;

import io.taskhooks.core.model.HookExecutionRecord;

/**
 * One parsed audit line with its chain fields and location.
 *
 * @param record    the decoded record
 * @param prevHash  hash of the preceding entry
 * @param entryHash hash of this entry
 * @param file      file name the line was read from
 * @param line      1-based line number within that file
 */
public record AuditEntry(HookExecutionRecord record, String prevHash, String entryHash, String file, int line) {}
