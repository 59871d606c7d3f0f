package com.wingman.core.error;

/**
 * Recovered conditions reported next to the model instead of aborting the sync.
 */
public enum DiagnosticKind {
    MALFORMED_RECORD,
    SCHEMA_MISMATCH,
    MISSING_CATEGORY,
    MISSION_FILE_NOT_FOUND,
    ANNOTATION_STORE_CORRUPT,
    STATISTIC_DISCREPANCY
}
