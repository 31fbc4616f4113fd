package com.softcheck.analysis;

/**
 * Kinds of {@link AnalysisError}.
 */
public enum ErrorKind {
    TYPE_MISMATCH,
    BAD_CALL,
    ILLEGAL_EXPRESSION,
    AMBIGUOUS_COLUMN_ACCESS,
    UNRESOLVED_CORRELATION_NAME,
    DUPLICATE_TABLE_NAME
}
