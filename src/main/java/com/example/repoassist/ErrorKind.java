package com.example.repoassist;

/** Structured error categories surfaced to callers of a failed request. */
public enum ErrorKind {
    CLASSIFICATION_FAILED,
    ORACLE_TIMEOUT,
    ORACLE_UNPARSEABLE,
    ORACLE_UNREACHABLE,
    CITATION_STALE,
    TOOL_GATEWAY_EXHAUSTED,
    CANCELLED,
    NO_REPOSITORY
}
