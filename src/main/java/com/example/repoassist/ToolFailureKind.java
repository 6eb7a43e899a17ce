package com.example.repoassist;

public enum ToolFailureKind {
    BAD_ARGUMENTS,
    NOT_FOUND,
    OUT_OF_RANGE,
    NOT_TEXT,
    REMOTE_FETCH,
    DISCARDED
}
