package com.example.repoassist;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EvidenceKind {
    CHUNK("chunk"),
    FILE_RANGE("file_range"),
    ISSUE("issue"),
    PULL_REQUEST("pull_request"),
    FILE_SUMMARY("file_summary");

    private final String label;

    EvidenceKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /** Evidence that points into repository files rather than the code host. */
    public boolean isRepositoryContent() {
        return this == CHUNK || this == FILE_RANGE || this == FILE_SUMMARY;
    }
}
