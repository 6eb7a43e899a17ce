package com.example.repoassist;

/**
 * Coarse classification of a repository file. Only {@link #BINARY} files are kept as metadata
 * without chunks.
 */
public enum FileKind {
    CODE,
    DOCS,
    CONFIG,
    OTHER_TEXT,
    BINARY;

    public boolean isText() {
        return this != BINARY;
    }
}
