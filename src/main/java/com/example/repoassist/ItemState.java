package com.example.repoassist;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/** State of an issue or pull request. {@link #MERGED} only applies to pull requests. */
public enum ItemState {
    OPEN,
    CLOSED,
    MERGED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
