package com.example.repoassist;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AssistScope {
    FILES_ONLY,
    INCLUDE_PR;

    @JsonValue
    public String label() {
        return this == FILES_ONLY ? "files-only" : "include-pr";
    }

    public boolean allowsExternal() {
        return this == INCLUDE_PR;
    }

    public static AssistScope parse(String value) {
        if (value == null || value.isBlank()) return INCLUDE_PR;
        String v = value.trim().toLowerCase(Locale.ROOT);
        if ("files-only".equals(v) || "files_only".equals(v)) return FILES_ONLY;
        if ("include-pr".equals(v) || "include_pr".equals(v)) return INCLUDE_PR;
        throw new IllegalArgumentException("scope must be files-only or include-pr: " + value);
    }
}
