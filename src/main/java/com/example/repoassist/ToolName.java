package com.example.repoassist;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolName {
    SEARCH_REPO("search_repo"),
    OPEN_FILE("open_file"),
    GET_ISSUE("get_issue"),
    GET_PULL_REQUESTS("get_pull_requests");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isExternal() {
        return this == GET_ISSUE || this == GET_PULL_REQUESTS;
    }

    public static ToolName fromWireName(String name) {
        for (ToolName t : values()) {
            if (t.wireName.equals(name)) return t;
        }
        throw new IllegalArgumentException("Unknown tool: " + name);
    }
}
