package com.example.repoassist;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResponseStatus {
    ANSWERED("answered"),
    INSUFFICIENT("insufficient"),
    FAILED("failed");

    private final String label;

    ResponseStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
