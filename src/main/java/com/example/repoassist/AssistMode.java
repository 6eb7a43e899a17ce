package com.example.repoassist;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/** Answer style requested by the caller. */
public enum AssistMode {
    EXPLAIN("Provide a thorough explanation. Reference specific file paths and line numbers."),
    LOCATE("Identify exactly which files and line ranges implement the requested functionality. "
            + "List locations first, brief explanation second."),
    SUGGEST("Suggest concrete next development steps, each with an impact label (high/medium/low) and an "
            + "effort label (high/medium/low). End with a 'Next Actions' list."),
    PATCH("Propose a code change that addresses the request. Output the change as a unified diff in a "
            + "```diff block after your explanation.");

    private final String instructions;

    AssistMode(String instructions) {
        this.instructions = instructions;
    }

    public String getInstructions() {
        return instructions;
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AssistMode parse(String value) {
        if (value == null || value.isBlank()) return EXPLAIN;
        try {
            return AssistMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("mode must be one of explain, locate, suggest, patch: " + value);
        }
    }
}
