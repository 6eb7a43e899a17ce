package com.example.repoassist;

import java.util.Locale;

/** Intent categories a query can be classified into. */
public enum Intent {
    LOCATE("location / feature finding"),
    OVERVIEW("overview / explanation"),
    PRIORITIZE("prioritization over issues and pull requests"),
    SUGGEST("suggestions / next steps"),
    PATCH("patch request");

    private final String description;

    Intent(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse a classifier label. Accepts the enum name and a few synonyms; returns null when the
     * label is not recognised.
     */
    public static Intent fromLabel(String label) {
        if (label == null) return null;
        String l = label.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z_]", "");
        switch (l) {
            case "LOCATE":
            case "LOCATION":
            case "FEATURE":
            case "FIND":
                return LOCATE;
            case "OVERVIEW":
            case "EXPLAIN":
                return OVERVIEW;
            case "PRIORITIZE":
            case "PRIORITIZATION":
            case "PRIORITISE":
                return PRIORITIZE;
            case "SUGGEST":
            case "SUGGESTION":
            case "NEXT_STEPS":
                return SUGGEST;
            case "PATCH":
                return PATCH;
            default:
                return null;
        }
    }
}
