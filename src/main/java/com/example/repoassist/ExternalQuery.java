package com.example.repoassist;

import java.util.Collection;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;

import lombok.Value;

/** Filters for an issue or pull request lookup. */
@Value
public class ExternalQuery {

    public enum StateFilter {
        OPEN, CLOSED, MERGED, ALL;

        public static StateFilter parse(String value) {
            if (value == null || value.isBlank()) return OPEN;
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("state must be open, closed, merged or all: " + value);
            }
        }

        public boolean accepts(ItemState state) {
            return this == ALL || name().equals(state.name());
        }
    }

    String query;
    StateFilter state;
    SortedSet<String> labels;
    int limit;

    public ExternalQuery(String query, StateFilter state, Collection<String> labels, int limit) {
        this.query = query == null ? "" : query.trim();
        this.state = state == null ? StateFilter.OPEN : state;
        this.labels = labels == null ? new TreeSet<>() : new TreeSet<>(labels);
        if (limit < 1) throw new IllegalArgumentException("limit must be positive");
        this.limit = limit;
    }

    /** Session cache key: query, state and labels; the limit is not part of it. */
    public String cacheKey() {
        return query.toLowerCase(Locale.ROOT) + "|" + state + "|" + String.join(",", labels);
    }

    /** Case-insensitive match of the free-text query against title and body. */
    public boolean matchesText(String title, String body) {
        if (query.isEmpty()) return true;
        String q = query.toLowerCase(Locale.ROOT);
        if (title != null && title.toLowerCase(Locale.ROOT).contains(q)) return true;
        if (body != null && body.toLowerCase(Locale.ROOT).contains(q)) return true;
        // fall back to any query term, so "login bug" still finds "Login fails"
        for (String term : Tokenizer.queryTerms(query)) {
            if (Tokenizer.tokens(title).contains(term) || Tokenizer.tokens(body).contains(term)) return true;
        }
        return false;
    }
}
