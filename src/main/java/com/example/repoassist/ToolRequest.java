package com.example.repoassist;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of one tool invocation. The {@link ToolName} tags which fields are meaningful;
 * instances are only created through the four factories.
 */
public final class ToolRequest {

    private final ToolName name;
    private final String query;
    private final SearchFilters filters;
    private final String path;
    private final int startLine;
    private final int endLine;
    private final ExternalQuery externalQuery;

    private ToolRequest(ToolName name, String query, SearchFilters filters, String path, int startLine,
                        int endLine, ExternalQuery externalQuery) {
        this.name = name;
        this.query = query;
        this.filters = filters;
        this.path = path;
        this.startLine = startLine;
        this.endLine = endLine;
        this.externalQuery = externalQuery;
    }

    public static ToolRequest searchRepo(String query, SearchFilters filters) {
        return new ToolRequest(ToolName.SEARCH_REPO, query, filters == null ? SearchFilters.NONE : filters,
                null, 0, 0, null);
    }

    public static ToolRequest openFile(String path, int startLine, int endLine) {
        return new ToolRequest(ToolName.OPEN_FILE, null, null, path, startLine, endLine, null);
    }

    public static ToolRequest getIssue(ExternalQuery q) {
        return new ToolRequest(ToolName.GET_ISSUE, q.getQuery(), null, null, 0, 0, q);
    }

    public static ToolRequest getPullRequests(ExternalQuery q) {
        return new ToolRequest(ToolName.GET_PULL_REQUESTS, q.getQuery(), null, null, 0, 0, q);
    }

    public ToolName getName() { return name; }
    public String getQuery() { return query; }
    public SearchFilters getFilters() { return filters; }
    public String getPath() { return path; }
    public int getStartLine() { return startLine; }
    public int getEndLine() { return endLine; }
    public ExternalQuery getExternalQuery() { return externalQuery; }

    /** Parameters as a flat map for traces and logs. */
    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        switch (name) {
            case SEARCH_REPO:
                out.put("query", query);
                out.putAll(filters.describe());
                break;
            case OPEN_FILE:
                out.put("path", path);
                out.put("startLine", startLine);
                out.put("endLine", endLine);
                break;
            case GET_ISSUE:
            case GET_PULL_REQUESTS:
                out.put("query", externalQuery.getQuery());
                out.put("state", externalQuery.getState().name().toLowerCase());
                out.put("labels", externalQuery.getLabels());
                out.put("limit", externalQuery.getLimit());
                break;
            default:
                throw new IllegalStateException("unknown tool " + name);
        }
        return out;
    }

    @Override
    public String toString() {
        return name.wireName() + describe();
    }
}
