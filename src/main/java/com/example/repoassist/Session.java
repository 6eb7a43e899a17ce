package com.example.repoassist;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import lombok.Value;

/**
 * Conversation scope passed into every request: default mode and scope, recent queries and the
 * issue/PR cache. One request runs at a time per session.
 */
public class Session {

    static final int MAX_HISTORY = 10;
    private static final int SUMMARY_CHARS = 300;

    @Value
    public static class QueryRecord {
        String query;
        String summary;
        ResponseStatus status;
        Instant at;
    }

    private final String id;
    private final Instant createdAt = Instant.now();
    private final ReentrantLock requestLock = new ReentrantLock();
    private final ExternalItemCache externalCache = new ExternalItemCache();
    private final Deque<QueryRecord> history = new ArrayDeque<>();
    private volatile AssistMode mode;
    private volatile AssistScope scope;
    private volatile RequestHandle activeRequest;

    public Session(String id, AssistMode mode, AssistScope scope) {
        this.id = id;
        this.mode = mode == null ? AssistMode.EXPLAIN : mode;
        this.scope = scope == null ? AssistScope.INCLUDE_PR : scope;
    }

    public synchronized void recordQuery(String query, String answer, ResponseStatus status) {
        String summary = answer == null ? "" : answer.length() > SUMMARY_CHARS ? answer.substring(0, SUMMARY_CHARS) : answer;
        history.addLast(new QueryRecord(query, summary, status, Instant.now()));
        while (history.size() > MAX_HISTORY) history.removeFirst();
    }

    public synchronized List<QueryRecord> history() {
        return new ArrayList<>(history);
    }

    public synchronized List<String> recentQueries() {
        List<String> out = new ArrayList<>();
        for (QueryRecord r : history) out.add(r.getQuery());
        return out;
    }

    /** Clears history and the issue/PR cache; settings are kept. */
    public synchronized void reset() {
        history.clear();
        externalCache.clear();
    }

    /** Cancels the running request, if any; returns whether there was one. */
    public boolean cancelActive() {
        RequestHandle h = activeRequest;
        if (h == null) return false;
        h.cancel();
        return true;
    }

    ReentrantLock getRequestLock() { return requestLock; }
    void setActiveRequest(RequestHandle handle) { this.activeRequest = handle; }

    public RequestHandle getActiveRequest() { return activeRequest; }
    public String getId() { return id; }
    public Instant getCreatedAt() { return createdAt; }
    public ExternalItemCache getExternalCache() { return externalCache; }
    public AssistMode getMode() { return mode; }
    public void setMode(AssistMode mode) { this.mode = mode; }
    public AssistScope getScope() { return scope; }
    public void setScope(AssistScope scope) { this.scope = scope; }
}
