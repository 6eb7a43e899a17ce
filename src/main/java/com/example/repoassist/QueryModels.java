package com.example.repoassist;

import java.time.Instant;
import java.util.List;

public class QueryModels {

    public static class QueryRequest {
        private String query;
        private String mode;     // explain | locate | suggest | patch
        private String scope;    // files-only | include-pr
        private String sessionId; // optional; one-off session when absent

        public String getQuery() {
            return query;
        }
        public void setQuery(String query) {
            this.query = query;
        }
        public String getMode() {
            return mode;
        }
        public void setMode(String mode) {
            this.mode = mode;
        }
        public String getScope() {
            return scope;
        }
        public void setScope(String scope) {
            this.scope = scope;
        }
        public String getSessionId() {
            return sessionId;
        }
        public void setSessionId(String sessionId) {
            this.sessionId = sessionId;
        }
    }

    public static class SessionRequest {
        private String mode;
        private String scope;

        public String getMode() {
            return mode;
        }
        public void setMode(String mode) {
            this.mode = mode;
        }
        public String getScope() {
            return scope;
        }
        public void setScope(String scope) {
            this.scope = scope;
        }
    }

    public static class SessionView {
        private final String id;
        private final AssistMode mode;
        private final AssistScope scope;
        private final Instant createdAt;
        private final RequestState activeRequestState;
        private final List<Session.QueryRecord> history;

        public SessionView(Session s) {
            this.id = s.getId();
            this.mode = s.getMode();
            this.scope = s.getScope();
            this.createdAt = s.getCreatedAt();
            RequestHandle h = s.getActiveRequest();
            this.activeRequestState = h == null ? null : h.getState();
            this.history = s.history();
        }

        public String getId() { return id; }
        public AssistMode getMode() { return mode; }
        public AssistScope getScope() { return scope; }
        public Instant getCreatedAt() { return createdAt; }
        public RequestState getActiveRequestState() { return activeRequestState; }
        public List<Session.QueryRecord> getHistory() { return history; }
    }

    public static class ErrorResponse {
        private final int status;
        private final String error;
        private final String message;

        public ErrorResponse(int status, String error, String message) {
            this.status = status;
            this.error = error;
            this.message = message;
        }

        public int getStatus() { return status; }
        public String getError() { return error; }
        public String getMessage() { return message; }
    }
}
