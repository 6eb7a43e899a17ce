package com.example.repoassist;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control surface of a running request. Cancelling seals the request's evidence set, so tool
 * calls still in flight finish but their results are not merged.
 */
public class RequestHandle {

    private final String requestId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile EvidenceSet evidence;
    private volatile RequestState state = RequestState.IDLE;

    public RequestHandle(String requestId) {
        this.requestId = requestId;
    }

    void attach(EvidenceSet evidence) {
        this.evidence = evidence;
        if (cancelled.get()) evidence.seal();
    }

    public void cancel() {
        cancelled.set(true);
        EvidenceSet e = evidence;
        if (e != null) e.seal();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void setState(RequestState state) {
        this.state = state;
    }

    public RequestState getState() {
        return state;
    }

    public String getRequestId() {
        return requestId;
    }
}
