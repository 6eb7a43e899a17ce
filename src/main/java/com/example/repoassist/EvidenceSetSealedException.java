package com.example.repoassist;

/** Raised when a tool call finishes after its request was cancelled; the results are dropped. */
public class EvidenceSetSealedException extends RuntimeException {

    public EvidenceSetSealedException(String requestId) {
        super("Evidence set of request " + requestId + " is sealed");
    }
}
