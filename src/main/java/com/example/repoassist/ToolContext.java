package com.example.repoassist;

/** What a tool call needs from its request: the leased snapshot, the evidence set and the session. */
public class ToolContext {

    private final String toolCallId;
    private final RepositorySnapshot snapshot;
    private final EvidenceSet evidence;
    private final ExternalItemCache externalCache;

    public ToolContext(String toolCallId, RepositorySnapshot snapshot, EvidenceSet evidence, ExternalItemCache externalCache) {
        this.toolCallId = toolCallId;
        this.snapshot = snapshot;
        this.evidence = evidence;
        this.externalCache = externalCache;
    }

    public String getToolCallId() { return toolCallId; }
    public RepositorySnapshot getSnapshot() { return snapshot; }
    public EvidenceSet getEvidence() { return evidence; }
    public ExternalItemCache getExternalCache() { return externalCache; }
}
