package com.example.repoassist;

import lombok.Builder;
import lombok.Value;

/**
 * The unit of citation. Items are created as drafts (no id, no epoch) by the tool gateway and
 * receive both when an {@link EvidenceSet} accepts them; after that they never change.
 */
@Value
@Builder(toBuilder = true)
public class EvidenceItem {
    String id;
    long epoch;
    EvidenceKind kind;
    /** Chunk id, "path#Ls-e" span, issue/PR number or summarized path, depending on kind. */
    String sourceRef;
    String filePath;
    Integer startLine;
    Integer endLine;
    Integer externalNumber;
    String displayText;
    String toolCallId;
    ToolName toolName;
    int rank;
    double score;

    /**
     * Key used to reject duplicate sources within one request. Chunks and opened ranges share
     * the span key, so opening exactly a chunk's lines reuses the chunk's item.
     */
    public String sourceKey() {
        switch (kind) {
            case CHUNK:
            case FILE_RANGE:
                return spanKey(filePath, startLine, endLine);
            case ISSUE:
                return "issue:" + externalNumber;
            case PULL_REQUEST:
                return "pr:" + externalNumber;
            case FILE_SUMMARY:
                return "summary:" + sourceRef;
            default:
                throw new IllegalStateException("unknown evidence kind " + kind);
        }
    }

    public static String spanKey(String path, int startLine, int endLine) {
        return "span:" + Chunk.idFor(path, startLine, endLine);
    }

    /** Short human-readable location, e.g. "src/auth/login.py:10-42" or "issue #12". */
    public String location() {
        switch (kind) {
            case CHUNK:
            case FILE_RANGE:
                return filePath + ":" + startLine + "-" + endLine;
            case ISSUE:
                return "issue #" + externalNumber;
            case PULL_REQUEST:
                return "pull request #" + externalNumber;
            case FILE_SUMMARY:
                return sourceRef + " (summary)";
            default:
                throw new IllegalStateException("unknown evidence kind " + kind);
        }
    }
}
