package com.example.repoassist;

import org.springframework.stereotype.Service;

/**
 * Citation catalog over the published repository and the session's code-host cache. Evidence
 * sets are opened per request against one snapshot; resolving an item checks that its epoch is
 * still the published one and refuses to map it onto newer content.
 */
@Service
public class EvidenceStore {

    private final IndexRegistry registry;

    public EvidenceStore(IndexRegistry registry) {
        this.registry = registry;
    }

    public EvidenceSet open(String requestId, RepositorySnapshot snapshot, ExternalItemCache externalCache) {
        return new EvidenceSet(requestId, snapshot.getEpoch(), externalCache);
    }

    public EvidenceItem get(EvidenceSet set, String id) {
        EvidenceItem item = set.get(id);
        if (item == null) {
            throw new EvidenceNotFoundException("No evidence " + id + " in request " + set.getRequestId());
        }
        return item;
    }

    /**
     * Resolve an item to the live object it cites: a {@link Chunk}, the cited text of a file range,
     * an {@link Issue}, a {@link PullRequest} or a {@link SourceFile}/{@link DirectoryNode} for
     * summaries.
     *
     * @throws CitationStaleException when the index was re-ingested since the item was gathered
     * @throws EvidenceNotFoundException when the cited object no longer exists
     */
    public Object resolveSource(EvidenceSet set, String id) {
        EvidenceItem item = get(set, id);
        RepositorySnapshot snapshot = registry.current();
        if (item.getEpoch() != snapshot.getEpoch()) {
            throw new CitationStaleException(id, item.getEpoch(), snapshot.getEpoch());
        }
        Object source;
        switch (item.getKind()) {
            case CHUNK:
                source = snapshot.chunk(item.getSourceRef());
                break;
            case FILE_RANGE: {
                SourceFile f = snapshot.file(item.getFilePath());
                source = f != null && item.getEndLine() <= f.getLineCount()
                        ? snapshot.linesOf(item.getFilePath(), item.getStartLine(), item.getEndLine())
                        : null;
                break;
            }
            case ISSUE:
                source = set.getExternalCache().issue(item.getExternalNumber());
                break;
            case PULL_REQUEST:
                source = set.getExternalCache().pullRequest(item.getExternalNumber());
                break;
            case FILE_SUMMARY: {
                SourceFile f = snapshot.file(item.getSourceRef());
                source = f != null ? f : snapshot.getTree().find(item.getSourceRef());
                break;
            }
            default:
                throw new IllegalStateException("unknown evidence kind " + item.getKind());
        }
        if (source == null) {
            throw new EvidenceNotFoundException("Source of " + id + " (" + item.location() + ") no longer exists");
        }
        return source;
    }
}
