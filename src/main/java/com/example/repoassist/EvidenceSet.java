package com.example.repoassist;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evidence gathered for a single request. Append-only: items are never replaced or removed, a
 * source already present maps back to its existing id, and iteration follows insertion
 * (provenance) order. Concurrent tool calls of one request share the set.
 */
public class EvidenceSet {

    private final String requestId;
    private final long epoch;
    private final ExternalItemCache externalCache;
    private final Map<String, EvidenceItem> items = new LinkedHashMap<>();
    private final Map<String, String> idsBySource = new HashMap<>();
    private boolean sealed;

    public EvidenceSet(String requestId, long epoch, ExternalItemCache externalCache) {
        this.requestId = requestId;
        this.epoch = epoch;
        this.externalCache = externalCache;
    }

    /** Adds a draft item and returns its id; idempotent on the item's source. */
    public synchronized String put(EvidenceItem draft) {
        return putAll(List.of(draft)).get(0);
    }

    /**
     * Adds all drafts or none. The returned ids are in draft order and may repeat when two drafts
     * share a source.
     */
    public synchronized List<String> putAll(List<EvidenceItem> drafts) {
        if (sealed) throw new EvidenceSetSealedException(requestId);
        List<String> ids = new ArrayList<>(drafts.size());
        for (EvidenceItem draft : drafts) {
            String key = draft.sourceKey();
            String existing = idsBySource.get(key);
            if (existing != null) {
                ids.add(existing);
                continue;
            }
            String id = "E" + (items.size() + 1);
            items.put(id, draft.toBuilder().id(id).epoch(epoch).build());
            idsBySource.put(key, id);
            ids.add(id);
        }
        return ids;
    }

    public synchronized EvidenceItem get(String id) {
        return items.get(id);
    }

    /** Id already assigned to a source, or null. */
    public synchronized String idForSource(String sourceKey) {
        return idsBySource.get(sourceKey);
    }

    public synchronized boolean contains(String id) {
        return items.containsKey(id);
    }

    /** Snapshot of all items in insertion order. */
    public synchronized List<EvidenceItem> items() {
        return new ArrayList<>(items.values());
    }

    public synchronized int size() {
        return items.size();
    }

    /** After sealing every put fails; used when the owning request is cancelled. */
    public synchronized void seal() {
        sealed = true;
    }

    public synchronized boolean isSealed() {
        return sealed;
    }

    public String getRequestId() {
        return requestId;
    }

    public long getEpoch() {
        return epoch;
    }

    public ExternalItemCache getExternalCache() {
        return externalCache;
    }
}
