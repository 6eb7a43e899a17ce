package com.example.repoassist;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One ingestion of a repository checkout: files, chunks, directory tree and lexical index. A
 * snapshot is immutable once published; re-ingestion produces a new snapshot with a new epoch.
 */
public class RepositorySnapshot {

    private final String id;
    private final String rootPath;
    private final long epoch;
    private final Instant indexedAt;
    private final Map<String, SourceFile> files;
    private final Map<String, Chunk> chunks;
    private final DirectoryNode tree;
    private final LexicalIndex index;
    private final Map<String, String> skipped;

    public RepositorySnapshot(String id, String rootPath, long epoch, Instant indexedAt,
                              List<SourceFile> files, List<Chunk> chunks, DirectoryNode tree,
                              LexicalIndex index, Map<String, String> skipped) {
        this.id = id;
        this.rootPath = rootPath;
        this.epoch = epoch;
        this.indexedAt = indexedAt;
        Map<String, SourceFile> f = new LinkedHashMap<>();
        for (SourceFile sf : files) f.put(sf.getPath(), sf);
        this.files = Collections.unmodifiableMap(f);
        Map<String, Chunk> c = new LinkedHashMap<>();
        for (Chunk ch : chunks) c.put(ch.getId(), ch);
        this.chunks = Collections.unmodifiableMap(c);
        this.tree = tree;
        this.index = index;
        this.skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
    }

    /** Placeholder used before the first ingestion: no files, epoch 0. */
    public static RepositorySnapshot empty() {
        return new RepositorySnapshot("none", "", 0L, Instant.EPOCH, List.of(), List.of(),
                DirectoryNode.build(List.of()), LexicalIndex.builder().build(), Map.of());
    }

    public SourceFile file(String path) {
        return files.get(path);
    }

    public Chunk chunk(String chunkId) {
        return chunks.get(chunkId);
    }

    public List<Chunk> chunksOf(String path) {
        SourceFile f = files.get(path);
        if (f == null) return List.of();
        List<Chunk> out = new ArrayList<>(f.getChunkIds().size());
        for (String id : f.getChunkIds()) out.add(chunks.get(id));
        return out;
    }

    /**
     * Text of lines {@code start..end} (inclusive) as indexed. Chunks cover their file without gaps,
     * so the file is reassembled from its chunks rather than re-read from disk.
     */
    public String linesOf(String path, int start, int end) {
        List<String> lines = new ArrayList<>();
        for (Chunk c : chunksOf(path)) {
            if (c.getEndLine() < start || c.getStartLine() > end) continue;
            String[] chunkLines = c.getText().split("\n", -1);
            for (int i = 0; i < chunkLines.length; i++) {
                int line = c.getStartLine() + i;
                if (line >= start && line <= end) lines.add(chunkLines[i]);
            }
        }
        return String.join("\n", lines);
    }

    public String getId() { return id; }
    public String getRootPath() { return rootPath; }
    public long getEpoch() { return epoch; }
    public Instant getIndexedAt() { return indexedAt; }
    public Collection<SourceFile> getFiles() { return files.values(); }
    public Collection<Chunk> getChunks() { return chunks.values(); }
    public DirectoryNode getTree() { return tree; }
    public LexicalIndex getIndex() { return index; }
    public Map<String, String> getSkipped() { return skipped; }
    public int totalFiles() { return files.size(); }
    public int totalChunks() { return chunks.size(); }
}
