package com.example.repoassist;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/** Ingests the repository, publishes the result as the new epoch and reports on what is loaded. */
@Slf4j
@Service
public class RepositoryService {

    private final RepositoryIndexer indexer;
    private final IndexRegistry registry;
    private final String configuredRoot;
    // held from indexing through publishing so epochs are published in the order they were taken
    private final ReentrantLock ingestLock = new ReentrantLock(true);

    public RepositoryService(RepositoryIndexer indexer, IndexRegistry registry, Environment env) {
        this.indexer = indexer;
        this.registry = registry;
        this.configuredRoot = env.getProperty("repository.root.path");
    }

    /** Resolves an explicit root, falling back to {@code repository.root.path}. */
    public Path resolveRoot(String root) {
        String r = root == null || root.isBlank() ? configuredRoot : root;
        if (r == null || r.isBlank()) {
            throw new IngestionException("No repository root given and repository.root.path is not set");
        }
        return Path.of(r);
    }

    public RepositorySnapshot ingest(Path root) {
        return ingest(root, () -> false, null);
    }

    /**
     * Waits for any other ingestion to finish, indexes the root, then blocks until requests on the
     * previous epoch have finished and swaps in the new snapshot.
     */
    public RepositorySnapshot ingest(Path root, BooleanSupplier cancelled, RepositoryIndexer.ProgressListener progress) {
        ingestLock.lock();
        try {
            RepositorySnapshot snapshot = indexer.ingest(root, cancelled, progress);
            registry.publish(snapshot);
            return snapshot;
        } finally {
            ingestLock.unlock();
        }
    }

    public Map<String, Object> status() {
        RepositorySnapshot s = registry.current();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("repositoryId", s.getId());
        out.put("rootPath", s.getRootPath());
        out.put("epoch", s.getEpoch());
        out.put("indexedAt", s.getEpoch() == 0 ? null : s.getIndexedAt().toString());
        out.put("totalFiles", s.totalFiles());
        out.put("totalChunks", s.totalChunks());
        out.put("skippedFiles", s.getSkipped());
        return out;
    }

    /**
     * Sorted repository paths under {@code prefix} (any when blank) whose extension is one of
     * {@code extensions} (any when empty). Extensions may be given with or without the dot.
     */
    public List<String> listFiles(String prefix, List<String> extensions) {
        List<String> exts = new ArrayList<>();
        if (extensions != null) {
            for (String e : extensions) {
                if (e == null || e.isBlank()) continue;
                String x = e.trim().toLowerCase(Locale.ROOT);
                exts.add(x.startsWith(".") ? x.substring(1) : x);
            }
        }
        String pre = prefix == null ? "" : DefaultToolGateway.normalizePath(prefix);
        List<String> out = new ArrayList<>();
        for (SourceFile f : registry.current().getFiles()) {
            if (!pre.isEmpty() && !f.getPath().startsWith(pre)) continue;
            if (!exts.isEmpty() && !exts.contains(FileTypeClassifier.extensionOf(f.getPath()))) continue;
            out.add(f.getPath());
        }
        out.sort(null);
        return out;
    }
}
