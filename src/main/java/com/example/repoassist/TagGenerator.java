package com.example.repoassist;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Best-effort descriptive tags for files and directories. Work is sent to the reasoning engine in
 * batches; a failed batch leaves its subjects untagged and never fails ingestion. Directory tags
 * are derived from the tags of their children, deepest directories first.
 */
@Slf4j
@Component
public class TagGenerator {

    private static final int DIRECTORY_LISTING_LIMIT = 40;

    private final ReasoningEngine engine;
    private final OracleCaller oracle;
    private final boolean enabled;
    private final int batchSize;

    public TagGenerator(ReasoningEngine engine, OracleCaller oracle, Environment env) {
        this.engine = engine;
        this.oracle = oracle;
        this.enabled = env.getProperty("indexer.tags.enabled", Boolean.class, true);
        this.batchSize = Math.max(1, env.getProperty("indexer.tags.batch-size", Integer.class, 20));
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Tags for the given files, keyed by path. Files the engine did not describe are absent. */
    public Map<String, String> tagFiles(List<TagSubject> files) {
        Map<String, String> tags = new LinkedHashMap<>();
        if (!enabled) return tags;
        for (int i = 0; i < files.size(); i += batchSize) {
            tags.putAll(describeBatch(files.subList(i, Math.min(i + batchSize, files.size()))));
        }
        log.info("Tagged {}/{} files", tags.size(), files.size());
        return tags;
    }

    /**
     * Tags every directory of the tree from its files' tags and its sub-directories' tags. Each
     * level is finished before its parents are described.
     */
    public void tagDirectories(DirectoryNode root, Map<String, String> fileTags) {
        if (!enabled) return;
        int tagged = 0;
        for (List<DirectoryNode> level : root.levelsDeepestFirst()) {
            List<TagSubject> subjects = new ArrayList<>();
            Map<String, DirectoryNode> byPath = new LinkedHashMap<>();
            for (DirectoryNode dir : level) {
                String listing = listing(dir, fileTags);
                if (listing.isEmpty()) continue;
                String path = dir.getPath().isEmpty() ? "." : dir.getPath();
                subjects.add(new TagSubject(path, true, listing));
                byPath.put(path, dir);
            }
            for (int i = 0; i < subjects.size(); i += batchSize) {
                Map<String, String> tags = describeBatch(subjects.subList(i, Math.min(i + batchSize, subjects.size())));
                for (Map.Entry<String, String> e : tags.entrySet()) {
                    byPath.get(e.getKey()).setTag(e.getValue());
                    tagged++;
                }
            }
        }
        log.info("Tagged {} directories", tagged);
    }

    private static String listing(DirectoryNode dir, Map<String, String> fileTags) {
        StringBuilder sb = new StringBuilder();
        int n = 0;
        for (DirectoryNode child : dir.getChildren()) {
            if (n++ >= DIRECTORY_LISTING_LIMIT) break;
            sb.append(child.getPath()).append("/");
            if (child.getTag() != null) sb.append(": ").append(child.getTag());
            sb.append("\n");
        }
        for (String file : dir.getFilePaths()) {
            if (n++ >= DIRECTORY_LISTING_LIMIT) break;
            sb.append(file);
            String tag = fileTags.get(file);
            if (tag != null) sb.append(": ").append(tag);
            sb.append("\n");
        }
        return sb.toString().trim();
    }

    private Map<String, String> describeBatch(List<TagSubject> batch) {
        try {
            return oracle.call("tag batch of " + batch.size(), () -> engine.describe(batch));
        } catch (OracleException e) {
            log.warn("Tag generation failed for {} subjects starting at {}: {}",
                    batch.size(), batch.get(0).getPath(), e.getMessage());
            return Map.of();
        }
    }
}
