package com.example.repoassist;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import lombok.EqualsAndHashCode;

/**
 * Inverted index from normalized token to the chunks containing it, with per-chunk term
 * frequencies, plus the normalized tokens of every indexed file path. Sorted maps only, so two
 * indexes built from the same files compare equal.
 */
@EqualsAndHashCode
public class LexicalIndex {

    // term -> (chunk id -> term frequency)
    private final NavigableMap<String, NavigableMap<String, Integer>> postings;
    // file path -> normalized path tokens
    private final NavigableMap<String, Set<String>> pathTerms;
    // chunk id -> file path
    private final NavigableMap<String, String> chunkFiles;

    private LexicalIndex(Builder b) {
        this.postings = b.postings;
        this.pathTerms = b.pathTerms;
        this.chunkFiles = b.chunkFiles;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int chunkCount() {
        return chunkFiles.size();
    }

    public int documentFrequency(String term) {
        Map<String, Integer> p = postings.get(term);
        return p == null ? 0 : p.size();
    }

    /** Smoothed inverse document frequency, never below 1 for a term that occurs. */
    public double idf(String term) {
        int df = documentFrequency(term);
        int n = Math.max(1, chunkCount());
        if (df == 0) return 1.0 + Math.log(n + 1.0);
        return 1.0 + Math.log((double) n / df);
    }

    public int termFrequency(String term, String chunkId) {
        Map<String, Integer> p = postings.get(term);
        if (p == null) return 0;
        Integer tf = p.get(chunkId);
        return tf == null ? 0 : tf;
    }

    /** Chunk ids containing the term, in id order. */
    public Set<String> chunksContaining(String term) {
        NavigableMap<String, Integer> p = postings.get(term);
        return p == null ? Collections.emptySet() : Collections.unmodifiableSet(p.navigableKeySet());
    }

    public Set<String> pathTerms(String filePath) {
        Set<String> t = pathTerms.get(filePath);
        return t == null ? Collections.emptySet() : Collections.unmodifiableSet(t);
    }

    public String fileOf(String chunkId) {
        return chunkFiles.get(chunkId);
    }

    public Set<String> terms() {
        return Collections.unmodifiableSet(postings.navigableKeySet());
    }

    public static class Builder {
        private final NavigableMap<String, NavigableMap<String, Integer>> postings = new TreeMap<>();
        private final NavigableMap<String, Set<String>> pathTerms = new TreeMap<>();
        private final NavigableMap<String, String> chunkFiles = new TreeMap<>();

        public Builder addFile(String filePath) {
            pathTerms.put(filePath, new TreeSet<>(Tokenizer.tokens(filePath)));
            return this;
        }

        public Builder addChunk(Chunk chunk) {
            chunkFiles.put(chunk.getId(), chunk.getFilePath());
            List<String> tokens = Tokenizer.tokens(chunk.getText());
            for (String t : tokens) {
                postings.computeIfAbsent(t, k -> new TreeMap<>()).merge(chunk.getId(), 1, Integer::sum);
            }
            return this;
        }

        public LexicalIndex build() {
            return new LexicalIndex(this);
        }
    }
}
