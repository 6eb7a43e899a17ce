package com.example.repoassist;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Builds a {@link RepositorySnapshot} from a checkout on disk. Files that cannot be read are
 * skipped with a warning and reported in {@link RepositorySnapshot#getSkipped()}; binary and
 * oversized files are kept as metadata without chunks. An empty repository is a valid result.
 */
@Slf4j
@Service
public class RepositoryIndexer {

    private static final int TAG_PREVIEW_LINES = 30;

    private final FileScanner fileScanner;
    private final FileTypeClassifier classifier;
    private final Chunker chunker;
    private final TagGenerator tagGenerator;
    private final IndexRegistry registry;
    private final long maxFileBytes;

    public RepositoryIndexer(FileScanner fileScanner, FileTypeClassifier classifier, Chunker chunker,
                             TagGenerator tagGenerator, IndexRegistry registry, Environment env) {
        this.fileScanner = fileScanner;
        this.classifier = classifier;
        this.chunker = chunker;
        this.tagGenerator = tagGenerator;
        this.registry = registry;
        this.maxFileBytes = env.getProperty("indexer.max-file.bytes", Long.class, 1048576L);
    }

    public RepositorySnapshot ingest(Path root) {
        return ingest(root, () -> false, null);
    }

    /**
     * @param cancelled polled between files; a cancelled ingestion throws {@link IngestionException}
     * @param progress  receives (processed, total) after every file, may be null
     */
    public RepositorySnapshot ingest(Path root, BooleanSupplier cancelled, ProgressListener progress) {
        Path absRoot = root.toAbsolutePath().normalize();
        Map<String, String> skipped = new LinkedHashMap<>();
        List<String> paths;
        try {
            paths = fileScanner.listAllFiles(absRoot, skipped);
        } catch (IOException e) {
            throw new IngestionException("Could not walk repository " + absRoot + ": " + e.getMessage(), e);
        }
        long epoch = registry.nextEpoch();
        log.info("Ingesting {} as epoch {}: {} candidate files", absRoot, epoch, paths.size());

        List<SourceFile> files = new ArrayList<>();
        Map<String, List<Chunk>> chunksByFile = new LinkedHashMap<>();
        List<TagSubject> tagSubjects = new ArrayList<>();
        int processed = 0;
        for (String rel : paths) {
            if (cancelled.getAsBoolean()) {
                throw new IngestionException("Ingestion of " + absRoot + " cancelled after " + processed + " files");
            }
            try {
                SourceFile file = readFile(absRoot, rel, chunksByFile, tagSubjects, skipped);
                files.add(file);
            } catch (IOException e) {
                log.warn("Skipping unreadable file {}: {}", rel, e.getMessage());
                skipped.put(rel, "unreadable: " + e.getMessage());
            }
            processed++;
            if (progress != null) progress.onProgress(processed, paths.size());
        }

        Map<String, String> fileTags = tagGenerator.tagFiles(tagSubjects);

        List<SourceFile> tagged = new ArrayList<>(files.size());
        List<Chunk> chunks = new ArrayList<>();
        LexicalIndex.Builder index = LexicalIndex.builder();
        for (SourceFile f : files) {
            String tag = fileTags.get(f.getPath());
            tagged.add(tag == null ? f : f.toBuilder().tag(tag).build());
            if (f.getKind().isText()) index.addFile(f.getPath());
            for (Chunk c : chunksByFile.getOrDefault(f.getPath(), List.of())) {
                Chunk withTag = tag == null ? c : c.toBuilder().tag(tag).build();
                chunks.add(withTag);
                index.addChunk(withTag);
            }
        }

        List<String> treePaths = new ArrayList<>();
        for (SourceFile f : tagged) treePaths.add(f.getPath());
        DirectoryNode tree = DirectoryNode.build(treePaths);
        tagGenerator.tagDirectories(tree, fileTags);

        String id = absRoot.getFileName() == null ? absRoot.toString() : absRoot.getFileName().toString();
        RepositorySnapshot snapshot = new RepositorySnapshot(id, absRoot.toString(), epoch, Instant.now(),
                tagged, chunks, tree, index.build(), skipped);
        log.info("Ingested {} epoch {}: files={}, chunks={}, skipped={}",
                id, epoch, snapshot.totalFiles(), snapshot.totalChunks(), skipped.size());
        if (!skipped.isEmpty()) {
            log.warn("Ingestion of {} was partial: {} paths skipped", id, skipped.size());
        }
        return snapshot;
    }

    private SourceFile readFile(Path root, String rel, Map<String, List<Chunk>> chunksByFile,
                                List<TagSubject> tagSubjects, Map<String, String> skipped) throws IOException {
        Path p = root.resolve(rel);
        BasicFileAttributes attrs = Files.readAttributes(p, BasicFileAttributes.class);
        FileKind kind = classifier.kindOf(rel);
        SourceFile.SourceFileBuilder file = SourceFile.builder()
                .path(rel)
                .language(classifier.languageOf(rel))
                .sizeBytes(attrs.size())
                .lastModified(attrs.lastModifiedTime().toMillis());

        if (kind == FileKind.BINARY || classifier.looksBinary(p)) {
            return file.kind(FileKind.BINARY).build();
        }
        if (attrs.size() > maxFileBytes) {
            log.warn("Not chunking {}: {} bytes exceeds indexer.max-file.bytes={}", rel, attrs.size(), maxFileBytes);
            skipped.put(rel, "larger than " + maxFileBytes + " bytes, metadata only");
            return file.kind(kind).build();
        }

        String text;
        try {
            text = Files.readString(p, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            log.debug("Keeping {} as metadata only: not valid UTF-8 past the sniffed prefix", rel);
            return file.kind(FileKind.BINARY).build();
        }
        List<String> lines = splitLines(text);
        List<Chunk> chunks = chunker.split(rel, classifier.languageOf(rel), lines);
        chunksByFile.put(rel, chunks);
        for (Chunk c : chunks) file.chunkId(c.getId());
        if (!lines.isEmpty()) {
            tagSubjects.add(new TagSubject(rel, false,
                    String.join("\n", lines.subList(0, Math.min(TAG_PREVIEW_LINES, lines.size())))));
        }
        return file.kind(kind).lineCount(lines.size()).build();
    }

    /** Lines without terminators; a final newline does not start another line. */
    static List<String> splitLines(String text) {
        if (text.isEmpty()) return List.of();
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\r?\n", -1)));
        if (lines.get(lines.size() - 1).isEmpty()) lines.remove(lines.size() - 1);
        return lines;
    }

    @FunctionalInterface
    public interface ProgressListener {
        void onProgress(int processed, int total);
    }
}
