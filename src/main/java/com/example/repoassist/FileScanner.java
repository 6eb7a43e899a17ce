package com.example.repoassist;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Enumerates the files of a repository checkout that are eligible for ingestion. Version-control
 * metadata, build output and dependency directories, hidden files and known binary extensions
 * are excluded here. Content-level binary sniffing happens later in the indexer.
 */
@Slf4j
@Service
public class FileScanner {

    static final Set<String> DEFAULT_IGNORE_DIRS = Set.of(
            ".git", ".hg", ".svn", "node_modules", ".venv", "venv", "__pycache__", "target", "build",
            "dist", "out", ".next", "coverage", ".pytest_cache", ".idea", ".gradle", ".mvn");

    static final Set<String> DEFAULT_IGNORE_EXTENSIONS = Set.of(".lock", ".pyc", ".pyo", ".class");

    private final Set<String> ignoreDirs;
    private final Set<String> ignoreExtensions;

    public FileScanner(Environment env) {
        this.ignoreDirs = readSet(env.getProperty("indexer.ignore.dirs"), DEFAULT_IGNORE_DIRS, false);
        this.ignoreExtensions = readSet(env.getProperty("indexer.ignore.extensions"), DEFAULT_IGNORE_EXTENSIONS, true);
    }

    private static Set<String> readSet(String configured, Set<String> defaults, boolean extensions) {
        if (configured == null || configured.isBlank()) return defaults;
        return Arrays.stream(configured.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> extensions && !s.startsWith(".") ? "." + s.toLowerCase() : s)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Return the repository-relative paths ('/'-separated) of every eligible file, sorted so that
     * repeated scans of an unchanged tree produce the same order.
     *
     * @param skipped receives a reason for every path that could not be visited
     */
    public List<String> listAllFiles(Path root, Map<String, String> skipped) throws IOException {
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new IngestionException("Repository root is not a readable directory: " + root);
        }
        List<String> out = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root)) {
                    String name = dir.getFileName().toString();
                    if (ignoreDirs.contains(name) || name.startsWith(".")) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!attrs.isRegularFile()) return FileVisitResult.CONTINUE;
                String name = file.getFileName().toString();
                if (name.startsWith(".")) return FileVisitResult.CONTINUE;
                String lower = name.toLowerCase();
                for (String e : ignoreExtensions) {
                    if (lower.endsWith(e)) return FileVisitResult.CONTINUE;
                }
                out.add(toRelative(root, file));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                String rel = toRelative(root, file);
                log.warn("Skipping unreadable path {}: {}", rel, exc.getMessage());
                skipped.put(rel, "unreadable: " + exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        Collections.sort(out);
        return out;
    }

    static String toRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
