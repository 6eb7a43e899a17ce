package com.example.repoassist;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SourceFile {
    String path;
    String language;
    FileKind kind;
    long sizeBytes;
    long lastModified;
    int lineCount;
    @Singular
    List<String> chunkIds;
    String tag;

    /** Number of path separators, so top-level files have depth 0. */
    public int depth() {
        int d = 0;
        for (int i = 0; i < path.length(); i++) {
            if (path.charAt(i) == '/') d++;
        }
        return d;
    }

    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    public String parentPath() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
