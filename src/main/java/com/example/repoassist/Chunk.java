package com.example.repoassist;

import lombok.Builder;
import lombok.Value;

/**
 * A citable, line-bounded slice of a file. Lines are 1-indexed and inclusive.
 */
@Value
@Builder(toBuilder = true)
public class Chunk {
    String id;
    String filePath;
    int startLine;
    int endLine;
    String text;
    // optional, set when a summary tag was generated for the enclosing file
    String tag;

    public static String idFor(String filePath, int startLine, int endLine) {
        return filePath + "#L" + startLine + "-" + endLine;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }
}
