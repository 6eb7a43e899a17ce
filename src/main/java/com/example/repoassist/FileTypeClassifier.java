package com.example.repoassist;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

/**
 * Maps file names to a {@link FileKind} and a language label, and sniffs content for binary
 * data.
 */
@Component
public class FileTypeClassifier {

    private static final int SNIFF_BYTES = 8000;

    private static final Set<String> CODE_EXTENSIONS = Set.of(
            "java", "kt", "scala", "groovy", "py", "rb", "php", "go", "rs", "c", "cpp", "cc", "cxx",
            "h", "hpp", "cs", "js", "jsx", "ts", "tsx", "vue", "svelte", "swift", "sh", "bash", "sql");

    private static final Set<String> DOCUMENT_EXTENSIONS = Set.of(
            "md", "markdown", "txt", "rst", "adoc", "asciidoc");

    private static final Set<String> CONFIG_EXTENSIONS = Set.of(
            "json", "yaml", "yml", "toml", "ini", "xml", "properties", "conf", "cfg", "gradle");

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            "png", "jpg", "jpeg", "gif", "svg", "ico", "pdf", "zip", "tar", "gz", "exe", "dll", "so",
            "dylib", "pyc", "pyo", "class", "jar", "war", "woff", "woff2", "ttf", "mp3", "mp4", "bin");

    private static final Map<String, String> EXTENSION_TO_LANGUAGE = Map.ofEntries(
            Map.entry("java", "java"),
            Map.entry("kt", "kotlin"),
            Map.entry("scala", "scala"),
            Map.entry("groovy", "groovy"),
            Map.entry("py", "python"),
            Map.entry("rb", "ruby"),
            Map.entry("php", "php"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("c", "c"),
            Map.entry("h", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("cc", "cpp"),
            Map.entry("cxx", "cpp"),
            Map.entry("hpp", "cpp"),
            Map.entry("cs", "csharp"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("vue", "vue"),
            Map.entry("svelte", "svelte"),
            Map.entry("swift", "swift"),
            Map.entry("sh", "shell"),
            Map.entry("bash", "shell"),
            Map.entry("sql", "sql"),
            Map.entry("md", "markdown"),
            Map.entry("markdown", "markdown"),
            Map.entry("rst", "rst"),
            Map.entry("json", "json"),
            Map.entry("yaml", "yaml"),
            Map.entry("yml", "yaml"),
            Map.entry("xml", "xml"),
            Map.entry("properties", "properties"),
            Map.entry("toml", "toml"));

    public static String extensionOf(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1).toLowerCase(Locale.ROOT) : "";
    }

    public FileKind kindOf(String path) {
        String ext = extensionOf(path);
        if (BINARY_EXTENSIONS.contains(ext)) return FileKind.BINARY;
        if (CODE_EXTENSIONS.contains(ext)) return FileKind.CODE;
        if (DOCUMENT_EXTENSIONS.contains(ext) || isDocumentationName(path)) return FileKind.DOCS;
        if (CONFIG_EXTENSIONS.contains(ext)) return FileKind.CONFIG;
        return FileKind.OTHER_TEXT;
    }

    public String languageOf(String path) {
        String ext = extensionOf(path);
        String lang = EXTENSION_TO_LANGUAGE.get(ext);
        if (lang != null) return lang;
        return ext.isEmpty() ? "text" : ext;
    }

    /** README, LICENSE, CONTRIBUTING and friends, with or without extension, or anything under docs/. */
    public static boolean isDocumentationName(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        String name = lower.substring(lower.lastIndexOf('/') + 1);
        return name.startsWith("readme") || name.startsWith("contributing") || name.startsWith("changelog")
                || name.startsWith("license") || lower.startsWith("docs/") || lower.startsWith("doc/");
    }

    public static boolean isReadme(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        return name.startsWith("readme");
    }

    /**
     * A file is binary when its head contains a NUL byte or is not valid UTF-8. A multi-byte
     * sequence cut at the sniff boundary is not counted as invalid.
     */
    public boolean looksBinary(Path file) throws IOException {
        byte[] head;
        try (InputStream in = Files.newInputStream(file)) {
            head = in.readNBytes(SNIFF_BYTES);
        }
        for (byte b : head) {
            if (b == 0) return true;
        }
        int len = head.length;
        if (len == SNIFF_BYTES) {
            // trim a possibly truncated trailing sequence
            int i = len - 1;
            int back = 0;
            while (i >= 0 && back < 3 && (head[i] & 0xC0) == 0x80) {
                i--;
                back++;
            }
            if (i >= 0 && (head[i] & 0x80) != 0) len = i;
        }
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(head, 0, len));
            return false;
        } catch (CharacterCodingException e) {
            return true;
        }
    }
}
