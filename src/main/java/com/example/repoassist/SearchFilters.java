package com.example.repoassist;

import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/** Candidate filters for {@code search_repo}. All fields are optional. */
@Value
@Builder(toBuilder = true)
public class SearchFilters {

    public static final SearchFilters NONE = SearchFilters.builder().build();

    String pathGlob;
    String language;
    boolean docsOnly;
    boolean codeOnly;

    public boolean isEmpty() {
        return (pathGlob == null || pathGlob.isBlank()) && (language == null || language.isBlank()) && !docsOnly && !codeOnly;
    }

    public boolean accepts(SourceFile file) {
        if (docsOnly && file.getKind() != FileKind.DOCS) return false;
        if (codeOnly && file.getKind() != FileKind.CODE) return false;
        if (language != null && !language.isBlank()
                && !language.toLowerCase(Locale.ROOT).equals(file.getLanguage())) return false;
        if (pathGlob != null && !pathGlob.isBlank()) {
            PathMatcher m = FileSystems.getDefault().getPathMatcher("glob:" + pathGlob);
            return m.matches(Paths.get(file.getPath()));
        }
        return true;
    }

    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        if (pathGlob != null) out.put("pathGlob", pathGlob);
        if (language != null) out.put("language", language);
        if (docsOnly) out.put("docsOnly", true);
        if (codeOnly) out.put("codeOnly", true);
        return out;
    }
}
