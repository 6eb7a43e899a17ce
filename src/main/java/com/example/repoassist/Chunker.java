package com.example.repoassist;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Splits a text file into non-overlapping chunks that cover it in order. Structural units
 * (functions, classes, markdown sections) are used when they can be detected with simple
 * keyword, brace and indentation patterns; otherwise the file is cut into fixed line windows.
 * Structural units longer than a window are windowed as well.
 */
@Component
public class Chunker {

    private static final Set<String> BRACE_LANGUAGES = Set.of(
            "java", "kotlin", "scala", "groovy", "go", "rust", "c", "cpp", "csharp", "javascript",
            "typescript", "php", "swift", "vue", "svelte");

    private static final Pattern BRACE_DECL = Pattern.compile(
            "^\\s*(@\\w+\\s+)*(export\\s+)?(default\\s+)?"
                    + "(public|private|protected|internal|static|final|abstract|async|override|open|sealed"
                    + "|pub(\\(crate\\))?|func|fn|function|class|interface|enum|struct|impl|trait|record"
                    + "|object|fun|def|void)\\b.*");
    private static final Pattern ARROW_DECL = Pattern.compile(
            "^\\s*(export\\s+)?(const|let|var)\\s+\\w+\\s*=\\s*(async\\s*)?(\\([^)]*\\)|\\w+)\\s*=>.*");
    private static final Pattern PYTHON_DECL = Pattern.compile("^( {0,4}|\\t?)(async\\s+def|def|class)\\s+\\w+.*");
    private static final Pattern RUBY_DECL = Pattern.compile("^\\s{0,2}(def|class|module)\\s+\\w+.*");
    private static final Pattern MARKDOWN_HEADING = Pattern.compile("^#{1,3}\\s+\\S.*");
    private static final Pattern STRING_LITERAL = Pattern.compile("\"(\\\\.|[^\"\\\\])*\"|'(\\\\.|[^'\\\\])*'");

    private final int windowLines;
    private final int minChunkLines;

    @Autowired
    public Chunker(Environment env) {
        this(env.getProperty("indexer.window.lines", Integer.class, 40),
                env.getProperty("indexer.min-chunk.lines", Integer.class, 5));
    }

    public Chunker(int windowLines, int minChunkLines) {
        if (windowLines < 1) throw new IllegalArgumentException("indexer.window.lines must be positive");
        this.windowLines = windowLines;
        this.minChunkLines = Math.max(1, minChunkLines);
    }

    public List<Chunk> split(String path, String language, List<String> lines) {
        List<Chunk> out = new ArrayList<>();
        int n = lines.size();
        if (n == 0) return out;

        TreeSet<Integer> boundaries = detectBoundaries(language, lines);
        List<int[]> segments = new ArrayList<>();
        if (boundaries.isEmpty()) {
            segments.add(new int[]{0, n});
        } else {
            int start = 0;
            for (int b : boundaries) {
                segments.add(new int[]{start, b});
                start = b;
            }
            segments.add(new int[]{start, n});
            segments = mergeSmall(segments);
        }

        for (int[] seg : segments) {
            for (int s = seg[0]; s < seg[1]; s += windowLines) {
                int e = Math.min(s + windowLines, seg[1]);
                String text = String.join("\n", lines.subList(s, e));
                out.add(Chunk.builder()
                        .id(Chunk.idFor(path, s + 1, e))
                        .filePath(path)
                        .startLine(s + 1)
                        .endLine(e)
                        .text(text)
                        .build());
            }
        }
        return out;
    }

    // segments are [start, end) line offsets; tiny ones are folded into a neighbour
    private List<int[]> mergeSmall(List<int[]> segments) {
        List<int[]> merged = new ArrayList<>();
        for (int[] seg : segments) {
            if (seg[1] <= seg[0]) continue;
            if (!merged.isEmpty()) {
                int[] prev = merged.get(merged.size() - 1);
                boolean prevSmall = prev[1] - prev[0] < minChunkLines;
                boolean curSmall = seg[1] - seg[0] < minChunkLines;
                if (prevSmall || curSmall) {
                    prev[1] = seg[1];
                    continue;
                }
            }
            merged.add(new int[]{seg[0], seg[1]});
        }
        return merged;
    }

    /** 0-based line offsets (never 0) at which a new structural unit begins. */
    TreeSet<Integer> detectBoundaries(String language, List<String> lines) {
        TreeSet<Integer> out = new TreeSet<>();
        if (language == null) return out;
        if (BRACE_LANGUAGES.contains(language)) {
            int depth = 0;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                String code = stripLiteralsAndComments(line);
                if (depth <= 1 && isBraceDeclaration(line, code)) {
                    addWithLeadingDecorations(out, lines, i);
                }
                for (int k = 0; k < code.length(); k++) {
                    char ch = code.charAt(k);
                    if (ch == '{') depth++;
                    else if (ch == '}') depth = Math.max(0, depth - 1);
                }
            }
        } else if ("python".equals(language)) {
            for (int i = 0; i < lines.size(); i++) {
                if (PYTHON_DECL.matcher(lines.get(i)).matches()) addWithLeadingDecorations(out, lines, i);
            }
        } else if ("ruby".equals(language)) {
            for (int i = 0; i < lines.size(); i++) {
                if (RUBY_DECL.matcher(lines.get(i)).matches()) out.add(i);
            }
        } else if ("markdown".equals(language)) {
            boolean inFence = false;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (line.trim().startsWith("```")) inFence = !inFence;
                if (!inFence && MARKDOWN_HEADING.matcher(line).matches()) out.add(i);
            }
        }
        out.remove(0);
        return out;
    }

    private static boolean isBraceDeclaration(String line, String code) {
        String trimmed = code.trim();
        if (trimmed.endsWith(";")) return false;
        if (ARROW_DECL.matcher(line).matches()) return true;
        return BRACE_DECL.matcher(line).matches() && (trimmed.contains("(") || trimmed.contains("{")
                || trimmed.matches(".*\\b(class|interface|enum|struct|trait|record|object|impl)\\b.*"));
    }

    // pull annotations, decorators and doc comments directly above a declaration into its unit
    private static void addWithLeadingDecorations(TreeSet<Integer> out, List<String> lines, int index) {
        int floor = out.isEmpty() ? 0 : out.last() + 1;
        int start = index;
        while (start - 1 >= floor) {
            String prev = lines.get(start - 1).trim();
            if (prev.startsWith("@") || prev.startsWith("/**") || prev.startsWith("*") || prev.startsWith("*/")
                    || prev.startsWith("//") || prev.startsWith("#[") || prev.startsWith("///")) {
                start--;
            } else {
                break;
            }
        }
        out.add(start);
    }

    private static String stripLiteralsAndComments(String line) {
        String s = STRING_LITERAL.matcher(line).replaceAll("\"\"");
        int comment = s.indexOf("//");
        return comment >= 0 ? s.substring(0, comment) : s;
    }

    public int getWindowLines() {
        return windowLines;
    }
}
