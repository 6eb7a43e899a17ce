package com.example.repoassist;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Deterministic lexical ranking of chunks for a query.
 *
 * <p>The score is a TF-IDF sum over chunk text plus a half-weight path-term component, followed
 * by a fixed sequence of boosts:
 * <ol>
 *   <li>{@value #PATH_SEGMENT_BOOST} per query term matching a path segment,</li>
 *   <li>{@value #ORIENTATION_BOOST} for top-level README/docs when the query asks for an
 *       overview,</li>
 *   <li>{@value #TAG_MATCH_BOOST} when the file's generated tag shares a term with the query.</li>
 * </ol>
 * Directory depth never changes a score; it only orders equal scores, shallow first. Remaining
 * ties are broken by path and start line, which makes the order total.
 */
@Slf4j
@Service
public class LexicalRanker {

    static final double PATH_TERM_WEIGHT = 0.5;
    static final double PATH_SEGMENT_BOOST = 2.0;
    static final double ORIENTATION_BOOST = 3.0;
    static final double TAG_MATCH_BOOST = 1.0;

    private static final Pattern ORIENTATION = Pattern.compile(
            "(?i).*\\b(what (does|is) (this|it|the (repo|repository|project|code|codebase|app|service))"
                    + "|overview|explain|summar(y|ize|ise)|introduc\\w*|purpose|architecture|high[- ]level"
                    + "|getting started|how is (this|it|the \\w+) (organi[sz]ed|structured))\\b.*");

    public static final Comparator<RankedCandidate> ORDER = Comparator
            .comparingDouble(RankedCandidate::getScore).reversed()
            .thenComparingInt(RankedCandidate::depth)
            .thenComparing(c -> c.getFile().getPath())
            .thenComparingInt(c -> c.getChunk().getStartLine());

    private final int topK;
    private final double semanticWeight;
    private final SemanticScorer semanticScorer;

    @Autowired
    public LexicalRanker(Environment env, ObjectProvider<SemanticScorer> semanticScorer) {
        this(env.getProperty("retriever.top-k", Integer.class, 10),
                env.getProperty("retriever.semantic.weight", Double.class, 0.5),
                semanticScorer.getIfAvailable());
    }

    public LexicalRanker(int topK, double semanticWeight, SemanticScorer semanticScorer) {
        this.topK = topK;
        this.semanticWeight = semanticWeight;
        this.semanticScorer = semanticScorer;
    }

    public List<RankedCandidate> rank(String query, SearchFilters filters, RepositorySnapshot corpus) {
        return rank(query, filters, corpus, topK);
    }

    public List<RankedCandidate> rank(String query, SearchFilters filters, RepositorySnapshot corpus, int limit) {
        List<String> terms = Tokenizer.queryTerms(query);
        boolean orientation = isOrientationQuery(query);
        SearchFilters f = filters == null ? SearchFilters.NONE : filters;
        LexicalIndex index = corpus.getIndex();

        Set<String> candidateIds = new TreeSet<>();
        for (String t : terms) candidateIds.addAll(index.chunksContaining(t));
        for (SourceFile file : corpus.getFiles()) {
            boolean pathHit = matchedPathTerms(file, terms, index) > 0 || matchedSegments(file, terms) > 0;
            boolean tagHit = tagMatches(file.getTag(), terms);
            boolean docHit = orientation && isTopLevelDoc(file);
            if (pathHit || tagHit || docHit || semanticScorer != null) candidateIds.addAll(file.getChunkIds());
        }

        List<RankedCandidate> out = new ArrayList<>();
        for (String id : candidateIds) {
            Chunk chunk = corpus.chunk(id);
            if (chunk == null) continue;
            SourceFile file = corpus.file(chunk.getFilePath());
            if (file == null || !f.accepts(file)) continue;

            double lexical = 0.0;
            for (String t : terms) {
                int tf = index.termFrequency(t, id);
                if (tf > 0) lexical += (1.0 + Math.log(tf)) * index.idf(t);
                if (index.pathTerms(file.getPath()).contains(t)) lexical += PATH_TERM_WEIGHT * index.idf(t);
            }
            double pathBoost = PATH_SEGMENT_BOOST * matchedSegments(file, terms);
            double orientationBoost = orientation && isTopLevelDoc(file) ? ORIENTATION_BOOST : 0.0;
            double tagBoost = tagMatches(file.getTag(), terms) ? TAG_MATCH_BOOST : 0.0;
            double baseline = lexical + pathBoost + orientationBoost + tagBoost;

            double semantic = 0.0;
            if (semanticScorer != null) {
                semantic = Math.max(0.0, Math.min(1.0, semanticScorer.score(query, chunk)));
            }
            double score = baseline + semanticWeight * semantic;
            if (baseline <= 0.0 && semantic <= 0.0) continue;

            out.add(RankedCandidate.builder()
                    .chunk(chunk)
                    .file(file)
                    .score(score)
                    .lexicalScore(lexical)
                    .pathBoost(pathBoost)
                    .orientationBoost(orientationBoost)
                    .tagBoost(tagBoost)
                    .semanticScore(semantic)
                    .build());
        }
        out.sort(ORDER);
        List<RankedCandidate> top = out.size() > limit ? new ArrayList<>(out.subList(0, limit)) : out;
        log.debug("rank '{}' filters={} -> {} candidates, returning {}", query, f.describe(), out.size(), top.size());
        return top;
    }

    public static boolean isOrientationQuery(String query) {
        return query != null && ORIENTATION.matcher(query.replace('\n', ' ')).matches();
    }

    /** README or documentation at the top of the tree (root, or directly under docs/). */
    static boolean isTopLevelDoc(SourceFile file) {
        if (file.getKind() != FileKind.DOCS) return false;
        if (file.depth() == 0) return true;
        String lower = file.getPath().toLowerCase();
        return file.depth() == 1 && (lower.startsWith("docs/") || lower.startsWith("doc/"));
    }

    private static int matchedPathTerms(SourceFile file, List<String> terms, LexicalIndex index) {
        Set<String> pt = index.pathTerms(file.getPath());
        int n = 0;
        for (String t : terms) if (pt.contains(t)) n++;
        return n;
    }

    /**
     * Number of query terms that match a whole path segment. A segment matches when it stems to
     * the term, or when it is a prefix of the term of at least four characters ("auth" for
     * "authentic").
     */
    static int matchedSegments(SourceFile file, List<String> terms) {
        List<String> segments = Tokenizer.pathSegments(file.getPath());
        int n = 0;
        for (String t : terms) {
            for (String s : segments) {
                if (Tokenizer.stem(s).equals(t) || (s.length() >= 4 && t.startsWith(s))) {
                    n++;
                    break;
                }
            }
        }
        return n;
    }

    public static boolean tagMatches(String tag, List<String> terms) {
        if (tag == null || tag.isBlank() || terms.isEmpty()) return false;
        Set<String> tagTerms = new HashSet<>(Tokenizer.tokens(tag));
        for (String t : terms) if (tagTerms.contains(t)) return true;
        return false;
    }

    public int getTopK() {
        return topK;
    }
}
