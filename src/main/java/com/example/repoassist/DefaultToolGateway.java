package com.example.repoassist;

import java.nio.file.FileSystems;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes the four tools to the leased snapshot (search_repo, open_file) or to the code host
 * (get_issue, get_pull_requests). Drafts are built completely before anything is registered, so
 * a call that fails half-way leaves the evidence set untouched.
 */
@Slf4j
@Service
public class DefaultToolGateway implements ToolGateway {

    private static final int MAX_SUMMARIES = 3;
    private static final int BODY_PREVIEW_CHARS = 500;

    private final LexicalRanker ranker;
    private final CodeHostClient codeHost;

    public DefaultToolGateway(LexicalRanker ranker, CodeHostClient codeHost) {
        this.ranker = ranker;
        this.codeHost = codeHost;
    }

    @Override
    public List<EvidenceItem> searchRepo(String query, SearchFilters filters, ToolContext ctx) throws ToolGatewayException {
        if (query == null || query.isBlank()) {
            throw new ToolGatewayException(ToolFailureKind.BAD_ARGUMENTS, "search_repo needs a non-empty query");
        }
        if (filters != null && filters.isDocsOnly() && filters.isCodeOnly()) {
            throw new ToolGatewayException(ToolFailureKind.BAD_ARGUMENTS, "docsOnly and codeOnly are mutually exclusive");
        }
        if (filters != null && filters.getPathGlob() != null && !filters.getPathGlob().isBlank()) {
            try {
                FileSystems.getDefault().getPathMatcher("glob:" + filters.getPathGlob());
            } catch (IllegalArgumentException e) {
                throw new ToolGatewayException(ToolFailureKind.BAD_ARGUMENTS, "Invalid path glob: " + e.getMessage(), e);
            }
        }
        List<RankedCandidate> ranked = ranker.rank(query, filters, ctx.getSnapshot());
        List<String> terms = Tokenizer.queryTerms(query);

        List<EvidenceItem> drafts = new ArrayList<>();
        Set<String> summarized = new LinkedHashSet<>();
        int rank = 0;
        for (RankedCandidate c : ranked) {
            Chunk chunk = c.getChunk();
            drafts.add(EvidenceItem.builder()
                    .kind(EvidenceKind.CHUNK)
                    .sourceRef(chunk.getId())
                    .filePath(chunk.getFilePath())
                    .startLine(chunk.getStartLine())
                    .endLine(chunk.getEndLine())
                    .displayText(chunk.getText())
                    .toolCallId(ctx.getToolCallId())
                    .toolName(ToolName.SEARCH_REPO)
                    .rank(++rank)
                    .score(c.getScore())
                    .build());
        }
        for (RankedCandidate c : ranked) {
            SourceFile file = c.getFile();
            if (summarized.size() >= MAX_SUMMARIES) break;
            if (summarized.contains(file.getPath()) || !LexicalRanker.tagMatches(file.getTag(), terms)) continue;
            summarized.add(file.getPath());
            drafts.add(EvidenceItem.builder()
                    .kind(EvidenceKind.FILE_SUMMARY)
                    .sourceRef(file.getPath())
                    .filePath(file.getPath())
                    .displayText(file.getPath() + ": " + file.getTag())
                    .toolCallId(ctx.getToolCallId())
                    .toolName(ToolName.SEARCH_REPO)
                    .rank(++rank)
                    .score(c.getScore())
                    .build());
        }
        return register(ctx, drafts);
    }

    @Override
    public String openFile(String path, int startLine, int endLine, ToolContext ctx) throws ToolGatewayException {
        if (path == null || path.isBlank()) {
            throw new ToolGatewayException(ToolFailureKind.BAD_ARGUMENTS, "open_file needs a path");
        }
        String normalized = normalizePath(path);
        RepositorySnapshot snapshot = ctx.getSnapshot();
        SourceFile file = snapshot.file(normalized);
        if (file == null) {
            throw new ToolGatewayException(ToolFailureKind.NOT_FOUND, "No such file in repository: " + normalized);
        }
        if (!file.getKind().isText()) {
            throw new ToolGatewayException(ToolFailureKind.NOT_TEXT, "File is not text: " + normalized);
        }
        if (startLine < 1 || endLine < startLine || endLine > file.getLineCount()) {
            throw new ToolGatewayException(ToolFailureKind.OUT_OF_RANGE, String.format(
                    "Lines %d-%d are outside %s (1-%d)", startLine, endLine, normalized, file.getLineCount()));
        }
        String text = snapshot.linesOf(normalized, startLine, endLine);
        EvidenceItem draft = EvidenceItem.builder()
                .kind(EvidenceKind.FILE_RANGE)
                .sourceRef(Chunk.idFor(normalized, startLine, endLine))
                .filePath(normalized)
                .startLine(startLine)
                .endLine(endLine)
                .displayText(text)
                .toolCallId(ctx.getToolCallId())
                .toolName(ToolName.OPEN_FILE)
                .rank(1)
                .score(bestOverlappingScore(ctx.getEvidence(), normalized, startLine, endLine))
                .build();
        register(ctx, List.of(draft));
        return text;
    }

    @Override
    public List<Issue> getIssue(ExternalQuery query, ToolContext ctx) throws ToolGatewayException {
        ExternalItemCache cache = ctx.getExternalCache();
        List<Issue> issues = cache.cachedIssues(query);
        if (issues == null) {
            try {
                issues = codeHost.fetchIssues(query);
            } catch (CodeHostException e) {
                log.warn("get_issue {} failed: {}", query.cacheKey(), e.getMessage());
                throw new ToolGatewayException(ToolFailureKind.REMOTE_FETCH, "Issue fetch failed: " + e.getMessage(), e);
            }
            cache.storeIssues(query, issues);
        } else {
            log.debug("get_issue {} served from session cache", query.cacheKey());
        }
        List<EvidenceItem> drafts = new ArrayList<>();
        int rank = 0;
        for (Issue i : issues) {
            drafts.add(EvidenceItem.builder()
                    .kind(EvidenceKind.ISSUE)
                    .sourceRef("#" + i.getNumber())
                    .externalNumber(i.getNumber())
                    .displayText(describe("Issue", i.getNumber(), i.getState(), i.getTitle(), i.getLabels(), i.getBody(), null))
                    .toolCallId(ctx.getToolCallId())
                    .toolName(ToolName.GET_ISSUE)
                    .rank(++rank)
                    .score(1.0)
                    .build());
        }
        register(ctx, drafts);
        return issues;
    }

    @Override
    public List<PullRequest> getPullRequests(ExternalQuery query, ToolContext ctx) throws ToolGatewayException {
        ExternalItemCache cache = ctx.getExternalCache();
        List<PullRequest> pulls = cache.cachedPullRequests(query);
        if (pulls == null) {
            try {
                pulls = codeHost.fetchPullRequests(query);
            } catch (CodeHostException e) {
                log.warn("get_pull_requests {} failed: {}", query.cacheKey(), e.getMessage());
                throw new ToolGatewayException(ToolFailureKind.REMOTE_FETCH, "Pull request fetch failed: " + e.getMessage(), e);
            }
            cache.storePullRequests(query, pulls);
        }
        List<EvidenceItem> drafts = new ArrayList<>();
        int rank = 0;
        for (PullRequest p : pulls) {
            drafts.add(EvidenceItem.builder()
                    .kind(EvidenceKind.PULL_REQUEST)
                    .sourceRef("#" + p.getNumber())
                    .externalNumber(p.getNumber())
                    .displayText(describe("Pull request", p.getNumber(), p.getState(), p.getTitle(), p.getLabels(),
                            p.getBody(), p.getTouchedFiles()))
                    .toolCallId(ctx.getToolCallId())
                    .toolName(ToolName.GET_PULL_REQUESTS)
                    .rank(++rank)
                    .score(1.0)
                    .build());
        }
        register(ctx, drafts);
        return pulls;
    }

    private static List<EvidenceItem> register(ToolContext ctx, List<EvidenceItem> drafts) throws ToolGatewayException {
        if (drafts.isEmpty()) return List.of();
        List<String> ids;
        try {
            ids = ctx.getEvidence().putAll(drafts);
        } catch (EvidenceSetSealedException e) {
            throw new ToolGatewayException(ToolFailureKind.DISCARDED, e.getMessage(), e);
        }
        List<EvidenceItem> out = new ArrayList<>();
        for (String id : new LinkedHashSet<>(ids)) out.add(ctx.getEvidence().get(id));
        return out;
    }

    private static double bestOverlappingScore(EvidenceSet set, String path, int start, int end) {
        double best = 0.0;
        for (EvidenceItem item : set.items()) {
            if (item.getKind() != EvidenceKind.CHUNK || !path.equals(item.getFilePath())) continue;
            if (item.getEndLine() < start || item.getStartLine() > end) continue;
            best = Math.max(best, item.getScore());
        }
        return best;
    }

    static String normalizePath(String path) {
        String p = path.trim().replace('\\', '/');
        while (p.startsWith("./")) p = p.substring(2);
        while (p.startsWith("/")) p = p.substring(1);
        return p;
    }

    private static String describe(String what, int number, ItemState state, String title, Set<String> labels,
                                   String body, List<String> touchedFiles) {
        StringBuilder sb = new StringBuilder();
        sb.append(what).append(" #").append(number).append(" [").append(state.label()).append("] ").append(title);
        if (!labels.isEmpty()) sb.append("\nlabels: ").append(String.join(", ", labels));
        if (touchedFiles != null && !touchedFiles.isEmpty()) sb.append("\nfiles: ").append(String.join(", ", touchedFiles));
        if (body != null && !body.isBlank()) {
            String b = body.length() > BODY_PREVIEW_CHARS ? body.substring(0, BODY_PREVIEW_CHARS) + "..." : body;
            sb.append("\n").append(b);
        }
        return sb.toString();
    }
}
