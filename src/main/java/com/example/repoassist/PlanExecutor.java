package com.example.repoassist;

import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Runs the steps of a plan through the tool gateway. Steps without a dependency start together
 * on a bounded pool; an open_file step waits for the search it depends on and targets one of its
 * hits. The returned trace is in plan order whatever order the calls finished in.
 */
@Slf4j
@Component
public class PlanExecutor {

    private final ToolGateway gateway;
    private final ExecutorService pool;

    @Autowired
    public PlanExecutor(ToolGateway gateway, Environment env) {
        this(gateway, env.getProperty("orchestrator.worker-threads", Integer.class, 4));
    }

    public PlanExecutor(ToolGateway gateway, int workerThreads) {
        this.gateway = gateway;
        AtomicInteger n = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(Math.max(1, workerThreads), r -> {
            Thread t = new Thread(r, "tool-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Outcome of one step; a skipped dependent step has no call. */
    private static final class StepResult {
        final ToolCall call;
        final List<EvidenceItem> hits;

        StepResult(ToolCall call, List<EvidenceItem> hits) {
            this.call = call;
            this.hits = hits;
        }
    }

    /**
     * @param ids       supplies tool call ids ("T1", "T2", ...) across the whole request
     * @param cancelled checked before every call; a cancelled step is recorded as discarded
     */
    public List<ToolCall> execute(Plan plan, RepositorySnapshot snapshot, EvidenceSet evidence,
                                  AtomicInteger ids, BooleanSupplier cancelled) {
        Map<PlanStep, CompletableFuture<StepResult>> futures = new IdentityHashMap<>();
        Map<PlanStep, String> callIds = new IdentityHashMap<>();
        for (PlanStep step : plan.getSteps()) {
            callIds.put(step, "T" + ids.incrementAndGet());
        }
        for (PlanStep step : plan.getSteps()) {
            String callId = callIds.get(step);
            CompletableFuture<StepResult> f;
            if (!step.isDependent()) {
                ToolRequest request = step.getRequest();
                f = CompletableFuture.supplyAsync(
                        () -> run(callId, step.getIntent(), request, snapshot, evidence, cancelled), pool);
            } else {
                f = futures.get(step.getDependsOn()).thenApplyAsync(parent -> {
                    ToolRequest open = targetOf(step, parent);
                    if (open == null) {
                        log.debug("Skipping {}: no hit {} to open", callId, step.getHitRank());
                        return new StepResult(null, List.of());
                    }
                    return run(callId, step.getIntent(), open, snapshot, evidence, cancelled);
                }, pool);
            }
            futures.put(step, f);
        }

        List<ToolCall> trace = new ArrayList<>();
        for (PlanStep step : plan.getSteps()) {
            StepResult r = futures.get(step).join();
            if (r.call != null) trace.add(r.call);
        }
        return trace;
    }

    /** The hit-rank-th distinct file among the search's chunk hits, opened over that chunk's lines. */
    private static ToolRequest targetOf(PlanStep step, StepResult parent) {
        if (parent.call == null || !parent.call.isSuccess()) return null;
        Set<String> files = new LinkedHashSet<>();
        for (EvidenceItem hit : parent.hits) {
            if (hit.getKind() != EvidenceKind.CHUNK) continue;
            if (files.add(hit.getFilePath()) && files.size() == step.getHitRank()) {
                return ToolRequest.openFile(hit.getFilePath(), hit.getStartLine(), hit.getEndLine());
            }
        }
        return null;
    }

    private StepResult run(String callId, Intent intent, ToolRequest request, RepositorySnapshot snapshot,
                           EvidenceSet evidence, BooleanSupplier cancelled) {
        ToolCall.ToolCallBuilder call = ToolCall.builder()
                .id(callId)
                .tool(request.getName())
                .parameters(request.describe())
                .intent(intent)
                .timestamp(Instant.now());
        if (cancelled.getAsBoolean()) {
            return new StepResult(call.success(false).evidenceIds(List.of())
                    .failureKind(ToolFailureKind.DISCARDED).failureMessage("request cancelled").build(), List.of());
        }
        ToolContext ctx = new ToolContext(callId, snapshot, evidence, evidence.getExternalCache());
        int before = evidence.size();
        try {
            List<EvidenceItem> hits = List.of();
            List<String> evidenceIds = new ArrayList<>();
            String text = null;
            switch (request.getName()) {
                case SEARCH_REPO:
                    hits = gateway.searchRepo(request.getQuery(), request.getFilters(), ctx);
                    for (EvidenceItem h : hits) evidenceIds.add(h.getId());
                    break;
                case OPEN_FILE: {
                    text = gateway.openFile(request.getPath(), request.getStartLine(), request.getEndLine(), ctx);
                    String path = DefaultToolGateway.normalizePath(request.getPath());
                    addId(evidenceIds, evidence, EvidenceItem.spanKey(path, request.getStartLine(), request.getEndLine()));
                    break;
                }
                case GET_ISSUE:
                    for (Issue i : gateway.getIssue(request.getExternalQuery(), ctx)) {
                        addId(evidenceIds, evidence, "issue:" + i.getNumber());
                    }
                    break;
                case GET_PULL_REQUESTS:
                    for (PullRequest p : gateway.getPullRequests(request.getExternalQuery(), ctx)) {
                        addId(evidenceIds, evidence, "pr:" + p.getNumber());
                    }
                    break;
                default:
                    throw new IllegalStateException("unknown tool " + request.getName());
            }
            log.info("{} {} ok: {} evidence items ({} new)", callId, request, evidenceIds.size(), evidence.size() - before);
            return new StepResult(call.success(true).evidenceIds(evidenceIds).text(text).build(), hits);
        } catch (ToolGatewayException e) {
            log.warn("{} {} failed ({}): {}", callId, request, e.getKind(), e.getMessage());
            return new StepResult(call.success(false).evidenceIds(List.of())
                    .failureKind(e.getKind()).failureMessage(e.getMessage()).build(), List.of());
        }
    }

    private static void addId(List<String> ids, EvidenceSet evidence, String sourceKey) {
        String id = evidence.idForSource(sourceKey);
        if (id != null && !ids.contains(id)) ids.add(id);
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }
}
