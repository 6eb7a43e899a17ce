package com.example.repoassist;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

/**
 * Planner-executor loop for one query:
 * IDLE, CLASSIFYING, PLANNING, EXECUTING, EVALUATING, SYNTHESIZING, DONE, where EVALUATING may go
 * back to PLANNING to refine and any state may end in INSUFFICIENT or FAILED.
 *
 * <p>The whole request runs on one snapshot lease, so a re-ingestion waits for it to finish.
 * Requests of the same session are serialized on the session lock.
 */
@Slf4j
@Service
public class AgentOrchestrator {

    static final String INSUFFICIENT_PREFIX = "Insufficient evidence:";

    private final IndexRegistry registry;
    private final EvidenceStore evidenceStore;
    private final ReasoningEngine engine;
    private final OracleCaller oracle;
    private final Planner planner;
    private final PlanExecutor executor;
    private final SufficiencyEvaluator evaluator;
    private final CitationValidator citationValidator;
    private final ResponseComposer composer;
    private final int maxRefinements;

    public AgentOrchestrator(IndexRegistry registry, EvidenceStore evidenceStore, ReasoningEngine engine,
                             OracleCaller oracle, Planner planner, PlanExecutor executor,
                             SufficiencyEvaluator evaluator, CitationValidator citationValidator,
                             ResponseComposer composer, Environment env) {
        this.registry = registry;
        this.evidenceStore = evidenceStore;
        this.engine = engine;
        this.oracle = oracle;
        this.planner = planner;
        this.executor = executor;
        this.evaluator = evaluator;
        this.citationValidator = citationValidator;
        this.composer = composer;
        this.maxRefinements = env.getProperty("orchestrator.max-refinements", Integer.class, 2);
    }

    /** Mode and scope fall back to the session's settings when null. */
    public ResponseEnvelope answer(Session session, String query, AssistMode mode, AssistScope scope) {
        if (query == null || query.isBlank()) throw new IllegalArgumentException("query must not be empty");
        AssistMode m = mode == null ? session.getMode() : mode;
        AssistScope s = scope == null ? session.getScope() : scope;
        RequestHandle handle = new RequestHandle(UUID.randomUUID().toString());

        session.getRequestLock().lock();
        try {
            session.setActiveRequest(handle);
            ResponseEnvelope envelope;
            try (IndexRegistry.Lease lease = registry.acquire()) {
                Run run = new Run(session, handle, query, m, s, lease.snapshot());
                envelope = run.execute();
            }
            session.recordQuery(query, envelope.getAnswer(), envelope.getStatus());
            return envelope;
        } finally {
            session.setActiveRequest(null);
            session.getRequestLock().unlock();
        }
    }

    /** State of one request while it moves through the loop. */
    private final class Run {
        private final Session session;
        private final RequestHandle handle;
        private final String query;
        private final AssistMode mode;
        private final AssistScope scope;
        private final RepositorySnapshot snapshot;
        private final EvidenceSet evidence;
        private final List<RequestState> states = new ArrayList<>();
        private final List<ToolCall> trace = new ArrayList<>();
        private final List<String> notes = new ArrayList<>();
        private final Set<String> executed = new HashSet<>();
        private final AtomicInteger callIds = new AtomicInteger();
        private Intent intent;

        Run(Session session, RequestHandle handle, String query, AssistMode mode, AssistScope scope,
            RepositorySnapshot snapshot) {
            this.session = session;
            this.handle = handle;
            this.query = query;
            this.mode = mode;
            this.scope = scope;
            this.snapshot = snapshot;
            this.evidence = evidenceStore.open(handle.getRequestId(), snapshot, session.getExternalCache());
            handle.attach(evidence);
            enter(RequestState.IDLE);
        }

        ResponseEnvelope execute() {
            if (snapshot.getEpoch() == 0) {
                return failed(ErrorKind.NO_REPOSITORY, "No repository has been ingested yet");
            }

            enter(RequestState.CLASSIFYING);
            try {
                ClassificationContext ctx = ClassificationContext.builder()
                        .mode(mode)
                        .scope(scope)
                        .recentQueries(session.recentQueries())
                        .repositoryId(snapshot.getId())
                        .totalFiles(snapshot.totalFiles())
                        .build();
                intent = bias(oracle.call("classification", () -> engine.classify(query, ctx)));
            } catch (OracleException e) {
                return failed(ErrorKind.CLASSIFICATION_FAILED, "Could not classify the query (" + e.kind() + "): " + e.getMessage());
            }
            log.info("Request {} classified as {}", handle.getRequestId(), intent);
            if (handle.isCancelled()) return cancelled();

            enter(RequestState.PLANNING);
            int budget = planner.getMaxToolCalls();
            Plan plan = planner.template(query, intent, scope);
            try {
                List<ToolRequest> extra = oracle.call("plan proposal", () -> engine.proposeExtraSteps(query, intent, plan.requests()));
                planner.extend(plan, extra, scope, budget);
            } catch (OracleException e) {
                log.warn("Request {}: no extra steps, proposal failed: {}", handle.getRequestId(), e.getMessage());
            }

            int refinements = 0;
            SufficiencyEvaluator.Verdict verdict;
            Plan current = plan;
            while (true) {
                if (handle.isCancelled()) return cancelled();
                enter(RequestState.EXECUTING);
                List<ToolCall> calls = executor.execute(current, snapshot, evidence, callIds, handle::isCancelled);
                record(calls);
                if (handle.isCancelled()) return cancelled();

                enter(RequestState.EVALUATING);
                verdict = evaluator.evaluate(intent, evidence.items(), snapshot);
                log.info("Request {} evaluation after {} tool calls: {}", handle.getRequestId(), trace.size(), verdict.getReason());
                if (verdict.isSufficient()) break;

                int remaining = budget - trace.size();
                if (refinements >= maxRefinements || remaining <= 0) break;
                Plan refined = planner.refine(query, current, scope, executed, remaining);
                if (refined.isEmpty()) break;
                refinements++;
                enter(RequestState.PLANNING);
                current = refined;
            }

            if (!verdict.isSufficient()) {
                if (!trace.isEmpty() && trace.stream().noneMatch(ToolCall::isSuccess)) {
                    return failed(ErrorKind.TOOL_GATEWAY_EXHAUSTED,
                            "All " + trace.size() + " tool calls failed: " + String.join("; ", notes));
                }
                return insufficient(verdict);
            }

            enter(RequestState.SYNTHESIZING);
            String raw;
            try {
                SynthesisRequest req = SynthesisRequest.builder()
                        .query(query)
                        .intent(intent)
                        .mode(mode)
                        .evidence(evidence.items())
                        .notes(notes)
                        .build();
                raw = oracle.call("synthesis", () -> engine.synthesize(req));
            } catch (OracleException e) {
                return failed(e.kind(), "Synthesis failed: " + e.getMessage());
            }
            if (handle.isCancelled()) return cancelled();

            CitationValidator.Result validated;
            try {
                validated = citationValidator.validate(raw, evidence);
            } catch (CitationStaleException e) {
                return failed(ErrorKind.CITATION_STALE, e.getMessage());
            }
            if (!validated.getStripped().isEmpty()) {
                notes.add("Removed citations not backed by gathered evidence: " + String.join(", ", validated.getStripped()));
            }
            if (validated.getCitations().isEmpty()) {
                notes.add("The answer carries no verifiable citations");
            }
            ResponseComposer.Composed composed = composer.compose(validated.getText(), mode);

            enter(RequestState.DONE);
            ResponseEnvelope.ResponseEnvelopeBuilder b = base(ResponseStatus.ANSWERED)
                    .answer(composed.getAnswer())
                    .patchDiff(composed.getPatchDiff())
                    .nextActions(composed.getNextActions());
            for (String id : validated.getCitations()) b.citation(evidence.get(id));
            return b.build();
        }

        private Intent bias(Intent classified) {
            if (mode == AssistMode.PATCH && classified == Intent.LOCATE) return Intent.PATCH;
            if (mode == AssistMode.SUGGEST && classified == Intent.OVERVIEW) return Intent.SUGGEST;
            return classified;
        }

        private void record(List<ToolCall> calls) {
            for (ToolCall c : calls) {
                trace.add(c);
                executed.add(c.getTool().wireName() + c.getParameters());
                if (!c.isSuccess()) {
                    notes.add(c.getTool().wireName() + " " + c.getParameters() + " failed ("
                            + c.getFailureKind() + "): " + c.getFailureMessage());
                }
            }
        }

        private void enter(RequestState state) {
            states.add(state);
            handle.setState(state);
            if (state != RequestState.IDLE) log.info("Request {} -> {}", handle.getRequestId(), state);
        }

        private ResponseEnvelope.ResponseEnvelopeBuilder base(ResponseStatus status) {
            return ResponseEnvelope.builder()
                    .requestId(handle.getRequestId())
                    .sessionId(session.getId())
                    .status(status)
                    .intent(intent)
                    .mode(mode)
                    .scope(scope)
                    .epoch(snapshot.getEpoch())
                    .evidence(evidence.items())
                    .toolCalls(trace)
                    .notes(notes)
                    .states(states);
        }

        private ResponseEnvelope insufficient(SufficiencyEvaluator.Verdict verdict) {
            enter(RequestState.INSUFFICIENT);
            String statement = INSUFFICIENT_PREFIX + " could not find " + verdict.getRequirement()
                    + " for this question in repository " + snapshot.getId() + " after " + trace.size()
                    + " tool calls. No answer was generated; the evidence gathered so far is listed as-is.";
            return base(ResponseStatus.INSUFFICIENT).answer(statement).build();
        }

        private ResponseEnvelope failed(ErrorKind kind, String message) {
            RequestState at = handle.getState();
            enter(RequestState.FAILED);
            log.warn("Request {} failed in {}: {} {}", handle.getRequestId(), at, kind, message);
            return base(ResponseStatus.FAILED).error(new ErrorInfo(kind, at, message)).build();
        }

        private ResponseEnvelope cancelled() {
            evidence.seal();
            return failed(ErrorKind.CANCELLED, "Request was cancelled");
        }
    }
}
