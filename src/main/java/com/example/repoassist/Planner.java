package com.example.repoassist;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Deterministic plan templates per intent, plus the two ways a plan may grow: extra steps
 * proposed by the reasoning engine and refinement after an insufficient evaluation. Neither may
 * take a request past its tool-call budget.
 */
@Slf4j
@Component
public class Planner {

    static final int EXTERNAL_LIMIT = 10;

    private final int maxToolCalls;
    private final int openTopHits;

    @Autowired
    public Planner(Environment env) {
        this(env.getProperty("orchestrator.max-tool-calls", Integer.class, 6),
                env.getProperty("orchestrator.open-top-hits", Integer.class, 2));
    }

    public Planner(int maxToolCalls, int openTopHits) {
        this.maxToolCalls = maxToolCalls;
        this.openTopHits = openTopHits;
    }

    public Plan template(String query, Intent intent, AssistScope scope) {
        Plan plan = new Plan(intent);
        switch (intent) {
            case LOCATE:
                searchAndOpen(plan, query, SearchFilters.NONE);
                break;
            case PATCH:
                searchAndOpen(plan, query, SearchFilters.builder().codeOnly(true).build());
                break;
            case OVERVIEW:
                plan.add(PlanStep.of(intent, ToolRequest.searchRepo(query, SearchFilters.builder().docsOnly(true).build())));
                plan.add(PlanStep.of(intent, ToolRequest.searchRepo(query, SearchFilters.NONE)));
                break;
            case PRIORITIZE:
                plan.add(PlanStep.of(intent, ToolRequest.getIssue(openItems())));
                plan.add(PlanStep.of(intent, ToolRequest.getPullRequests(openItems())));
                break;
            case SUGGEST:
                plan.add(PlanStep.of(intent, ToolRequest.searchRepo(query, SearchFilters.NONE)));
                plan.add(PlanStep.of(intent, ToolRequest.getIssue(openItems())));
                break;
            default:
                throw new IllegalStateException("unknown intent " + intent);
        }
        Plan scoped = applyScope(plan, scope);
        if (scoped.isEmpty()) {
            // nothing repository-local left, e.g. prioritization in files-only scope
            scoped.add(PlanStep.of(intent, ToolRequest.searchRepo(query, SearchFilters.NONE)));
        }
        scoped.truncate(maxToolCalls);
        return scoped;
    }

    /** Appends engine-proposed steps that are permitted, new and within the remaining budget. */
    public int extend(Plan plan, List<ToolRequest> extra, AssistScope scope, int budget) {
        Set<String> known = new HashSet<>();
        for (PlanStep s : plan.getSteps()) known.add(s.toString());
        int added = 0;
        for (ToolRequest r : extra) {
            if (plan.size() >= budget) break;
            if (r.getName().isExternal() && !scope.allowsExternal()) continue;
            if (r.getName() == ToolName.OPEN_FILE && (r.getPath() == null || r.getPath().isBlank())) continue;
            if (!known.add(r.toString())) continue;
            plan.add(PlanStep.of(plan.getIntent(), r));
            added++;
        }
        if (added > 0) log.info("Plan extended by {} engine-proposed steps: {}", added, plan);
        return added;
    }

    /**
     * Next plan after an insufficient evaluation: filtered searches are repeated without filters,
     * issue and pull request lookups are widened to every state, and location-type intents open
     * the top hit of the broadened search. Requests already executed are never repeated, so the
     * result may be empty.
     */
    public Plan refine(String query, Plan previous, AssistScope scope, Set<String> executed, int budget) {
        Intent intent = previous.getIntent();
        Plan next = new Plan(intent);
        Set<String> planned = new HashSet<>(executed);
        PlanStep firstSearch = null;

        List<ToolRequest> broadened = new ArrayList<>();
        for (PlanStep s : previous.getSteps()) {
            ToolRequest r = s.getRequest();
            if (r == null) continue;
            switch (r.getName()) {
                case SEARCH_REPO:
                    broadened.add(ToolRequest.searchRepo(r.getQuery(), SearchFilters.NONE));
                    break;
                case GET_ISSUE:
                    broadened.add(ToolRequest.getIssue(widen(r.getExternalQuery())));
                    break;
                case GET_PULL_REQUESTS:
                    broadened.add(ToolRequest.getPullRequests(widen(r.getExternalQuery())));
                    break;
                default:
                    break;
            }
        }
        if (broadened.isEmpty() || intent == Intent.PRIORITIZE) {
            broadened.add(ToolRequest.searchRepo(query, SearchFilters.NONE));
        }
        for (ToolRequest r : broadened) {
            if (!planned.add(r.toString())) continue;
            PlanStep step = PlanStep.of(intent, r);
            next.add(step);
            if (firstSearch == null && r.getName() == ToolName.SEARCH_REPO) firstSearch = step;
        }
        if (firstSearch != null && (intent == Intent.LOCATE || intent == Intent.PATCH)) {
            next.add(PlanStep.openHit(intent, firstSearch, 1));
        }
        Plan scoped = applyScope(next, scope);
        scoped.truncate(budget);
        log.info("Refined plan ({} steps within budget {}): {}", scoped.size(), budget, scoped);
        return scoped;
    }

    private void searchAndOpen(Plan plan, String query, SearchFilters filters) {
        PlanStep search = PlanStep.of(plan.getIntent(), ToolRequest.searchRepo(query, filters));
        plan.add(search);
        for (int i = 1; i <= openTopHits; i++) {
            plan.add(PlanStep.openHit(plan.getIntent(), search, i));
        }
    }

    private static Plan applyScope(Plan plan, AssistScope scope) {
        if (scope.allowsExternal()) return plan;
        Plan out = new Plan(plan.getIntent());
        for (PlanStep s : plan.getSteps()) {
            if (!s.getTool().isExternal()) out.add(s);
        }
        return out;
    }

    private static ExternalQuery openItems() {
        return new ExternalQuery("", ExternalQuery.StateFilter.OPEN, List.of(), EXTERNAL_LIMIT);
    }

    private static ExternalQuery widen(ExternalQuery q) {
        return new ExternalQuery(q.getQuery(), ExternalQuery.StateFilter.ALL, q.getLabels(), q.getLimit() * 2);
    }

    public int getMaxToolCalls() {
        return maxToolCalls;
    }
}
