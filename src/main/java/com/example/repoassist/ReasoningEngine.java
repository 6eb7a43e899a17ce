package com.example.repoassist;

import java.util.List;
import java.util.Map;

/**
 * External reasoning engine. Every method is an oracle call: the orchestrator wraps it in
 * {@link OracleCaller} for timeout and retry, and never depends on how the engine reaches its
 * answer.
 */
public interface ReasoningEngine {

    /** Maps a query to exactly one intent; anything that is not a known intent label is an error. */
    Intent classify(String query, ClassificationContext context) throws OracleException;

    /** Answer text with embedded {@code [E<n>]} citation markers. */
    String synthesize(SynthesisRequest request) throws OracleException;

    /** Short descriptive tags for a batch of files or directories, keyed by path. Unknown paths are ignored. */
    Map<String, String> describe(List<TagSubject> subjects) throws OracleException;

    /** Extra tool requests to append to a templated plan; the orchestrator enforces the step cap. */
    default List<ToolRequest> proposeExtraSteps(String query, Intent intent, List<ToolRequest> planned) throws OracleException {
        return List.of();
    }
}
