package com.example.repoassist;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * What a caller gets back for one query. {@code citations} are the evidence items the answer
 * cites, in order of first citation; {@code evidence} is everything gathered, in provenance order.
 */
@Value
@Builder
public class ResponseEnvelope {
    String requestId;
    String sessionId;
    ResponseStatus status;
    Intent intent;
    AssistMode mode;
    AssistScope scope;
    long epoch;
    String answer;
    @Singular
    List<EvidenceItem> citations;
    String patchDiff;
    @Singular
    List<String> nextActions;
    @Singular("evidenceItem")
    List<EvidenceItem> evidence;
    @Singular
    List<ToolCall> toolCalls;
    @Singular
    List<String> notes;
    /** States visited, starting at IDLE. */
    @Singular
    List<RequestState> states;
    ErrorInfo error;
}
