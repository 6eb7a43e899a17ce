package com.example.repoassist;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class SynthesisRequest {
    String query;
    Intent intent;
    AssistMode mode;
    /** The whole evidence set in provenance order; ids are the only citable markers. */
    @Singular("evidenceItem")
    List<EvidenceItem> evidence;
    /** Failed tool calls the answer should acknowledge instead of guessing around. */
    @Singular
    List<String> notes;
}
