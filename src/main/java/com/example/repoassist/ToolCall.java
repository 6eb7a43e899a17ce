package com.example.repoassist;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/** Trace record of one executed tool invocation. */
@Value
@Builder
public class ToolCall {
    String id;
    ToolName tool;
    Map<String, Object> parameters;
    Intent intent;
    Instant timestamp;
    boolean success;
    List<String> evidenceIds;
    // raw text result, set for open_file
    String text;
    ToolFailureKind failureKind;
    String failureMessage;
}
