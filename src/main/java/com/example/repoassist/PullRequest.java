package com.example.repoassist;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class PullRequest {
    int number;
    String title;
    String body;
    @Singular
    Set<String> labels;
    ItemState state;
    Instant createdAt;
    Instant updatedAt;
    String url;
    // null when the touched files were not fetched
    List<String> touchedFiles;
}
