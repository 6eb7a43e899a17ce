package com.example.repoassist;

import java.time.Instant;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class Issue {
    int number;
    String title;
    String body;
    @Singular
    Set<String> labels;
    ItemState state;
    Instant createdAt;
    Instant updatedAt;
    String url;
}
