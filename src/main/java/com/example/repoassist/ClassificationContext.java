package com.example.repoassist;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** What the classifier may look at besides the query itself. */
@Value
@Builder
public class ClassificationContext {
    AssistMode mode;
    AssistScope scope;
    /** Earlier queries of the session, oldest first. */
    @Singular
    List<String> recentQueries;
    String repositoryId;
    int totalFiles;
}
