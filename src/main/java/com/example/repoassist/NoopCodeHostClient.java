package com.example.repoassist;

import java.util.Collections;
import java.util.List;

/** Used when no code-host repository is configured; every lookup is empty. */
public class NoopCodeHostClient implements CodeHostClient {

    @Override
    public List<Issue> fetchIssues(ExternalQuery query) {
        return Collections.emptyList();
    }

    @Override
    public List<PullRequest> fetchPullRequests(ExternalQuery query) {
        return Collections.emptyList();
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
