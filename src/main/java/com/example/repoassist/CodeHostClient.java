package com.example.repoassist;

import java.util.List;

/** Fetches issues and pull requests of the session's repository from its code host. */
public interface CodeHostClient {

    List<Issue> fetchIssues(ExternalQuery query) throws CodeHostException;

    List<PullRequest> fetchPullRequests(ExternalQuery query) throws CodeHostException;

    /** Whether a remote repository is configured at all. */
    default boolean isConfigured() {
        return true;
    }
}
