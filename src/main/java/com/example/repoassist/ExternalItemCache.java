package com.example.repoassist;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped cache of issues and pull requests fetched from the code host, keyed by
 * query, state and labels. A cached result fetched with a smaller limit than a later request is
 * not reused for it.
 */
public class ExternalItemCache {

    private static final class Entry<T> {
        final int limit;
        final List<T> items;

        Entry(int limit, List<T> items) {
            this.limit = limit;
            this.items = List.copyOf(items);
        }
    }

    private final Map<String, Entry<Issue>> issueQueries = new ConcurrentHashMap<>();
    private final Map<String, Entry<PullRequest>> pullQueries = new ConcurrentHashMap<>();
    private final Map<Integer, Issue> issues = new ConcurrentHashMap<>();
    private final Map<Integer, PullRequest> pulls = new ConcurrentHashMap<>();

    public List<Issue> cachedIssues(ExternalQuery q) {
        return lookup(issueQueries.get(q.cacheKey()), q.getLimit());
    }

    public List<PullRequest> cachedPullRequests(ExternalQuery q) {
        return lookup(pullQueries.get(q.cacheKey()), q.getLimit());
    }

    private static <T> List<T> lookup(Entry<T> e, int limit) {
        if (e == null) return null;
        // a short result under a smaller limit may have been truncated
        if (e.limit < limit && e.items.size() >= e.limit) return null;
        return e.items.size() <= limit ? e.items : e.items.subList(0, limit);
    }

    public void storeIssues(ExternalQuery q, List<Issue> fetched) {
        issueQueries.put(q.cacheKey(), new Entry<>(q.getLimit(), fetched));
        for (Issue i : fetched) issues.put(i.getNumber(), i);
    }

    public void storePullRequests(ExternalQuery q, List<PullRequest> fetched) {
        pullQueries.put(q.cacheKey(), new Entry<>(q.getLimit(), fetched));
        for (PullRequest p : fetched) pulls.put(p.getNumber(), p);
    }

    public Issue issue(int number) {
        return issues.get(number);
    }

    public PullRequest pullRequest(int number) {
        return pulls.get(number);
    }

    public void clear() {
        issueQueries.clear();
        pullQueries.clear();
        issues.clear();
        pulls.clear();
    }
}
