package com.example.repoassist;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * GitHub REST v3 implementation. Issues come from the issues endpoint with pull requests
 * filtered out; pull requests come from the pulls endpoint, where a set {@code merged_at} marks a
 * merged one. Text and label filtering happen on the fetched page.
 */
@Slf4j
public class GitHubCodeHostClient implements CodeHostClient {

    static final int PAGE_SIZE = 100;

    private final RestTemplate rest;
    private final ObjectMapper mapper;
    private final String owner;
    private final String name;
    private final boolean fetchPullRequestFiles;

    /**
     * @param rest template whose root URI is the API base, e.g. https://api.github.com
     * @param repository "owner/name"
     */
    public GitHubCodeHostClient(RestTemplate rest, ObjectMapper mapper, String repository, boolean fetchPullRequestFiles) {
        String[] parts = repository.split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException("codehost.github.repository must be owner/name: " + repository);
        }
        this.rest = rest;
        this.mapper = mapper;
        this.owner = parts[0];
        this.name = parts[1];
        this.fetchPullRequestFiles = fetchPullRequestFiles;
    }

    @Override
    public List<Issue> fetchIssues(ExternalQuery query) throws CodeHostException {
        if (query.getState() == ExternalQuery.StateFilter.MERGED) {
            return List.of();
        }
        String state = query.getState().name().toLowerCase();
        JsonNode page;
        if (query.getLabels().isEmpty()) {
            page = get("/repos/{owner}/{name}/issues?state={state}&per_page={perPage}", owner, name, state, PAGE_SIZE);
        } else {
            page = get("/repos/{owner}/{name}/issues?state={state}&labels={labels}&per_page={perPage}",
                    owner, name, state, String.join(",", query.getLabels()), PAGE_SIZE);
        }
        List<Issue> out = new ArrayList<>();
        for (JsonNode n : page) {
            if (n.has("pull_request")) continue;
            String title = n.path("title").asText("");
            String body = n.path("body").asText("");
            if (!query.matchesText(title, body)) continue;
            Issue issue = Issue.builder()
                    .number(n.path("number").asInt())
                    .title(title)
                    .body(body)
                    .labels(labelsOf(n))
                    .state("closed".equals(n.path("state").asText()) ? ItemState.CLOSED : ItemState.OPEN)
                    .createdAt(instant(n, "created_at"))
                    .updatedAt(instant(n, "updated_at"))
                    .url(n.path("html_url").asText(null))
                    .build();
            out.add(issue);
            if (out.size() >= query.getLimit()) break;
        }
        log.debug("Fetched {} issues from {}/{} for {}", out.size(), owner, name, query.cacheKey());
        return out;
    }

    @Override
    public List<PullRequest> fetchPullRequests(ExternalQuery query) throws CodeHostException {
        String state;
        switch (query.getState()) {
            case OPEN:
                state = "open";
                break;
            case ALL:
                state = "all";
                break;
            default:
                state = "closed";
        }
        JsonNode page = get("/repos/{owner}/{name}/pulls?state={state}&per_page={perPage}", owner, name, state, PAGE_SIZE);
        List<PullRequest> out = new ArrayList<>();
        for (JsonNode n : page) {
            ItemState itemState = n.hasNonNull("merged_at") ? ItemState.MERGED
                    : "closed".equals(n.path("state").asText()) ? ItemState.CLOSED : ItemState.OPEN;
            if (!query.getState().accepts(itemState)) continue;
            Set<String> labels = labelsOf(n);
            if (!labels.containsAll(query.getLabels())) continue;
            String title = n.path("title").asText("");
            String body = n.path("body").asText("");
            if (!query.matchesText(title, body)) continue;
            int number = n.path("number").asInt();
            out.add(PullRequest.builder()
                    .number(number)
                    .title(title)
                    .body(body)
                    .labels(labels)
                    .state(itemState)
                    .createdAt(instant(n, "created_at"))
                    .updatedAt(instant(n, "updated_at"))
                    .url(n.path("html_url").asText(null))
                    .touchedFiles(fetchPullRequestFiles ? touchedFiles(number) : null)
                    .build());
            if (out.size() >= query.getLimit()) break;
        }
        log.debug("Fetched {} pull requests from {}/{} for {}", out.size(), owner, name, query.cacheKey());
        return out;
    }

    private List<String> touchedFiles(int number) throws CodeHostException {
        JsonNode files = get("/repos/{owner}/{name}/pulls/{number}/files?per_page={perPage}", owner, name, number, PAGE_SIZE);
        List<String> out = new ArrayList<>();
        for (JsonNode f : files) out.add(f.path("filename").asText());
        return out;
    }

    private JsonNode get(String uri, Object... vars) throws CodeHostException {
        try {
            String body = rest.getForObject(uri, String.class, vars);
            JsonNode node = mapper.readTree(body == null ? "[]" : body);
            if (!node.isArray()) {
                throw new CodeHostException("Unexpected response from " + uri + ": " + node.path("message").asText("not an array"));
            }
            return node;
        } catch (RestClientException e) {
            throw new CodeHostException("GitHub request failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new CodeHostException("GitHub returned malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static Set<String> labelsOf(JsonNode n) {
        Set<String> labels = new LinkedHashSet<>();
        for (JsonNode l : n.path("labels")) labels.add(l.path("name").asText());
        return labels;
    }

    private static Instant instant(JsonNode n, String field) {
        String v = n.path(field).asText(null);
        return v == null ? null : Instant.parse(v);
    }
}
