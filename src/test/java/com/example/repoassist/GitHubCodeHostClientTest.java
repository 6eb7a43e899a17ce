package com.example.repoassist;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.ExpectedCount.never;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.http.HttpMethod.GET;

public class GitHubCodeHostClientTest {

    private static final String API = "https://api.github.com";

    private MockRestServiceServer server;
    private GitHubCodeHostClient client;

    @BeforeEach
    public void setUp() {
        RestTemplate rest = new RestTemplateBuilder().rootUri(API).build();
        server = MockRestServiceServer.bindTo(rest).build();
        client = new GitHubCodeHostClient(rest, new ObjectMapper(), "acme/shop", false);
    }

    @Test
    public void issuesSkipPullRequestsAndFilterByText() throws Exception {
        String page = "["
                + "{\"number\":7,\"title\":\"Login fails on empty password\",\"body\":\"steps...\",\"state\":\"open\","
                + "\"labels\":[{\"name\":\"bug\"}],\"created_at\":\"2024-01-02T03:04:05Z\",\"html_url\":\"https://github.com/acme/shop/issues/7\"},"
                + "{\"number\":8,\"title\":\"Login PR\",\"state\":\"open\",\"pull_request\":{}},"
                + "{\"number\":9,\"title\":\"Dark mode\",\"body\":\"please\",\"state\":\"open\"}"
                + "]";
        server.expect(requestTo(API + "/repos/acme/shop/issues?state=open&per_page=100"))
                .andExpect(method(GET))
                .andRespond(withSuccess(page, MediaType.APPLICATION_JSON));

        List<Issue> issues = client.fetchIssues(new ExternalQuery("login", ExternalQuery.StateFilter.OPEN, null, 10));

        server.verify();
        assertThat(issues).hasSize(1);
        Issue i = issues.get(0);
        assertThat(i.getNumber()).isEqualTo(7);
        assertThat(i.getLabels()).containsExactly("bug");
        assertThat(i.getState()).isEqualTo(ItemState.OPEN);
        assertThat(i.getCreatedAt()).isEqualTo(Instant.parse("2024-01-02T03:04:05Z"));
        assertThat(i.getUrl()).endsWith("/issues/7");
    }

    @Test
    public void labelsArePassedToTheIssuesEndpoint() throws Exception {
        server.expect(requestTo(startsWith(API + "/repos/acme/shop/issues?state=all&labels=")))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        assertThat(client.fetchIssues(new ExternalQuery("", ExternalQuery.StateFilter.ALL, List.of("bug", "ui"), 5))).isEmpty();
        server.verify();
    }

    @Test
    public void mergedIssuesAreNeverRequested() throws Exception {
        server.expect(never(), requestTo(startsWith(API)));

        assertThat(client.fetchIssues(new ExternalQuery("", ExternalQuery.StateFilter.MERGED, null, 5))).isEmpty();
        server.verify();
    }

    @Test
    public void mergedPullRequestsComeFromClosedOnes() throws Exception {
        String page = "["
                + "{\"number\":3,\"title\":\"Hash passwords\",\"state\":\"closed\",\"merged_at\":\"2024-02-01T00:00:00Z\"},"
                + "{\"number\":4,\"title\":\"Abandoned\",\"state\":\"closed\",\"merged_at\":null}"
                + "]";
        server.expect(requestTo(API + "/repos/acme/shop/pulls?state=closed&per_page=100"))
                .andRespond(withSuccess(page, MediaType.APPLICATION_JSON));

        List<PullRequest> prs = client.fetchPullRequests(new ExternalQuery("", ExternalQuery.StateFilter.MERGED, null, 10));

        assertThat(prs).extracting(PullRequest::getNumber).containsExactly(3);
        assertThat(prs.get(0).getState()).isEqualTo(ItemState.MERGED);
        assertThat(prs.get(0).getTouchedFiles()).isNull();
    }

    @Test
    public void touchedFilesAreFetchedWhenEnabled() throws Exception {
        RestTemplate rest = new RestTemplateBuilder().rootUri(API).build();
        MockRestServiceServer s = MockRestServiceServer.bindTo(rest).build();
        GitHubCodeHostClient withFiles = new GitHubCodeHostClient(rest, new ObjectMapper(), "acme/shop", true);
        s.expect(requestTo(API + "/repos/acme/shop/pulls?state=open&per_page=100"))
                .andRespond(withSuccess("[{\"number\":5,\"title\":\"Refactor login\",\"state\":\"open\"}]", MediaType.APPLICATION_JSON));
        s.expect(requestTo(API + "/repos/acme/shop/pulls/5/files?per_page=100"))
                .andRespond(withSuccess("[{\"filename\":\"auth/login.py\"},{\"filename\":\"README.md\"}]", MediaType.APPLICATION_JSON));

        List<PullRequest> prs = withFiles.fetchPullRequests(new ExternalQuery("", ExternalQuery.StateFilter.OPEN, null, 10));

        s.verify();
        assertThat(prs.get(0).getTouchedFiles()).containsExactly("auth/login.py", "README.md");
    }

    @Test
    public void limitStopsTheScan() throws Exception {
        server.expect(requestTo(API + "/repos/acme/shop/issues?state=open&per_page=100"))
                .andRespond(withSuccess("[{\"number\":1,\"title\":\"a\"},{\"number\":2,\"title\":\"b\"}]", MediaType.APPLICATION_JSON));

        assertThat(client.fetchIssues(new ExternalQuery("", null, null, 1))).extracting(Issue::getNumber).containsExactly(1);
    }

    @Test
    public void serverErrorsBecomeCodeHostExceptions() {
        server.expect(requestTo(API + "/repos/acme/shop/pulls?state=open&per_page=100")).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchPullRequests(new ExternalQuery("", ExternalQuery.StateFilter.OPEN, null, 10)))
                .isInstanceOf(CodeHostException.class)
                .hasMessageStartingWith("GitHub request failed");
    }

    @Test
    public void nonArrayResponsesAreRejected() {
        server.expect(requestTo(API + "/repos/acme/shop/issues?state=open&per_page=100"))
                .andRespond(withSuccess("{\"message\":\"Not Found\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.fetchIssues(new ExternalQuery("", null, null, 10)))
                .isInstanceOf(CodeHostException.class)
                .hasMessageContaining("Not Found");
    }

    @Test
    public void repositoryMustBeOwnerSlashName() {
        assertThatThrownBy(() -> new GitHubCodeHostClient(new RestTemplate(), new ObjectMapper(), "shop", false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
