package com.example.repoassist;

import com.example.repoassist.testutils.TestRepositories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class SufficiencyEvaluatorTest {

    @TempDir
    Path tempDir;

    private RepositorySnapshot snapshot;
    private final SufficiencyEvaluator evaluator = new SufficiencyEvaluator(1.0);

    @BeforeEach
    public void setUp() throws Exception {
        TestRepositories.authRepository(tempDir);
        snapshot = TestRepositories.indexer(new IndexRegistry()).ingest(tempDir);
    }

    @Test
    public void locateNeedsARelevantCodeSpan() {
        EvidenceItem code = EvidenceSetTest.chunkDraft("auth/login.py", 1, 15, 2.5);
        EvidenceItem weak = EvidenceSetTest.chunkDraft("auth/login.py", 1, 15, 0.4);
        EvidenceItem docs = EvidenceSetTest.chunkDraft("README.md", 1, 4, 5.0);

        assertThat(evaluator.evaluate(Intent.LOCATE, List.of(code), snapshot).isSufficient()).isTrue();
        assertThat(evaluator.evaluate(Intent.PATCH, List.of(weak, docs), snapshot).isSufficient()).isFalse();
        assertThat(evaluator.evaluate(Intent.LOCATE, List.of(), snapshot).getReason())
                .isEqualTo("missing a code chunk above the relevance floor");
    }

    @Test
    public void overviewAcceptsDocumentation() {
        EvidenceItem docs = EvidenceSetTest.chunkDraft("README.md", 1, 4, 3.0);
        assertThat(evaluator.evaluate(Intent.OVERVIEW, List.of(docs), snapshot).isSufficient()).isTrue();
        assertThat(evaluator.evaluate(Intent.OVERVIEW, List.of(EvidenceSetTest.issueDraft(1)), snapshot).isSufficient())
                .isFalse();
    }

    @Test
    public void prioritizeNeedsIssuesOrPullRequests() {
        EvidenceItem code = EvidenceSetTest.chunkDraft("auth/login.py", 1, 15, 9.0);
        assertThat(evaluator.evaluate(Intent.PRIORITIZE, List.of(code), snapshot).isSufficient()).isFalse();
        assertThat(evaluator.evaluate(Intent.PRIORITIZE, List.of(EvidenceSetTest.issueDraft(3)), snapshot).isSufficient())
                .isTrue();
    }

    @Test
    public void suggestAcceptsEither() {
        assertThat(evaluator.evaluate(Intent.SUGGEST, List.of(EvidenceSetTest.issueDraft(3)), snapshot).isSufficient())
                .isTrue();
        assertThat(evaluator.evaluate(Intent.SUGGEST,
                List.of(EvidenceSetTest.chunkDraft("util/strings.py", 1, 8, 1.0)), snapshot).isSufficient()).isTrue();
        assertThat(evaluator.evaluate(Intent.SUGGEST, List.of(), snapshot).isSufficient()).isFalse();
    }
}
