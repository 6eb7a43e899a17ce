package com.example.repoassist;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class IngestOnStartupRunnerTest {

    @Test
    public void ingestsTheConfiguredRoot() {
        RepositoryService repo = Mockito.mock(RepositoryService.class);
        Path root = Path.of("/checkout");
        when(repo.resolveRoot(null)).thenReturn(root);
        when(repo.ingest(root)).thenReturn(RepositorySnapshot.empty());
        IngestOnStartupRunner runner = new IngestOnStartupRunner();
        ReflectionTestUtils.setField(runner, "repositoryService", repo);

        runner.run();

        verify(repo).ingest(root);
    }

    @Test
    public void failedIngestionDoesNotStopStartup() {
        RepositoryService repo = Mockito.mock(RepositoryService.class);
        when(repo.resolveRoot(null)).thenThrow(new IngestionException("No repository root given"));
        IngestOnStartupRunner runner = new IngestOnStartupRunner();
        ReflectionTestUtils.setField(runner, "repositoryService", repo);

        assertThatCode(runner::run).doesNotThrowAnyException();
    }
}
