package com.example.repoassist;

import com.example.repoassist.testutils.TestRepositories;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

public class RepositoryServiceTest {

    @TempDir
    Path tempDir;

    @Test
    public void overlappingIngestionsPublishInEpochOrder() throws Exception {
        Path slow = TestRepositories.authRepository(tempDir.resolve("slow"));
        Path fast = TestRepositories.authRepository(tempDir.resolve("fast"));
        IndexRegistry registry = new IndexRegistry();
        RepositoryService service = new RepositoryService(TestRepositories.indexer(registry), registry,
                TestRepositories.environment());

        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BooleanSupplier holdFirstFile = () -> {
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return false;
        };

        CompletableFuture<RepositorySnapshot> first =
                CompletableFuture.supplyAsync(() -> service.ingest(slow, holdFirstFile, null));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        CompletableFuture<RepositorySnapshot> second = CompletableFuture.supplyAsync(() -> service.ingest(fast));

        Thread.sleep(200);
        assertThat(second.isDone()).isFalse();
        assertThat(registry.current().getEpoch()).isZero();

        release.countDown();
        RepositorySnapshot a = first.get(5, TimeUnit.SECONDS);
        RepositorySnapshot b = second.get(5, TimeUnit.SECONDS);

        assertThat(a.getEpoch()).isEqualTo(1);
        assertThat(b.getEpoch()).isEqualTo(2);
        assertThat(registry.current().getEpoch()).isEqualTo(2);
        assertThat(registry.current().getRootPath()).isEqualTo(fast.toAbsolutePath().normalize().toString());
    }

    @Test
    public void listsFilesByPrefixAndExtension() throws Exception {
        TestRepositories.authRepository(tempDir);
        IndexRegistry registry = new IndexRegistry();
        RepositoryService service = new RepositoryService(TestRepositories.indexer(registry), registry,
                TestRepositories.environment());
        service.ingest(tempDir);

        assertThat(service.listFiles(null, List.of(".py"))).containsExactly("auth/login.py", "util/strings.py");
        assertThat(service.listFiles("util", List.of())).containsExactly("util/strings.py");
        assertThat(service.status().get("epoch")).isEqualTo(1L);
    }
}
