package com.example.repoassist;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Service
public class IngestionJobService {

    private final RepositoryService repositoryService;

    // one background job at a time; RepositoryService serializes it against synchronous ingests
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "ingestion-job-thread");
        t.setDaemon(true);
        return t;
    });

    private volatile String currentJobId = null;
    private volatile String currentRoot = null;
    private volatile Instant startedAt = null;
    private volatile Instant finishedAt = null;
    private volatile String error = null;
    private volatile Long publishedEpoch = null;
    private final AtomicInteger totalFiles = new AtomicInteger(0);
    private final AtomicInteger processedFiles = new AtomicInteger(0);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private volatile Future<?> currentFuture = null;

    public IngestionJobService(RepositoryService repositoryService) {
        this.repositoryService = repositoryService;
    }

    public synchronized String startJob(String root) {
        if (currentJobId != null && currentFuture != null && !currentFuture.isDone()) {
            return currentJobId; // job already running
        }
        Path path = repositoryService.resolveRoot(root);

        this.currentJobId = UUID.randomUUID().toString();
        this.currentRoot = path.toString();
        this.startedAt = Instant.now();
        this.finishedAt = null;
        this.error = null;
        this.publishedEpoch = null;
        this.totalFiles.set(0);
        this.processedFiles.set(0);
        this.cancelled.set(false);

        String jobId = currentJobId;
        this.currentFuture = executor.submit(() -> {
            log.info("Ingestion job {} started for {}", jobId, path);
            try {
                RepositorySnapshot s = repositoryService.ingest(path, cancelled::get, (done, total) -> {
                    totalFiles.set(total);
                    processedFiles.set(done);
                });
                publishedEpoch = s.getEpoch();
            } catch (IngestionException e) {
                error = e.getMessage();
                log.warn("Ingestion job {} stopped: {}", jobId, e.getMessage());
            } catch (RuntimeException e) {
                error = e.toString();
                log.error("Ingestion job {} failed", jobId, e);
            } finally {
                finishedAt = Instant.now();
                log.info("Ingestion job {} finished. processed={}/{}", jobId, processedFiles.get(), totalFiles.get());
            }
        });
        return currentJobId;
    }

    public synchronized boolean cancel() {
        if (currentJobId == null) return false;
        cancelled.set(true);
        return true;
    }

    public Map<String, Object> status() {
        Map<String, Object> out = new java.util.HashMap<>();
        out.put("jobId", currentJobId);
        out.put("root", currentRoot);
        out.put("startedAt", startedAt == null ? null : startedAt.toString());
        out.put("finishedAt", finishedAt == null ? null : finishedAt.toString());
        out.put("totalFiles", totalFiles.get());
        out.put("processedFiles", processedFiles.get());
        out.put("cancelled", cancelled.get());
        out.put("running", currentFuture != null && !currentFuture.isDone());
        out.put("publishedEpoch", publishedEpoch);
        out.put("error", error);
        return out;
    }

    /** Waits for the running job, if any; used by tests and shutdown. */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        Future<?> f = currentFuture;
        if (f == null) return true;
        try {
            f.get(timeout, unit);
            return true;
        } catch (ExecutionException e) {
            log.warn("Ingestion job ended abnormally: {}", e.getCause().toString());
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        cancelled.set(true);
        executor.shutdownNow();
    }
}
