package com.example.repoassist;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin/repository")
public class AdminController {

    @Autowired
    private RepositoryService repositoryService;

    @Autowired
    private IngestionJobService ingestionJobService;

    /** Synchronous ingestion; returns once the new epoch is published. */
    @PostMapping("/ingest")
    public Map<String, Object> ingest(@RequestParam(name = "root", required = false) String root) {
        repositoryService.ingest(repositoryService.resolveRoot(root));
        return repositoryService.status();
    }

    @PostMapping("/ingest/start")
    public Map<String, Object> startIngest(@RequestParam(name = "root", required = false) String root) {
        String jobId = ingestionJobService.startJob(root);
        return Collections.singletonMap("jobId", jobId);
    }

    @GetMapping("/ingest/status")
    public Map<String, Object> ingestStatus() {
        return ingestionJobService.status();
    }

    @PostMapping("/ingest/cancel")
    public String cancelIngest() {
        return ingestionJobService.cancel() ? "cancelled" : "no-job";
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return repositoryService.status();
    }

    @GetMapping("/files")
    public List<String> files(@RequestParam(name = "prefix", required = false) String prefix,
                              @RequestParam(name = "ext", required = false) List<String> extensions) {
        return repositoryService.listFiles(prefix, extensions);
    }
}
