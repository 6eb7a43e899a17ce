package com.example.repoassist;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Enabled with --repository.ingest-on-startup=true: ingests repository.root.path before the
 * application starts serving, so the first query already sees epoch 1.
 */
@Component
@ConditionalOnProperty(name = "repository.ingest-on-startup", havingValue = "true")
public class IngestOnStartupRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestOnStartupRunner.class);

    @Autowired
    private RepositoryService repositoryService;

    @Override
    public void run(String... args) {
        log.info("IngestOnStartupRunner: ingesting configured repository");
        try {
            RepositorySnapshot s = repositoryService.ingest(repositoryService.resolveRoot(null));
            log.info("IngestOnStartupRunner: epoch {} ready ({} files, {} chunks)", s.getEpoch(), s.totalFiles(), s.totalChunks());
        } catch (IngestionException e) {
            log.error("IngestOnStartupRunner: ingestion failed, serving without a repository: {}", e.getMessage());
        }
    }
}
