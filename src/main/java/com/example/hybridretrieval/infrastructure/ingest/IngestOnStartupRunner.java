package com.example.hybridretrieval.infrastructure.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ingests the configured data directory once the application has started.
 */
@Component
@ConditionalOnProperty(name = "hybridretrieval.ingest.on-startup", havingValue = "true")
public class IngestOnStartupRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(IngestOnStartupRunner.class);

    private final IngestService ingestService;
    private final String dataDir;

    public IngestOnStartupRunner(
            IngestService ingestService,
            @Value("${hybridretrieval.ingest.data-dir}") String dataDir
    ) {
        this.ingestService = ingestService;
        this.dataDir = dataDir;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("event=startup_ingest_begin dir={}", dataDir);
        IngestService.IngestResult result = ingestService.ingestDirectory(dataDir);
        log.info("event=startup_ingest_done documents={} chunks={} indexed={} failed={}",
                result.documents(), result.chunks(), result.indexed(), result.failed());
    }
}
