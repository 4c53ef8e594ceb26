package com.example.hybridretrieval.infrastructure.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RetrievalExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(RetrievalExecutorConfig.class);

    /**
     * Dedicated executor for the parallel vector and keyword sub-searches of hybrid retrieval.
     * Fixed pool sized from configuration, or from the CPU count (at least 4) when unset.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService hybridSearchExecutor(
            @Value("${hybridretrieval.retrieve.executor-threads:0}") int configuredThreads
    ) {
        int threads = configuredThreads > 0
                ? configuredThreads
                : Math.max(4, Runtime.getRuntime().availableProcessors());
        log.info("event=hybrid_executor_config threads={}", threads);

        AtomicInteger seq = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "hybrid-search-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }
}
