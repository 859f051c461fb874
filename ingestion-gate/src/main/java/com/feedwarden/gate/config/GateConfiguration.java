package com.feedwarden.gate.config;

import com.feedwarden.gate.client.HttpTransport;
import com.feedwarden.gate.client.JdkHttpTransport;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure. Time, randomness and the transport are beans so tests can swap them.
 */
@Configuration
public class GateConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random random() {
        return new SecureRandom();
    }

    /** One bulkhead per source id, one call at a time. */
    @Bean
    public BulkheadRegistry sourceBulkheads(IngestionGateProperties properties) {
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(1)
                .maxWaitDuration(properties.getClient().getMaxConcurrentWait())
                .build();
        return BulkheadRegistry.of(config);
    }

    @Bean
    public HttpTransport httpTransport(IngestionGateProperties properties) {
        return new JdkHttpTransport(properties);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ingestionWorkers(IngestionGateProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "ingestion-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getScheduling().getWorkerThreads()), threads);
    }
}
