package com.repolink.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for context and commit operations.
 */
@Service
public class RepolinkMetrics {

    private final MeterRegistry registry;

    public RepolinkMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordContextCreated() {
        Counter.builder("repolink.contexts.created")
                .register(registry)
                .increment();
    }

    public void recordContextsEvicted(int count) {
        Counter.builder("repolink.contexts.evicted")
                .description("Contexts removed by the retention sweep")
                .register(registry)
                .increment(count);
    }

    /**
     * Records one commit attempt.
     *
     * @param outcome "committed", "conflict", "not_found", "validation" or "upstream"
     * @param ms      wall time of the attempt
     */
    public void recordCommit(String outcome, long ms) {
        Timer.builder("repolink.commit.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));

        Counter.builder("repolink.commit.results")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordCommitFiles(int fileCount) {
        DistributionSummary.builder("repolink.commit.files")
                .description("Files per committed request")
                .register(registry)
                .record(fileCount);
    }
}
