package com.repolink.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RepolinkMetricsTest {

    private SimpleMeterRegistry registry;
    private RepolinkMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RepolinkMetrics(registry);
    }

    @Test
    @DisplayName("recordContextCreated increments the created counter")
    void recordContextCreated() {
        metrics.recordContextCreated();
        metrics.recordContextCreated();

        var counter = registry.find("repolink.contexts.created").counter();
        assertNotNull(counter);
        assertEquals(2.0, counter.count());
    }

    @Test
    @DisplayName("recordContextsEvicted adds the sweep count")
    void recordContextsEvicted() {
        metrics.recordContextsEvicted(3);

        var counter = registry.find("repolink.contexts.evicted").counter();
        assertNotNull(counter);
        assertEquals(3.0, counter.count());
    }

    @Test
    @DisplayName("recordCommit records timer and counter by outcome tag")
    void recordCommit() {
        metrics.recordCommit("committed", 120);
        metrics.recordCommit("committed", 80);
        metrics.recordCommit("conflict", 40);

        var committedTimer = registry.find("repolink.commit.duration")
                .tag("outcome", "committed").timer();
        var conflicts = registry.find("repolink.commit.results")
                .tag("outcome", "conflict").counter();

        assertNotNull(committedTimer);
        assertNotNull(conflicts);
        assertEquals(2, committedTimer.count());
        assertEquals(1.0, conflicts.count());
    }

    @Test
    @DisplayName("recordCommitFiles records to distribution summary")
    void recordCommitFiles() {
        metrics.recordCommitFiles(1);
        metrics.recordCommitFiles(5);

        var summary = registry.find("repolink.commit.files").summary();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertEquals(6.0, summary.totalAmount());
    }
}
