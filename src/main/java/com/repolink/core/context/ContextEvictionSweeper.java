package com.repolink.core.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;

/**
 * Periodically drops contexts older than the retention window.
 *
 * <p>Best effort: a request racing the sweep may see {@code NOT_FOUND} for a
 * context it used a moment earlier.
 */
public class ContextEvictionSweeper {

    private static final Logger log = LoggerFactory.getLogger(ContextEvictionSweeper.class);

    private final ContextStore contextStore;
    private final Clock clock;

    public ContextEvictionSweeper(ContextStore contextStore, Clock clock) {
        this.contextStore = contextStore;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${repolink.context.sweep-interval-ms:3600000}",
               initialDelayString = "${repolink.context.sweep-interval-ms:3600000}")
    public void sweep() {
        int evicted = contextStore.evictExpired(clock.instant());
        if (evicted > 0) {
            log.info("Context sweep evicted {} context(s), {} remaining", evicted, contextStore.size());
        } else {
            log.debug("Context sweep found nothing to evict ({} live)", contextStore.size());
        }
    }
}
