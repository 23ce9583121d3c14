package com.repolink.core.context;

import com.repolink.config.RepolinkProperties;
import com.repolink.core.metrics.RepolinkMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class ContextStoreConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ContextStore contextStore(Clock clock, RepolinkProperties properties,
                                     @Autowired(required = false) RepolinkMetrics metrics) {
        return new InMemoryContextStore(clock, properties, metrics);
    }

    @Bean
    public ContextEvictionSweeper contextEvictionSweeper(ContextStore contextStore, Clock clock) {
        return new ContextEvictionSweeper(contextStore, clock);
    }
}
