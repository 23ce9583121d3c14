package com.repolink.core.objectstore;

import com.repolink.config.RepolinkProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObjectStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ObjectStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "repolink.object-store.provider", havingValue = "github", matchIfMissing = true)
    public GitHubObjectStoreClient gitHubObjectStoreClient(RepolinkProperties properties) {
        if (!properties.isTokenConfigured()) {
            log.warn("No GitHub token configured; write operations will be rejected by GitHub");
        }
        return new GitHubObjectStoreClient(properties);
    }

    /**
     * Local object store for development without GitHub access. Each name in
     * {@code repolink.object-store.repositories} starts with one empty commit
     * on the default branch.
     */
    @Bean
    @ConditionalOnProperty(name = "repolink.object-store.provider", havingValue = "memory")
    public InMemoryObjectStore inMemoryObjectStore(RepolinkProperties properties) {
        var store = new InMemoryObjectStore();
        for (String repo : properties.getObjectStore().getRepositories()) {
            store.createRepository(repo, properties.getDefaultBranch());
        }
        return store;
    }
}
