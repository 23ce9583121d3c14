package com.repolink.core.commit;

import com.repolink.config.RepolinkProperties;
import com.repolink.core.metrics.RepolinkMetrics;
import com.repolink.core.objectstore.ObjectStoreClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class CommitConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService blobUploadExecutor(RepolinkProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getBlobParallelism()), r -> {
            Thread t = new Thread(r, "blob-upload-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public AtomicCommitBuilder atomicCommitBuilder(ObjectStoreClient objectStoreClient,
                                                   @Qualifier("blobUploadExecutor") ExecutorService blobUploadExecutor,
                                                   @Autowired(required = false) RepolinkMetrics metrics) {
        return new AtomicCommitBuilder(objectStoreClient, blobUploadExecutor, metrics);
    }
}
