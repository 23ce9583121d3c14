package com.repolink.core.health;

import com.repolink.config.RepolinkProperties;
import com.repolink.core.context.ContextStore;
import com.repolink.core.objectstore.ObjectStoreClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final ContextStore contextStore;
    private final ObjectStoreClient objectStoreClient;
    private final RepolinkProperties properties;

    public HealthCheckService(
            @Autowired(required = false) ContextStore contextStore,
            @Autowired(required = false) ObjectStoreClient objectStoreClient,
            RepolinkProperties properties) {
        this.contextStore = contextStore;
        this.objectStoreClient = objectStoreClient;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkContextStore());
        results.add(checkObjectStore());
        return results;
    }

    private HealthStatus checkContextStore() {
        if (contextStore == null) {
            return HealthStatus.down("context-store", "Context store not available");
        }
        int live = contextStore.size();
        return HealthStatus.up("context-store", live + " live context(s)", Map.of("contexts", String.valueOf(live)));
    }

    private HealthStatus checkObjectStore() {
        if (objectStoreClient == null) {
            return HealthStatus.down("object-store", "No ObjectStoreClient configured");
        }
        var provider = objectStoreClient.name();
        if ("github".equals(provider) && !properties.isTokenConfigured()) {
            return HealthStatus.degraded("object-store",
                    "GitHub client has no token; commits will be rejected",
                    Map.of("provider", provider));
        }
        return HealthStatus.up("object-store", "Provider " + provider + " available", Map.of("provider", provider));
    }
}
