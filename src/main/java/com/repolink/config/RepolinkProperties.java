package com.repolink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "repolink")
public class RepolinkProperties {

    private Context context = new Context();
    private Github github = new Github();
    private ObjectStore objectStore = new ObjectStore();
    private Commit commit = new Commit();

    // -- Context accessors (delegate to nested) --
    public Duration getRetention() { return context.retention; }
    public long getSweepIntervalMs() { return context.sweepIntervalMs; }
    public int getPreviewLength() { return context.previewLength; }
    public String getDefaultBranch() { return context.defaultBranch; }

    // -- GitHub accessors (delegate to nested) --
    public String getApiUrl() { return github.apiUrl; }
    public String getOwner() { return github.owner; }
    public String getToken() { return github.token; }

    /**
     * Returns true when a GitHub token was configured via {@code GITHUB_TOKEN}
     * or {@code repolink.github.token}. Without it only public, read-only
     * calls can succeed.
     */
    public boolean isTokenConfigured() {
        return github.token != null && !github.token.isBlank();
    }

    public String getProvider() { return objectStore.provider; }
    public int getBlobParallelism() { return commit.blobParallelism; }

    public Context getContext() { return context; }
    public void setContext(Context context) { this.context = context; }
    public Github getGithub() { return github; }
    public void setGithub(Github github) { this.github = github; }
    public ObjectStore getObjectStore() { return objectStore; }
    public void setObjectStore(ObjectStore objectStore) { this.objectStore = objectStore; }
    public Commit getCommit() { return commit; }
    public void setCommit(Commit commit) { this.commit = commit; }

    public static class Context {
        private Duration retention = Duration.ofHours(24);
        private long sweepIntervalMs = 3_600_000L;
        private int previewLength = 200;
        private String defaultBranch = "main";

        public Duration getRetention() { return retention; }
        public void setRetention(Duration retention) { this.retention = retention; }
        public long getSweepIntervalMs() { return sweepIntervalMs; }
        public void setSweepIntervalMs(long sweepIntervalMs) { this.sweepIntervalMs = sweepIntervalMs; }
        public int getPreviewLength() { return previewLength; }
        public void setPreviewLength(int previewLength) { this.previewLength = previewLength; }
        public String getDefaultBranch() { return defaultBranch; }
        public void setDefaultBranch(String defaultBranch) { this.defaultBranch = defaultBranch; }
    }

    public static class Github {
        private String apiUrl = "https://api.github.com";
        private String owner = "";
        private String token = "";
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 30;

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }
        public String getOwner() { return owner; }
        public void setOwner(String owner) { this.owner = owner; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class ObjectStore {
        private String provider = "github";
        /** Repositories created at startup by the memory provider. */
        private List<String> repositories = new ArrayList<>();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public List<String> getRepositories() { return repositories; }
        public void setRepositories(List<String> repositories) { this.repositories = repositories; }
    }

    public static class Commit {
        private int blobParallelism = 4;

        public int getBlobParallelism() { return blobParallelism; }
        public void setBlobParallelism(int blobParallelism) { this.blobParallelism = blobParallelism; }
    }
}
