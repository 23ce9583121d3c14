package com.repolink.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RepolinkPropertiesTest {

    @Test
    @DisplayName("defaults match the documented configuration")
    void defaults() {
        var props = new RepolinkProperties();
        assertEquals(Duration.ofHours(24), props.getRetention());
        assertEquals(3_600_000L, props.getSweepIntervalMs());
        assertEquals(200, props.getPreviewLength());
        assertEquals("main", props.getDefaultBranch());
        assertEquals("https://api.github.com", props.getApiUrl());
        assertEquals("github", props.getProvider());
        assertEquals(4, props.getBlobParallelism());
        assertFalse(props.isTokenConfigured());
    }

    @Test
    @DisplayName("binds kebab-case keys from configuration")
    void binding() {
        var source = new MapConfigurationPropertySource(Map.of(
                "repolink.context.retention", "2h",
                "repolink.context.default-branch", "trunk",
                "repolink.github.token", "tok",
                "repolink.object-store.provider", "memory",
                "repolink.object-store.repositories[0]", "sandbox",
                "repolink.commit.blob-parallelism", "8"));

        var props = new Binder(source).bind("repolink", RepolinkProperties.class).get();

        assertEquals(Duration.ofHours(2), props.getRetention());
        assertEquals("trunk", props.getDefaultBranch());
        assertTrue(props.isTokenConfigured());
        assertEquals("memory", props.getProvider());
        assertEquals(List.of("sandbox"), props.getObjectStore().getRepositories());
        assertEquals(8, props.getBlobParallelism());
    }
}
