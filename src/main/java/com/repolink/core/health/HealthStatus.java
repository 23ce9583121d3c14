package com.repolink.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Result of probing one runtime dependency (the context store or the object
 * store backend).
 *
 * @param component short kebab-case name, used as the key in {@code /health}
 * @param status    severity of the result
 * @param detail    one human-readable line for the console and the JSON body
 * @param metadata  extra facts such as the provider name; never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /** Declared from least to most severe. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    /** The most severe status among {@code checks}; UP when there are none. */
    public static Status overall(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
