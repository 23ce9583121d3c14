package com.repolink.dispatch.cli;

import com.repolink.core.health.HealthCheckService;
import com.repolink.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * CLI command: repolink health
 * <p>
 * Runs all health checks and prints one line per component. Exits 1 when
 * any component is DOWN.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
        }

        ConsoleOutput.rule();
        switch (HealthStatus.overall(checks)) {
            case DOWN -> {
                ConsoleOutput.error("Overall: one or more components down");
                return 1;
            }
            case DEGRADED -> ConsoleOutput.warn("Overall: degraded");
            case UP -> ConsoleOutput.success("Overall: all systems operational");
        }
        return 0;
    }
}
