package com.repolink;

import com.repolink.dispatch.cli.LaunchMode;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for both the HTTP service and the one-shot CLI commands.
 */
@SpringBootApplication
public class RepolinkApplication {

    public static void main(String[] args) {
        String[] effective = LaunchMode.withHostedDefault(args, System.getenv("PORT"));
        LaunchMode mode = LaunchMode.of(effective);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(RepolinkApplication.class)
                .properties("spring.main.banner-mode=off",
                        "spring.main.web-application-type=" + (mode == LaunchMode.SERVER ? "servlet" : "none"))
                .run(effective);

        if (mode == LaunchMode.COMMAND) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }
}
