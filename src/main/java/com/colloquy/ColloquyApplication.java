package com.colloquy;

import com.colloquy.dispatch.cli.LaunchMode;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point. {@code colloquy serve} starts the REST and SSE server; any other
 * invocation runs one CLI command and exits with its code.
 */
@SpringBootApplication
public class ColloquyApplication {

    public static void main(String[] args) {
        LaunchMode mode = LaunchMode.of(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(ColloquyApplication.class)
                .web(mode.webApplicationType())
                .properties("spring.main.banner-mode=off")
                .run(args);

        if (mode == LaunchMode.COMMAND) {
            System.exit(SpringApplication.exit(ctx));
        }
    }
}
