package com.colloquy.dispatch.cli;

import org.springframework.boot.WebApplicationType;

/**
 * Whether the process runs the HTTP server or a single CLI command.
 * <p>
 * Only the subcommand position counts: {@code colloquy serve} starts the server, while
 * {@code colloquy converse -a chef "what to serve"} is a CLI run.
 */
public enum LaunchMode {

    SERVE(WebApplicationType.SERVLET),
    COMMAND(WebApplicationType.NONE);

    static final String SERVE_COMMAND = "serve";

    private final WebApplicationType webApplicationType;

    LaunchMode(WebApplicationType webApplicationType) {
        this.webApplicationType = webApplicationType;
    }

    public WebApplicationType webApplicationType() {
        return webApplicationType;
    }

    public static LaunchMode of(String... args) {
        for (String arg : args) {
            if (arg.startsWith("-")) {
                continue;
            }
            return SERVE_COMMAND.equals(arg) ? SERVE : COMMAND;
        }
        return COMMAND;
    }
}
