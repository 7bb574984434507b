package com.colloquy.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree once the Spring context is up and keeps its exit code
 * for {@link org.springframework.boot.SpringApplication#exit}.
 * <p>
 * In {@link LaunchMode#SERVE} nothing is executed here; the embedded server keeps the
 * process alive and {@link ServeCommand} prints the banner when it is ready.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ColloquyCommand colloquyCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ColloquyCommand colloquyCommand, IFactory factory) {
        this.colloquyCommand = colloquyCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        if (LaunchMode.of(args) == LaunchMode.SERVE) {
            return;
        }
        exitCode = new CommandLine(colloquyCommand, factory)
                .setExitCodeExceptionMapper(ExitCodes::forException)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
