package com.fixagent.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with the Spring Boot lifecycle: parses the arguments, runs
 * the selected command and hands its exit code to {@code SpringApplication.exit}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    /** Exit code when a command fails with an exception instead of a verdict. */
    static final int INTERNAL_ERROR = 2;

    private final VerifierCommand verifierCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(VerifierCommand verifierCommand, IFactory factory) {
        this.verifierCommand = verifierCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(verifierCommand, factory)
                .setExecutionExceptionHandler((e, cmd, parseResult) -> {
                    log.error("Command {} failed", cmd.getCommandName(), e);
                    ConsoleOutput.error(cmd.getCommandName() + " failed: "
                            + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
                    return INTERNAL_ERROR;
                });
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
