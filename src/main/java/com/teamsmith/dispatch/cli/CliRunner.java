package com.teamsmith.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and runs the team assignment command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final TeamsmithCommand teamsmithCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TeamsmithCommand teamsmithCommand, IFactory factory) {
        this.teamsmithCommand = teamsmithCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(teamsmithCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
