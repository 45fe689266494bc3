package com.armada.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ArmadaCommand armadaCommand;
    private final IFactory factory;
    private final GracefulShutdown gracefulShutdown;
    private int exitCode;

    public CliRunner(ArmadaCommand armadaCommand, IFactory factory, GracefulShutdown gracefulShutdown) {
        this.armadaCommand = armadaCommand;
        this.factory = factory;
        this.gracefulShutdown = gracefulShutdown;
    }

    @Override
    public void run(String... args) throws Exception {
        gracefulShutdown.install();
        try {
            exitCode = new CommandLine(armadaCommand, factory).execute(args);
        } finally {
            gracefulShutdown.uninstall();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
