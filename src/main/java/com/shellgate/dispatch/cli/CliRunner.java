package com.shellgate.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code shellgate} command tree once the context is up. The chosen
 * subcommand's return value becomes the process exit status, so {@code serve}
 * keeps the context alive for as long as the MCP session lasts.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final ShellgateCommand shellgateCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ShellgateCommand shellgateCommand, IFactory factory) {
        this.shellgateCommand = shellgateCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(shellgateCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
