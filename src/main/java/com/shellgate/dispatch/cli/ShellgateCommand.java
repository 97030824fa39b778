package com.shellgate.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Shellgate.
 * Routes to subcommands: serve, exec, check-policy, health.
 */
@Command(
        name = "shellgate",
        mixinStandardHelpOptions = true,
        version = "Shellgate 0.1.0",
        description = "Policy-checked shell command gateway for automated clients",
        subcommands = {
                ServeCommand.class,
                ExecCommand.class,
                CheckPolicyCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ShellgateCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
