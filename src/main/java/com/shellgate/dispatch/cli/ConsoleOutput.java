package com.shellgate.dispatch.cli;

import com.shellgate.core.policy.PolicySnapshot;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Shellgate CLI.
 * Never used by {@code serve}, whose stdout is the MCP channel.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) SHELLGATE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [SHELLGATE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void policy(PolicySnapshot policy) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold Commands:|@    " + String.join(", ", policy.allowedCommands())));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold Directories:|@ " + String.join(", ", policy.directoryNames())
                        + " (subdirectories included)"));
        String strict = policy.strictValidation()
                ? "@|fg(green) on|@"
                : "@|fg(red) off|@ (pipes and redirection allowed)";
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  @|bold Strict:|@      " + strict));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|bold Output cap:|@  " + policy.maxOutputSize() + " bytes"));
    }
}
