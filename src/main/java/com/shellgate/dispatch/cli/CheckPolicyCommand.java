package com.shellgate.dispatch.cli;

import com.shellgate.core.policy.FilePolicySource;
import com.shellgate.core.policy.PolicyConfigException;
import com.shellgate.core.policy.PolicyParser;
import com.shellgate.core.policy.PolicySnapshot;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: shellgate check-policy FILE
 * <p>
 * Validates a policy file without installing it. Useful before editing the
 * live file, since a malformed reload is only reported as a warning.
 */
@Command(name = "check-policy", mixinStandardHelpOptions = true,
        description = "Validate a policy file and print what it allows")
@Component
public class CheckPolicyCommand implements Callable<Integer> {

    private final PolicyParser parser;

    @Parameters(index = "0", paramLabel = "FILE", description = "Policy JSON file")
    Path file;

    public CheckPolicyCommand(PolicyParser parser) {
        this.parser = parser;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        PolicySnapshot policy;
        try {
            policy = parser.load(new FilePolicySource(file));
        } catch (PolicyConfigException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        ConsoleOutput.success("Policy " + file + " is valid");
        ConsoleOutput.policy(policy);
        return 0;
    }
}
