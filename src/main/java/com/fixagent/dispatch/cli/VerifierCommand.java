package com.fixagent.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command. Without a subcommand it prints the banner and usage.
 */
@Command(
        name = "fixagent-verifier",
        mixinStandardHelpOptions = true,
        version = "fixagent-verifier 0.1.0",
        description = "Automated PR verification through isolated Docker environments",
        subcommands = {
                RunSingleCommand.class,
                RunBatchCommand.class,
                RunComposeCommand.class,
                RunAllComposeCommand.class,
                ListComposeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class VerifierCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner("Automated PR Verification through Docker Isolation");
        spec.commandLine().usage(System.out);
    }
}
