package dev.directives;

import dev.directives.cli.WorkflowDirectivesCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkflowDirectivesCli()).execute(args);
        System.exit(exitCode);
    }
}
