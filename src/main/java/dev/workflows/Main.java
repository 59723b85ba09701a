package dev.workflows;

import dev.workflows.cli.WorkflowsCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = WorkflowsCli.commandLineInstance().execute(args);
        System.exit(exitCode);
    }
}
