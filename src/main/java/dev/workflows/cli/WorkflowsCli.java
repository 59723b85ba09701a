package dev.workflows.cli;

import dev.workflows.backend.StoreResult;
import dev.workflows.engine.ResourceValidator;
import dev.workflows.engine.StepMessageBuilder;
import dev.workflows.engine.WorkflowLoader;
import dev.workflows.model.WorkflowDefinition;
import dev.workflows.model.WorkflowStep;
import dev.workflows.store.DirectoryWorkflowStore;
import dev.workflows.store.JsonResourceCatalogs;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Inspects stored workflows: lists them, shows the messages a run would send, and checks
 * step resources against a catalog file.
 */
@Command(
    name = "agent-workflows",
    mixinStandardHelpOptions = true,
    description = "Inspect and validate agent workflows."
)
public class WorkflowsCli implements Callable<Integer> {

    static final int EXIT_NOT_FOUND = 1;
    static final int EXIT_UNAVAILABLE_RESOURCES = 2;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Workflow ID to inspect")
    private String workflowId;

    @Option(names = "--dir", defaultValue = ".workflows", description = "Workflow root directory")
    private Path dir;

    @Option(names = "--space", defaultValue = "default", description = "Space ID")
    private String spaceId;

    @Option(names = "--list", description = "List all workflows of the space")
    private boolean list;

    @Option(names = "--catalog", description = "Resource catalog JSON to validate step resources against")
    private Path catalog;

    @Option(names = "--settings", description = "Engine settings JSON")
    private Path settings;

    @Option(names = "--locale", description = "Catalog locale, overrides the settings file")
    private String locale;

    public static CommandLine commandLineInstance() {
        return new CommandLine(new WorkflowsCli());
    }

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        var store = new DirectoryWorkflowStore(dir);

        if (list) {
            StoreResult<List<WorkflowDefinition>> workflows = store.list(spaceId);
            if (!workflows.success()) {
                err.println("Error: " + workflows.error());
                return EXIT_NOT_FOUND;
            }
            out.println("Workflows in space " + spaceId + ":");
            for (WorkflowDefinition workflow : workflows.data()) {
                out.printf("  %s  %s  (%d steps)%n", workflow.id(), workflow.name(), workflow.steps().size());
            }
            out.flush();
            return 0;
        }

        if (workflowId == null) {
            err.println("Error: workflow ID required. Use --list to see available workflows.");
            return EXIT_NOT_FOUND;
        }

        StoreResult<WorkflowDefinition> loaded = store.get(spaceId, workflowId);
        if (!loaded.hasData()) {
            err.println("Error: " + loaded.error());
            return EXIT_NOT_FOUND;
        }
        WorkflowDefinition workflow = loaded.data();

        out.println(workflow.name());
        List<WorkflowStep> steps = workflow.steps();
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            String message = StepMessageBuilder.build(step);
            out.printf("  %d. %s -> %s%s%n", i + 1, step.kind().jsonName(),
                message.isEmpty() ? "<empty>" : message,
                step.summarizeAfter() ? " [summarize]" : "");
        }

        if (catalog != null) {
            String catalogLocale = locale != null ? locale : WorkflowLoader.loadSettings(settings).locale();
            out.println("Checking step resources (locale " + catalogLocale + ")");
            List<String> missing = ResourceValidator.validate(workflow,
                JsonResourceCatalogs.loadFromFile(catalog), spaceId, catalogLocale);
            if (!missing.isEmpty()) {
                out.println(ResourceValidator.describe(missing));
                out.flush();
                return EXIT_UNAVAILABLE_RESOURCES;
            }
            out.println("All step resources available.");
        }
        out.flush();
        return 0;
    }
}
