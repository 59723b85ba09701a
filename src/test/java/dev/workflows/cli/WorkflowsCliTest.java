package dev.workflows.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowsCliTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() throws IOException {
        Path space = Files.createDirectories(dir.resolve("space-1"));
        Files.writeString(space.resolve("release.json"), """
            {
              "id": "release",
              "spaceId": "space-1",
              "name": "Release",
              "steps": [
                { "id": "s1", "kind": "skill", "name": "research", "input": "changelog", "summarizeAfter": true },
                { "id": "s2", "kind": "agent", "name": "tools:writer" },
                { "id": "s3", "kind": "message" }
              ]
            }
            """);

        commandLine = WorkflowsCli.commandLineInstance();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void listsWorkflowsOfSpace() {
        int exitCode = commandLine.execute("--dir", dir.toString(), "--space", "space-1", "--list");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("release  Release  (3 steps)");
    }

    @Test
    void showsMessagesEachStepWouldSend() {
        int exitCode = commandLine.execute("--dir", dir.toString(), "--space", "space-1", "release");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("1. skill -> /research changelog [summarize]")
            .contains("2. agent -> @tools:writer")
            .contains("3. message -> <empty>");
    }

    @Test
    void reportsUnavailableResourcesAgainstCatalog() throws IOException {
        Path catalog = dir.resolve("catalog.json");
        Files.writeString(catalog, "{ \"skills\": [\"research\"], \"agents\": [\"writer\"] }");

        int exitCode = commandLine.execute("--dir", dir.toString(), "--space", "space-1",
            "--catalog", catalog.toString(), "release");

        assertThat(exitCode).isEqualTo(WorkflowsCli.EXIT_UNAVAILABLE_RESOURCES);
        assertThat(out.toString()).contains("Workflow contains unavailable resources: Step 2: agent tools:writer");
    }

    @Test
    void confirmsWhenEveryResourceIsAvailable() throws IOException {
        Path catalog = dir.resolve("catalog.json");
        Files.writeString(catalog, """
            { "skills": ["research"], "agents": [ { "name": "writer", "namespace": "tools" } ] }
            """);

        int exitCode = commandLine.execute("--dir", dir.toString(), "--space", "space-1",
            "--catalog", catalog.toString(), "release");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("All step resources available.");
    }

    @Test
    void localeOptionOverridesSettingsFile() throws IOException {
        Path catalog = dir.resolve("catalog.json");
        Files.writeString(catalog, """
            { "skills": ["research"], "agents": [ { "name": "writer", "namespace": "tools" } ] }
            """);
        Path settings = dir.resolve("settings.json");
        Files.writeString(settings, "{ \"locale\": \"de\", \"turnTimeoutSeconds\": 30 }");

        int fromFile = commandLine.execute("--dir", dir.toString(), "--space", "space-1",
            "--catalog", catalog.toString(), "--settings", settings.toString(), "release");

        assertThat(fromFile).isZero();
        assertThat(out.toString()).contains("Checking step resources (locale de)");

        int overridden = WorkflowsCli.commandLineInstance()
            .setOut(new PrintWriter(out))
            .execute("--dir", dir.toString(), "--space", "space-1", "--catalog", catalog.toString(),
                "--settings", settings.toString(), "--locale", "fr", "release");

        assertThat(overridden).isZero();
        assertThat(out.toString()).contains("Checking step resources (locale fr)");
    }

    @Test
    void unknownWorkflowFails() {
        int exitCode = commandLine.execute("--dir", dir.toString(), "--space", "space-1", "missing");

        assertThat(exitCode).isEqualTo(WorkflowsCli.EXIT_NOT_FOUND);
        assertThat(err.toString()).contains("Workflow not found: missing");
    }

    @Test
    void requiresWorkflowIdWithoutList() {
        int exitCode = commandLine.execute("--dir", dir.toString());

        assertThat(exitCode).isEqualTo(WorkflowsCli.EXIT_NOT_FOUND);
        assertThat(err.toString()).contains("workflow ID required");
    }
}
