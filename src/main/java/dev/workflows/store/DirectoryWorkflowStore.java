package dev.workflows.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflows.backend.StoreResult;
import dev.workflows.backend.WorkflowPatch;
import dev.workflows.backend.WorkflowStore;
import dev.workflows.engine.WorkflowLoader;
import dev.workflows.model.WorkflowDefinition;
import dev.workflows.model.WorkflowSettings;
import dev.workflows.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Keeps each workflow as {@code <root>/<spaceId>/<workflowId>.json}.
 */
public final class DirectoryWorkflowStore implements WorkflowStore {

    private static final Logger log = LoggerFactory.getLogger(DirectoryWorkflowStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path root;
    private final Clock clock;

    public DirectoryWorkflowStore(Path root) {
        this(root, Clock.systemUTC());
    }

    public DirectoryWorkflowStore(Path root, Clock clock) {
        this.root = root;
        this.clock = clock;
    }

    @Override
    public StoreResult<List<WorkflowDefinition>> list(String spaceId) {
        if (!isSafe(spaceId)) {
            return StoreResult.failed("Invalid space id: " + spaceId);
        }
        Path dir = root.resolve(spaceId);
        if (!Files.isDirectory(dir)) {
            return StoreResult.ok(List.of());
        }
        var workflows = new ArrayList<WorkflowDefinition>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                 .sorted()
                 .forEach(p -> {
                     try {
                         WorkflowDefinition workflow = WorkflowLoader.loadFromFile(p);
                         if (spaceId.equals(workflow.spaceId())) {
                             workflows.add(workflow);
                         }
                     } catch (IOException | IllegalArgumentException e) {
                         log.warn("Skipping unreadable workflow file {}: {}", p, e.getMessage());
                     }
                 });
        } catch (IOException e) {
            log.warn("Failed to list workflows in {}", dir, e);
            return StoreResult.failed("Failed to load workflows");
        }
        workflows.sort(Comparator.comparing(WorkflowDefinition::name));
        return StoreResult.ok(workflows);
    }

    @Override
    public StoreResult<WorkflowDefinition> get(String spaceId, String workflowId) {
        if (!isSafe(spaceId) || !isSafe(workflowId)) {
            return StoreResult.failed("Workflow not found: " + workflowId);
        }
        Path file = fileFor(spaceId, workflowId);
        if (!Files.isRegularFile(file)) {
            return StoreResult.failed("Workflow not found: " + workflowId);
        }
        try {
            return StoreResult.ok(WorkflowLoader.loadFromFile(file));
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Failed to read workflow {}", file, e);
            return StoreResult.failed("Failed to load workflow");
        }
    }

    @Override
    public StoreResult<WorkflowDefinition> create(String spaceId, WorkflowDefinition input) {
        if (!isSafe(spaceId)) {
            return StoreResult.failed("Invalid space id: " + spaceId);
        }
        Instant now = clock.instant();
        WorkflowDefinition workflow = new WorkflowDefinition(
            UUID.randomUUID().toString(), spaceId, input.name(), input.description(),
            withIds(input.steps()), input.settings(), now, now, null, null);
        return write(workflow);
    }

    @Override
    public StoreResult<WorkflowDefinition> update(String spaceId, String workflowId, WorkflowPatch patch) {
        StoreResult<WorkflowDefinition> existing = get(spaceId, workflowId);
        if (!existing.hasData()) {
            return existing;
        }
        WorkflowDefinition current = existing.data();
        WorkflowDefinition updated = new WorkflowDefinition(
            current.id(),
            current.spaceId(),
            patch.name() != null ? patch.name() : current.name(),
            patch.description() != null ? patch.description() : current.description(),
            patch.steps() != null ? withIds(patch.steps()) : current.steps(),
            patch.settings() != null ? patch.settings() : current.settings(),
            current.createdAt(),
            clock.instant(),
            patch.lastRunAt() != null ? patch.lastRunAt() : current.lastRunAt(),
            patch.lastConversationId() != null ? patch.lastConversationId() : current.lastConversationId());
        return write(updated);
    }

    @Override
    public StoreResult<Void> delete(String spaceId, String workflowId) {
        if (!isSafe(spaceId) || !isSafe(workflowId)) {
            return StoreResult.failed("Workflow not found: " + workflowId);
        }
        try {
            if (!Files.deleteIfExists(fileFor(spaceId, workflowId))) {
                return StoreResult.failed("Workflow not found: " + workflowId);
            }
            return StoreResult.ok(null);
        } catch (IOException e) {
            log.warn("Failed to delete workflow {}", workflowId, e);
            return StoreResult.failed("Failed to delete workflow");
        }
    }

    private StoreResult<WorkflowDefinition> write(WorkflowDefinition workflow) {
        Path file = fileFor(workflow.spaceId(), workflow.id());
        try {
            Files.createDirectories(file.getParent());
            MAPPER.writeValue(file.toFile(), toJson(workflow));
            return StoreResult.ok(workflow);
        } catch (IOException e) {
            log.warn("Failed to write workflow {}", file, e);
            return StoreResult.failed("Failed to save workflow");
        }
    }

    private Path fileFor(String spaceId, String workflowId) {
        return root.resolve(spaceId).resolve(workflowId + ".json");
    }

    private static boolean isSafe(String id) {
        return id != null && SAFE_ID.matcher(id).matches() && !id.equals(".") && !id.equals("..");
    }

    private static List<WorkflowStep> withIds(List<WorkflowStep> steps) {
        var normalized = new ArrayList<WorkflowStep>();
        for (WorkflowStep step : steps) {
            String id = step.id() != null && !step.id().isBlank() ? step.id() : UUID.randomUUID().toString();
            normalized.add(new WorkflowStep(id, step.kind(), step.name(), step.input(), step.args(),
                step.summarizeAfter()));
        }
        return normalized;
    }

    private static ObjectNode toJson(WorkflowDefinition workflow) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("id", workflow.id());
        root.put("spaceId", workflow.spaceId());
        root.put("name", workflow.name());
        putIfPresent(root, "description", workflow.description());

        ArrayNode steps = root.putArray("steps");
        for (WorkflowStep step : workflow.steps()) {
            ObjectNode node = steps.addObject();
            node.put("id", step.id());
            node.put("kind", step.kind().jsonName());
            putIfPresent(node, "name", step.name());
            putIfPresent(node, "input", step.input());
            putIfPresent(node, "args", step.args());
            if (step.summarizeAfter()) {
                node.put("summarizeAfter", true);
            }
        }

        WorkflowSettings settings = workflow.settings();
        ObjectNode settingsNode = root.putObject("settings");
        if (settings.thinkingEnabled() != null) {
            settingsNode.put("thinkingEnabled", settings.thinkingEnabled());
        }
        if (settings.aiBrowserEnabled() != null) {
            settingsNode.put("aiBrowserEnabled", settings.aiBrowserEnabled());
        }

        putIfPresent(root, "createdAt", workflow.createdAt());
        putIfPresent(root, "updatedAt", workflow.updatedAt());
        putIfPresent(root, "lastRunAt", workflow.lastRunAt());
        putIfPresent(root, "lastConversationId", workflow.lastConversationId());
        return root;
    }

    private static void putIfPresent(ObjectNode node, String field, Object value) {
        if (value != null) {
            node.put(field, value.toString());
        }
    }
}
