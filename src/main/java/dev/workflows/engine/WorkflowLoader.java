package dev.workflows.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflows.model.StepKind;
import dev.workflows.model.WorkflowDefinition;
import dev.workflows.model.WorkflowSettings;
import dev.workflows.model.WorkflowStep;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;

/**
 * Reads workflow definitions and engine settings from JSON.
 */
public final class WorkflowLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WorkflowLoader() {}

    /**
     * Load a single workflow from a JSON file.
     */
    public static WorkflowDefinition loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return parseWorkflow(root);
    }

    /**
     * Load a single workflow from a JSON string.
     */
    public static WorkflowDefinition loadFromString(String json) throws IOException {
        JsonNode root = MAPPER.readTree(json);
        return parseWorkflow(root);
    }

    /**
     * Load engine settings, falling back to defaults for missing keys.
     * A null path yields {@link EngineSettings#defaults()}.
     */
    public static EngineSettings loadSettings(Path path) throws IOException {
        if (path == null) {
            return EngineSettings.defaults();
        }
        JsonNode root = MAPPER.readTree(path.toFile());
        Duration timeout = root.has("turnTimeoutSeconds")
            ? Duration.ofSeconds(root.get("turnTimeoutSeconds").asLong())
            : EngineSettings.DEFAULT_TURN_TIMEOUT;
        String locale = root.has("locale") ? root.get("locale").asText() : EngineSettings.DEFAULT_LOCALE;
        return new EngineSettings(timeout, locale);
    }

    static WorkflowDefinition parseWorkflow(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Workflow must be a JSON object");
        }
        String id = required(root, "id");
        String spaceId = required(root, "spaceId");
        String name = required(root, "name");

        JsonNode stepsNode = root.get("steps");
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new IllegalArgumentException("Workflow '%s' has no steps array".formatted(id));
        }
        var steps = new ArrayList<WorkflowStep>();
        for (JsonNode stepNode : stepsNode) {
            steps.add(parseStep(stepNode, steps.size()));
        }

        return new WorkflowDefinition(
            id, spaceId, name, text(root, "description"), steps,
            parseSettings(root.get("settings")),
            instant(root, "createdAt"), instant(root, "updatedAt"), instant(root, "lastRunAt"),
            text(root, "lastConversationId"));
    }

    private static WorkflowStep parseStep(JsonNode node, int index) {
        String kind = text(node, "kind");
        if (kind == null) {
            kind = text(node, "type");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Step %d has no kind".formatted(index + 1));
        }
        return new WorkflowStep(
            text(node, "id"),
            StepKind.fromJson(kind),
            text(node, "name"),
            text(node, "input"),
            text(node, "args"),
            node.has("summarizeAfter") && node.get("summarizeAfter").asBoolean());
    }

    private static WorkflowSettings parseSettings(JsonNode node) {
        if (node == null || !node.isObject()) {
            return WorkflowSettings.defaults();
        }
        return new WorkflowSettings(bool(node, "thinkingEnabled"), bool(node, "aiBrowserEnabled"));
    }

    private static String required(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Workflow is missing '%s'".formatted(field));
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Boolean bool(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asBoolean();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Field '%s' is not an ISO-8601 instant: %s".formatted(field, value), e);
        }
    }
}
