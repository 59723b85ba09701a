package dev.workflows.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.workflows.backend.ResourceCatalogs;
import dev.workflows.backend.StoreResult;
import dev.workflows.model.ResourceRef;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Catalogs read from one JSON file:
 * <pre>{"skills": [{"name": "lint"}], "agents": [...], "commands": [...]}</pre>
 * The same entries are served for every space and locale.
 */
public final class JsonResourceCatalogs implements ResourceCatalogs {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<ResourceRef> skills;
    private final List<ResourceRef> agents;
    private final List<ResourceRef> commands;

    public JsonResourceCatalogs(List<ResourceRef> skills, List<ResourceRef> agents, List<ResourceRef> commands) {
        this.skills = List.copyOf(skills);
        this.agents = List.copyOf(agents);
        this.commands = List.copyOf(commands);
    }

    public static JsonResourceCatalogs loadFromFile(Path path) throws IOException {
        JsonNode root = MAPPER.readTree(path.toFile());
        return new JsonResourceCatalogs(
            parseEntries(root.get("skills")),
            parseEntries(root.get("agents")),
            parseEntries(root.get("commands")));
    }

    @Override
    public StoreResult<List<ResourceRef>> listSkills(String spaceId, String locale) {
        return StoreResult.ok(skills);
    }

    @Override
    public StoreResult<List<ResourceRef>> listAgents(String spaceId, String locale) {
        return StoreResult.ok(agents);
    }

    @Override
    public StoreResult<List<ResourceRef>> listCommands(String spaceId, String locale) {
        return StoreResult.ok(commands);
    }

    private static List<ResourceRef> parseEntries(JsonNode node) {
        var entries = new ArrayList<ResourceRef>();
        if (node == null || !node.isArray()) {
            return entries;
        }
        for (JsonNode entry : node) {
            if (entry.isTextual()) {
                entries.add(ResourceRef.of(entry.asText()));
                continue;
            }
            if (!entry.hasNonNull("name")) {
                throw new IllegalArgumentException("Catalog entry without name: " + entry);
            }
            String namespace = entry.hasNonNull("namespace") ? entry.get("namespace").asText() : null;
            entries.add(new ResourceRef(entry.get("name").asText(), namespace));
        }
        return entries;
    }
}
