package dev.workflows.backend;

import dev.workflows.model.ResourceRef;
import dev.workflows.model.StepKind;

import java.util.List;

/**
 * Skills, agents and commands currently installed for a space.
 */
public interface ResourceCatalogs {

    StoreResult<List<ResourceRef>> listSkills(String spaceId, String locale);

    StoreResult<List<ResourceRef>> listAgents(String spaceId, String locale);

    StoreResult<List<ResourceRef>> listCommands(String spaceId, String locale);

    /**
     * The catalog a step of the given kind is looked up in, or an empty list for kinds
     * that need no resource. A failed listing counts as an empty catalog.
     */
    default List<ResourceRef> catalogFor(StepKind kind, String spaceId, String locale) {
        StoreResult<List<ResourceRef>> result;
        switch (kind) {
            case SKILL -> result = listSkills(spaceId, locale);
            case AGENT -> result = listAgents(spaceId, locale);
            case COMMAND -> result = listCommands(spaceId, locale);
            default -> result = StoreResult.ok(List.of());
        }
        return result.hasData() ? result.data() : List.of();
    }
}
