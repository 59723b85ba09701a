package dev.workflows.engine;

import dev.workflows.backend.ResourceCatalogs;
import dev.workflows.model.ResourceRef;
import dev.workflows.model.StepKind;
import dev.workflows.model.WorkflowDefinition;
import dev.workflows.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Checks every step of a workflow against the resource catalogs before a run starts.
 */
public final class ResourceValidator {

    private static final Logger log = LoggerFactory.getLogger(ResourceValidator.class);

    static final String UNAVAILABLE_PREFIX = "Workflow contains unavailable resources: ";

    private ResourceValidator() {}

    /**
     * Fetch the catalogs once and validate the workflow against them. A catalog that cannot
     * be listed counts as empty.
     */
    public static List<String> validate(WorkflowDefinition workflow, ResourceCatalogs catalogs,
                                        String spaceId, String locale) {
        var lookup = new EnumMap<StepKind, List<ResourceRef>>(StepKind.class);
        for (WorkflowStep step : workflow.steps()) {
            if (step.kind().requiresResource() && !lookup.containsKey(step.kind())) {
                lookup.put(step.kind(), fetch(catalogs, step.kind(), spaceId, locale));
            }
        }
        return validate(workflow, lookup);
    }

    private static List<ResourceRef> fetch(ResourceCatalogs catalogs, StepKind kind, String spaceId, String locale) {
        try {
            return catalogs.catalogFor(kind, spaceId, locale);
        } catch (RuntimeException e) {
            log.warn("Failed to list {} catalog for space {}", kind.jsonName(), spaceId, e);
            return List.of();
        }
    }

    /**
     * Validate against already-fetched catalogs. Returns an empty list if every resource is
     * available, otherwise one {@code "Step {n}: {kind} {name}"} entry per offending step.
     */
    public static List<String> validate(WorkflowDefinition workflow, Map<StepKind, List<ResourceRef>> catalogs) {
        var missing = new ArrayList<String>();
        List<WorkflowStep> steps = workflow.steps();
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            if (!step.kind().requiresResource()) {
                continue;
            }
            // Nameless steps are left to fail when their message is built
            if (step.name() == null || step.name().isBlank()) {
                continue;
            }
            String name = step.name().trim();
            List<ResourceRef> catalog = catalogs.getOrDefault(step.kind(), List.of());
            if (!ResourceAvailability.isAvailable(name, catalog)) {
                missing.add("Step %d: %s %s".formatted(i + 1, step.kind().jsonName(), name));
            }
        }
        return missing;
    }

    /** The user-facing message for a non-empty validation result. */
    public static String describe(List<String> missing) {
        return UNAVAILABLE_PREFIX + String.join(", ", missing);
    }
}
