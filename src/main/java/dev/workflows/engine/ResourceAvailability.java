package dev.workflows.engine;

import dev.workflows.model.ResourceRef;

import java.util.List;
import java.util.Objects;

/**
 * Decides whether a step's resource name resolves against a catalog.
 */
public final class ResourceAvailability {

    private ResourceAvailability() {}

    /**
     * Check a possibly namespace-qualified name against catalog entries.
     *
     * <p>An unqualified name matches an entry without namespace, and falls back to any entry
     * of that name for catalogs that do not track namespaces. A qualified {@code ns:name}
     * matches only an entry with exactly that name and namespace.
     *
     * @param stepName the name as written in the step, may be null
     * @param catalog  entries currently installed
     * @return false for blank names and malformed qualifications
     */
    public static boolean isAvailable(String stepName, List<ResourceRef> catalog) {
        if (stepName == null) {
            return false;
        }
        String trimmed = stepName.trim();
        if (trimmed.isEmpty()) {
            return false;
        }

        int colon = trimmed.indexOf(':');
        if (colon < 0) {
            return catalog.stream().anyMatch(ref -> trimmed.equals(ref.name()) && !ref.hasNamespace())
                || catalog.stream().anyMatch(ref -> trimmed.equals(ref.name()));
        }

        String namespace = trimmed.substring(0, colon);
        String name = trimmed.substring(colon + 1);
        // only the first ':' separates; anything after a second one is dropped
        int extra = name.indexOf(':');
        if (extra >= 0) {
            name = name.substring(0, extra);
        }
        if (namespace.isEmpty() || name.isEmpty()) {
            return false;
        }
        String resourceName = name;
        return catalog.stream().anyMatch(ref ->
            resourceName.equals(ref.name()) && Objects.equals(namespace, ref.namespace()));
    }
}
