package dev.workflows.model;

/**
 * A skill, agent or command entry of a resource catalog.
 */
public record ResourceRef(String name, String namespace) {

    public static ResourceRef of(String name) {
        return new ResourceRef(name, null);
    }

    public boolean hasNamespace() {
        return namespace != null && !namespace.isBlank();
    }
}
