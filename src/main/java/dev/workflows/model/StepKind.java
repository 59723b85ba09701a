package dev.workflows.model;

import java.util.Locale;

/**
 * What a workflow step invokes on the agent backend.
 */
public enum StepKind {
    SKILL,
    AGENT,
    COMMAND,
    MESSAGE;

    /** Name used in workflow files and user-facing messages. */
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether the step refers to a catalog resource that must exist before a run. */
    public boolean requiresResource() {
        return this != MESSAGE;
    }

    public static StepKind fromJson(String value) {
        for (StepKind kind : values()) {
            if (kind.jsonName().equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown step kind: " + value);
    }
}
