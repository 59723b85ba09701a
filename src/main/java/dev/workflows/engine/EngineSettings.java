package dev.workflows.engine;

import java.time.Duration;

/**
 * Tunables of the workflow engine.
 */
public record EngineSettings(
    Duration turnTimeout, // zero disables the deadline
    String locale         // passed to the resource catalogs
) {
    public static final Duration DEFAULT_TURN_TIMEOUT = Duration.ofMinutes(10);
    public static final String DEFAULT_LOCALE = "en";

    public EngineSettings {
        if (turnTimeout == null || turnTimeout.isNegative()) {
            throw new IllegalArgumentException("turnTimeout must be zero or positive: " + turnTimeout);
        }
        locale = locale != null && !locale.isBlank() ? locale : DEFAULT_LOCALE;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_TURN_TIMEOUT, DEFAULT_LOCALE);
    }

    public boolean hasTurnTimeout() {
        return !turnTimeout.isZero();
    }

    public EngineSettings withTurnTimeout(Duration timeout) {
        return new EngineSettings(timeout, locale);
    }
}
