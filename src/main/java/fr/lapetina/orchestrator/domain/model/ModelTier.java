package fr.lapetina.orchestrator.domain.model;

import java.util.Locale;

/**
 * Complexity tier of a task. Each provider maps a tier to one of its own models.
 */
public enum ModelTier {
    /**
     * Cheap, low latency model.
     */
    FAST,

    /**
     * General purpose model, used when no tier is given.
     */
    STANDARD,

    /**
     * Most capable model of the provider.
     */
    ADVANCED;

    /**
     * Parses a tier name, case-insensitively. Null or blank means {@link #STANDARD}.
     *
     * @throws IllegalArgumentException if the name is not a known tier
     */
    public static ModelTier fromString(String value) {
        if (value == null || value.isBlank()) {
            return STANDARD;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown model tier: " + value);
        }
    }
}
