package dev.jobmatcher.model;

import java.util.Locale;
import java.util.Optional;

/**
 * How soon a job needs to be started.
 */
public enum Urgency {
    LOW("flexible"),
    MEDIUM("month"),
    HIGH("week"),
    URGENT("asap");

    // Token used by older job postings for the same level
    private final String alias;

    Urgency(String alias) {
        this.alias = alias;
    }

    /**
     * Parse an urgency token, case-insensitive, accepting the legacy aliases.
     *
     * @param value raw token, may be null
     * @return the urgency, or empty when the token is unknown
     */
    public static Optional<Urgency> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String token = value.trim().toLowerCase(Locale.ROOT);
        for (Urgency urgency : values()) {
            if (urgency.name().toLowerCase(Locale.ROOT).equals(token) || urgency.alias.equals(token)) {
                return Optional.of(urgency);
            }
        }
        return Optional.empty();
    }
}
