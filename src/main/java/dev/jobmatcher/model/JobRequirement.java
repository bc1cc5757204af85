package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

/**
 * Canonical, validated job requirement. Built by the normalizer and never
 * modified while providers are scored against it.
 */
@Value
@Builder
public class JobRequirement {
    String id;
    String title;
    String description;
    String category;
    double budgetMin;
    double budgetMax;
    GeoPoint location; // null when missing or malformed
    Urgency urgency;
    @Singular
    Set<String> requiredSkills;
    Instant postedAt;

    public boolean hasLocation() {
        return location != null;
    }
}
