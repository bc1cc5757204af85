package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.DayOfWeek;
import java.util.Set;

/**
 * Canonical snapshot of a candidate provider for one matching call.
 */
@Value
@Builder
public class Provider {
    String id;
    String name;
    String category;
    @Singular
    Set<String> skills;
    GeoPoint location; // null marks the provider as geographically unscoreable
    double rating;
    int completedJobs;
    double hourlyRate;
    double serviceRadiusKm;
    @Singular
    Set<DayOfWeek> availableDays;
    double responseTimeHours;
    double qualityScore;

    public boolean hasLocation() {
        return location != null;
    }
}
