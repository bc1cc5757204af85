package dev.jobmatcher.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Incoming matching request as supplied by the calling layer. Fields are
 * loosely typed here and validated by the normalizer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MatchRequest {

    private JobPayload job;

    @Builder.Default
    private List<ProviderPayload> providers = new ArrayList<>();

    @JsonProperty("top_k")
    private Integer topK;

    private WeightsPayload weights;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class JobPayload {
        private String id;
        private String title;
        private String description;
        private String category;
        @JsonProperty("budget_min")
        private Double budgetMin;
        @JsonProperty("budget_max")
        private Double budgetMax;
        private List<Double> location;
        private String urgency;
        private List<String> skills;
        @JsonProperty("posted_at")
        private Instant postedAt;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderPayload {
        private String id;
        private String name;
        private String category;
        private List<String> skills;
        private List<Double> location;
        private Double rating;
        @JsonProperty("completed_jobs")
        private Integer completedJobs;
        @JsonProperty("hourly_rate")
        private Double hourlyRate;
        @JsonProperty("service_radius_km")
        private Double serviceRadiusKm;
        private Map<String, Boolean> availability;
        @JsonProperty("response_time_hours")
        private Double responseTimeHours;
        @JsonProperty("quality_score")
        private Double qualityScore;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class WeightsPayload {
        private Double skill;
        private Double location;
        private Double budget;
        private Double availability;
        private Double quality;
    }
}
