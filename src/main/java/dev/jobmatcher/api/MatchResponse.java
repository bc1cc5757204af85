package dev.jobmatcher.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.jobmatcher.model.MatchResult;

import java.util.List;

/**
 * Outgoing matching response. Scores are percentages rounded to one decimal.
 */
@JsonPropertyOrder({"job_id", "strategy", "matches_found", "matches"})
public record MatchResponse(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("matches_found") int matchesFound,
        @JsonProperty("matches") List<MatchView> matches) {

    public static MatchResponse of(String jobId, String strategy, List<MatchResult> results) {
        List<MatchView> views = results.stream().map(MatchView::of).toList();
        return new MatchResponse(jobId, strategy, views.size(), views);
    }

    @JsonPropertyOrder({"provider_id", "match_score", "skill_match", "location_score",
            "budget_compatibility", "availability_score", "quality_score",
            "confidence_level", "explanation"})
    public record MatchView(
            @JsonProperty("provider_id") String providerId,
            @JsonProperty("match_score") double matchScore,
            @JsonProperty("skill_match") double skillMatch,
            @JsonProperty("location_score") double locationScore,
            @JsonProperty("budget_compatibility") double budgetCompatibility,
            @JsonProperty("availability_score") double availabilityScore,
            @JsonProperty("quality_score") double qualityScore,
            @JsonProperty("confidence_level") String confidenceLevel,
            @JsonProperty("explanation") String explanation) {

        public static MatchView of(MatchResult result) {
            return new MatchView(
                    result.getProviderId(),
                    percent(result.getMatchScore()),
                    percent(result.getSkillMatch()),
                    percent(result.getLocationScore()),
                    percent(result.getBudgetCompatibility()),
                    percent(result.getAvailabilityScore()),
                    percent(result.getQualityScore()),
                    result.confidence().getLabel(),
                    result.getExplanation());
        }
    }

    /**
     * Convert a [0,1] score into a percentage with one decimal place.
     */
    static double percent(double score) {
        return Math.round(score * 1000.0) / 10.0;
    }
}
