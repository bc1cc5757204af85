package dev.jobmatcher.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Scored match of one provider against a job. All scores are in [0,1].
 */
@Value
@Builder
public class MatchResult {
    String providerId;
    String jobId;
    double skillMatch;
    double locationScore;
    double budgetCompatibility;
    double availabilityScore;
    double qualityScore;
    double matchScore;
    /** False when the job or the provider has no coordinates. */
    @Builder.Default
    boolean locationKnown = true;
    @With
    String explanation;

    public ComponentScores components() {
        return new ComponentScores(skillMatch, locationScore, budgetCompatibility, availabilityScore, qualityScore);
    }

    public ConfidenceLevel confidence() {
        return ConfidenceLevel.of(matchScore);
    }
}
