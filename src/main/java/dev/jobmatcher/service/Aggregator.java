package dev.jobmatcher.service;

import dev.jobmatcher.model.ComponentScores;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.MatchResult;
import dev.jobmatcher.model.Provider;
import dev.jobmatcher.model.ScoreComponent;
import dev.jobmatcher.model.ScoringWeights;
import org.springframework.stereotype.Service;

/**
 * Combines component scores into a single weighted match score.
 */
@Service
public class Aggregator {

    private static final double SCORE_PRECISION = 1e9;

    /**
     * Build the match result for one provider. The explanation is left empty
     * until the result survives ranking.
     */
    public MatchResult aggregate(JobRequirement job, Provider provider, ComponentScores scores, ScoringWeights weights) {
        return MatchResult.builder()
                .jobId(job.getId())
                .providerId(provider.getId())
                .skillMatch(scores.skill())
                .locationScore(scores.location())
                .budgetCompatibility(scores.budget())
                .availabilityScore(scores.availability())
                .qualityScore(scores.quality())
                .matchScore(matchScore(scores, weights))
                .locationKnown(job.hasLocation() && provider.hasLocation())
                .explanation("")
                .build();
    }

    /**
     * @return {@code Σ weight_i × component_i}, clamped to [0,1] and rounded to
     * nine decimals so equal sums compare equal in ranking
     */
    public double matchScore(ComponentScores scores, ScoringWeights weights) {
        double total = 0.0;
        for (ScoreComponent component : ScoreComponent.values()) {
            total += weights.weightOf(component) * scores.valueOf(component);
        }
        double clamped = Math.max(0.0, Math.min(1.0, total));
        return Math.round(clamped * SCORE_PRECISION) / SCORE_PRECISION;
    }
}
