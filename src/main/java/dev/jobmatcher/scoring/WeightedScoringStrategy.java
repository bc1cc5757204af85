package dev.jobmatcher.scoring;

import dev.jobmatcher.model.ComponentScores;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Default strategy: continuous scores from the five dedicated scorers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "matching.strategy", havingValue = "weighted", matchIfMissing = true)
public class WeightedScoringStrategy implements ScoringStrategy {

    public static final String NAME = "weighted";

    private final SkillMatcher skillMatcher;
    private final GeoScorer geoScorer;
    private final BudgetScorer budgetScorer;
    private final AvailabilityScorer availabilityScorer;
    private final QualityScorer qualityScorer;

    @Override
    public ComponentScores score(JobRequirement job, Provider provider) {
        ComponentScores scores = new ComponentScores(
                skillMatcher.score(job.getRequiredSkills(), provider.getSkills()),
                geoScorer.score(job, provider),
                budgetScorer.score(job, provider),
                availabilityScorer.score(job, provider),
                qualityScorer.score(provider));

        log.debug("Scored provider {} for job {}: {}", provider.getId(), job.getId(), scores);
        return scores;
    }

    @Override
    public String name() {
        return NAME;
    }
}
