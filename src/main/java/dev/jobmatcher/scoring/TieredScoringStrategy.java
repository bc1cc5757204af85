package dev.jobmatcher.scoring;

import dev.jobmatcher.model.ComponentScores;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;
import dev.jobmatcher.model.Urgency;
import dev.jobmatcher.service.JobAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;

/**
 * Bucketed strategy kept for platforms that tuned their weights against the
 * older step-function scores. Skill and quality use the shared scorers;
 * location, budget and availability fall into fixed tiers. Budget compares
 * the provider's estimate for the job, hourly rate times the hours inferred
 * from the description, against the job's budget range.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "matching.strategy", havingValue = "tiered")
public class TieredScoringStrategy implements ScoringStrategy {

    public static final String NAME = "tiered";

    private final SkillMatcher skillMatcher;
    private final AvailabilityScorer availabilityScorer;
    private final QualityScorer qualityScorer;
    private final JobAnalysisService jobAnalysisService;

    @Override
    public ComponentScores score(JobRequirement job, Provider provider) {
        ComponentScores scores = new ComponentScores(
                skillMatcher.score(job.getRequiredSkills(), provider.getSkills()),
                locationTier(job, provider),
                budgetTier(job.getBudgetMin(), job.getBudgetMax(), providerEstimate(job, provider)),
                availabilityTier(job, provider),
                qualityScorer.score(provider));

        log.debug("Scored provider {} for job {} (tiered): {}", provider.getId(), job.getId(), scores);
        return scores;
    }

    @Override
    public String name() {
        return NAME;
    }

    double locationTier(JobRequirement job, Provider provider) {
        if (!job.hasLocation() || !provider.hasLocation()) {
            return 0.0;
        }
        double distance = GeoDistance.kilometers(job.getLocation(), provider.getLocation());
        if (distance <= 5) {
            return 1.0;
        } else if (distance <= 15) {
            return 0.8;
        } else if (distance <= 30) {
            return 0.6;
        } else if (distance <= 50) {
            return 0.4;
        }
        return 0.2;
    }

    double providerEstimate(JobRequirement job, Provider provider) {
        int hours = jobAnalysisService.analyze(job.getDescription()).estimatedHours();
        return provider.getHourlyRate() * hours;
    }

    double budgetTier(double budgetMin, double budgetMax, double estimate) {
        if (estimate >= budgetMin && estimate <= budgetMax) {
            return 1.0;
        }
        if (estimate < budgetMin) {
            return 0.9;
        }
        if (budgetMax <= 0) {
            return 0.1;
        }
        double overage = (estimate - budgetMax) / budgetMax;
        if (overage <= 0.2) {
            return 0.7;
        } else if (overage <= 0.5) {
            return 0.4;
        }
        return 0.1;
    }

    /**
     * Average of a response-time check and the share of available days, each
     * measured against the urgency's limits. Urgent jobs still require the
     * provider to be free on the posting day.
     */
    double availabilityTier(JobRequirement job, Provider provider) {
        if (availabilityScorer.score(job, provider) == 0.0) {
            return 0.0;
        }
        Limits limits = Limits.of(job.getUrgency());

        double responseScore = provider.getResponseTimeHours() <= limits.maxResponseHours() ? 1.0 : 0.5;
        double ratio = (double) provider.getAvailableDays().size() / DayOfWeek.values().length;
        double daysScore = ratio >= limits.minAvailableShare() ? 1.0 : ratio;

        return (responseScore + daysScore) / 2;
    }

    private record Limits(double maxResponseHours, double minAvailableShare) {
        static Limits of(Urgency urgency) {
            return switch (urgency) {
                case URGENT -> new Limits(2, 0.8);
                case HIGH -> new Limits(12, 0.6);
                case MEDIUM -> new Limits(48, 0.4);
                case LOW -> new Limits(168, 0.2);
            };
        }
    }
}
