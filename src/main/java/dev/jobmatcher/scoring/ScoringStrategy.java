package dev.jobmatcher.scoring;

import dev.jobmatcher.model.ComponentScores;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;

/**
 * Interface for computing the component scores of one provider against a job.
 * Exactly one implementation is active, chosen by {@code matching.strategy}.
 * Implementations must be stateless: they are called concurrently.
 */
public interface ScoringStrategy {

    /**
     * Score a single provider.
     *
     * @param job      the normalized job
     * @param provider the normalized provider
     * @return the five component scores, each in [0,1]
     */
    ComponentScores score(JobRequirement job, Provider provider);

    /**
     * @return the configuration name of this strategy
     */
    String name();
}
