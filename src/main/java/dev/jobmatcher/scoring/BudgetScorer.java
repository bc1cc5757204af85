package dev.jobmatcher.scoring;

import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;
import org.springframework.stereotype.Component;

/**
 * Scores how well a provider's hourly rate fits the job's budget range.
 * Rates below the range are penalized as well as rates above it.
 */
@Component
public class BudgetScorer {

    public double score(JobRequirement job, Provider provider) {
        return score(job.getBudgetMin(), job.getBudgetMax(), provider.getHourlyRate());
    }

    /**
     * 1.0 inside {@code [min, max]}; decays linearly to 0 at {@code min / 2}
     * below the range and at {@code 2 * max} above it.
     */
    public double score(double budgetMin, double budgetMax, double rate) {
        if (rate >= budgetMin && rate <= budgetMax) {
            return 1.0;
        }
        if (rate < budgetMin) {
            double floor = budgetMin / 2;
            if (rate <= floor) {
                return 0.0;
            }
            return (rate - floor) / (budgetMin - floor);
        }
        if (budgetMax <= 0) {
            return 0.0;
        }
        double ceiling = 2 * budgetMax;
        if (rate >= ceiling) {
            return 0.0;
        }
        return (ceiling - rate) / budgetMax;
    }
}
