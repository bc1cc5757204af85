package dev.jobmatcher.scoring;

import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;
import dev.jobmatcher.model.Urgency;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.Set;

/**
 * Scores whether a provider can take the job on a qualifying day.
 * This is a hard signal: 1.0 or 0.0.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityScorer {

    private final MatchingConfig matchingConfig;

    public double score(JobRequirement job, Provider provider) {
        Set<DayOfWeek> available = provider.getAvailableDays();
        if (available == null || available.isEmpty()) {
            return 0.0;
        }
        for (DayOfWeek day : qualifyingDays(job)) {
            if (available.contains(day)) {
                return 1.0;
            }
        }
        return 0.0;
    }

    /**
     * Days on which the job may start: the posting day for urgent jobs,
     * any day otherwise.
     */
    public Set<DayOfWeek> qualifyingDays(JobRequirement job) {
        if (job.getUrgency() == Urgency.URGENT) {
            return EnumSet.of(postingDay(job));
        }
        return EnumSet.allOf(DayOfWeek.class);
    }

    DayOfWeek postingDay(JobRequirement job) {
        return job.getPostedAt().atZone(matchingConfig.zoneId()).getDayOfWeek();
    }
}
