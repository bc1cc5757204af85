package dev.jobmatcher.scoring;

import dev.jobmatcher.model.GeoPoint;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;
import org.springframework.stereotype.Component;

/**
 * Scores proximity as a linear decay of distance against the provider's
 * service radius.
 */
@Component
public class GeoScorer {

    public double score(JobRequirement job, Provider provider) {
        return score(job.getLocation(), provider.getLocation(), provider.getServiceRadiusKm());
    }

    /**
     * @return {@code max(0, 1 - d / radius)}, or 0 when either location is unknown
     */
    public double score(GeoPoint jobLocation, GeoPoint providerLocation, double radiusKm) {
        if (jobLocation == null || providerLocation == null || !(radiusKm > 0)) {
            return 0.0;
        }
        double distance = GeoDistance.kilometers(jobLocation, providerLocation);
        if (distance >= radiusKm) {
            return 0.0;
        }
        return Math.max(0.0, 1.0 - distance / radiusKm);
    }
}
