package dev.jobmatcher.scoring;

import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.model.Provider;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Scores a provider's track record from rating, completed-job volume and
 * responsiveness.
 */
@Component
@RequiredArgsConstructor
public class QualityScorer {

    private final MatchingConfig matchingConfig;

    public double score(Provider provider) {
        MatchingConfig.Quality quality = matchingConfig.getQuality();

        double totalWeight = quality.getRatingWeight() + quality.getVolumeWeight()
                + quality.getResponsivenessWeight();
        if (totalWeight <= 0) {
            return 0.0;
        }

        double blended = quality.getRatingWeight() * ratingSignal(provider)
                + quality.getVolumeWeight() * volumeSignal(provider.getCompletedJobs())
                + quality.getResponsivenessWeight() * responsivenessSignal(provider.getResponseTimeHours());

        return Math.max(0.0, Math.min(1.0, blended / totalWeight));
    }

    /**
     * Rating scaled to [0,1]. A provider without reviews (rating 0) is
     * judged on the platform's own quality score instead.
     */
    double ratingSignal(Provider provider) {
        if (provider.getRating() <= 0) {
            return provider.getQualityScore();
        }
        return Math.min(1.0, provider.getRating() / 5.0);
    }

    /**
     * Diminishing-returns volume signal; new providers get a neutral value.
     */
    double volumeSignal(int completedJobs) {
        MatchingConfig.Quality quality = matchingConfig.getQuality();
        if (completedJobs <= 0) {
            return quality.getColdStartVolume();
        }
        return Math.min(1.0, (double) completedJobs / quality.getVolumeSaturation());
    }

    double responsivenessSignal(double responseTimeHours) {
        return 1.0 / (1.0 + Math.max(0.0, responseTimeHours));
    }
}
