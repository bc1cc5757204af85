package dev.jobmatcher.config;

import dev.jobmatcher.model.ScoringWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the matching engine.
 * Loaded from matching.yml under 'matching' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "matching")
public class MatchingConfig {

    private Weights weights = new Weights();
    private int defaultTopK = 5;
    private double defaultServiceRadiusKm = 25.0;
    private String timeZone = "UTC";
    private List<String> skillRequiredCategories = new ArrayList<>();
    private boolean requireCategoryMatch = false;
    private boolean inferSkillsFromDescription = false;
    private String strategy = "weighted";
    private int parallelism = Runtime.getRuntime().availableProcessors();
    private Duration batchTimeout;
    private Synonyms synonyms = new Synonyms();
    private Explanation explanation = new Explanation();
    private Quality quality = new Quality();

    public ZoneId zoneId() {
        return ZoneId.of(timeZone);
    }

    @Data
    public static class Weights {
        private double skill = 0.30;
        private double location = 0.20;
        private double budget = 0.15;
        private double availability = 0.25;
        private double quality = 0.10;

        public ScoringWeights toScoringWeights() {
            return new ScoringWeights(skill, location, budget, availability, quality);
        }
    }

    @Data
    public static class Synonyms {
        private boolean enabled = false;
        private Map<String, List<String>> groups = new LinkedHashMap<>();
    }

    @Data
    public static class Explanation {
        private double strongThreshold = 0.8;
        private double weakThreshold = 0.3;
    }

    @Data
    public static class Quality {
        private double ratingWeight = 0.5;
        private double volumeWeight = 0.3;
        private double responsivenessWeight = 0.2;
        private int volumeSaturation = 50;
        private double coldStartVolume = 0.5;
        private double defaultResponseTimeHours = 24.0;
        private double defaultQualityScore = 0.5;
    }
}
