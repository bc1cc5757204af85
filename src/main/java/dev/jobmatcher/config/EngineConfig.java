package dev.jobmatcher.config;

import dev.jobmatcher.model.ScoringWeights;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Beans derived from {@link MatchingConfig}. The weight profile is validated
 * here, once, so a bad profile stops the application at startup.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public ScoringWeights scoringWeights(MatchingConfig matchingConfig) {
        try {
            ScoringWeights weights = matchingConfig.getWeights().toScoringWeights();
            log.info("Loaded scoring weights: {}", weights);
            return weights;
        } catch (IllegalArgumentException e) {
            log.error("Invalid scoring weights in configuration: {}", e.getMessage());
            throw e;
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock(MatchingConfig matchingConfig) {
        return Clock.system(matchingConfig.zoneId());
    }
}
