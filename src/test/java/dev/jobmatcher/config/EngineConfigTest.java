package dev.jobmatcher.config;

import dev.jobmatcher.model.ScoringWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class EngineConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesBinding.class, MatchingConfig.class, EngineConfig.class);

    @Configuration
    @EnableConfigurationProperties
    static class PropertiesBinding {
    }

    @Test
    @DisplayName("Should build weights from configuration")
    void shouldBuildWeights() {
        contextRunner
                .withPropertyValues(
                        "matching.weights.skill=0.4",
                        "matching.weights.location=0.1",
                        "matching.weights.budget=0.1",
                        "matching.weights.availability=0.3",
                        "matching.weights.quality=0.1")
                .run(context -> assertThat(context.getBean(ScoringWeights.class))
                        .isEqualTo(new ScoringWeights(0.4, 0.1, 0.1, 0.3, 0.1)));
    }

    @Test
    @DisplayName("Should fail startup for weights that do not sum to 1.0")
    void shouldFailStartupForBadWeights() {
        contextRunner
                .withPropertyValues("matching.weights.skill=0.9")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(IllegalArgumentException.class)
                            .hasMessageContaining("sum to 1.0");
                });
    }

    @Test
    @DisplayName("Should fail startup for negative weights")
    void shouldFailStartupForNegativeWeights() {
        contextRunner
                .withPropertyValues("matching.weights.skill=-0.3", "matching.weights.quality=0.7")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Should create a clock in the configured time zone")
    void shouldCreateClockInConfiguredZone() {
        contextRunner
                .withPropertyValues("matching.time-zone=Australia/Sydney")
                .run(context -> assertThat(context.getBean(Clock.class).getZone())
                        .isEqualTo(ZoneId.of("Australia/Sydney")));
    }
}
