package dev.jobmatcher.service;

import dev.jobmatcher.api.MatchRequest;
import dev.jobmatcher.api.MatchRequest.JobPayload;
import dev.jobmatcher.api.MatchRequest.ProviderPayload;
import dev.jobmatcher.api.MatchRequest.WeightsPayload;
import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.model.GeoPoint;
import dev.jobmatcher.model.InvalidMatchRequestException;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;
import dev.jobmatcher.model.ScoringWeights;
import dev.jobmatcher.model.Urgency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class NormalizerTest {

    private static final Instant NOW = Instant.parse("2026-10-14T09:00:00Z");

    private MatchingConfig matchingConfig;
    private Normalizer normalizer;

    @BeforeEach
    void setUp() {
        matchingConfig = new MatchingConfig();
        matchingConfig.setSkillRequiredCategories(List.of("electrical", "plumbing"));
        normalizer = new Normalizer(matchingConfig, ScoringWeights.defaults(), new JobAnalysisService(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private JobPayload.JobPayloadBuilder validJob() {
        return JobPayload.builder()
                .id("job-1")
                .title("Rewire kitchen")
                .description("Replace old wiring")
                .category("Electrical")
                .budgetMin(50.0)
                .budgetMax(100.0)
                .location(List.of(-33.8688, 151.2093))
                .urgency("high")
                .skills(List.of("Electrical", " wiring "));
    }

    private ProviderPayload.ProviderPayloadBuilder validProvider(String id) {
        return ProviderPayload.builder()
                .id(id)
                .name("Sparky " + id)
                .category("electrical")
                .skills(List.of("electrical"))
                .location(List.of(-33.87, 151.21))
                .rating(4.5)
                .completedJobs(25)
                .hourlyRate(80.0)
                .serviceRadiusKm(20.0)
                .availability(Map.of("monday", true, "tuesday", false))
                .responseTimeHours(2.0)
                .qualityScore(0.9);
    }

    private MatchRequest request(JobPayload job, ProviderPayload... providers) {
        return MatchRequest.builder()
                .job(job)
                .providers(new ArrayList<>(Arrays.asList(providers)))
                .build();
    }

    private InvalidMatchRequestException rejection(MatchRequest request) {
        Throwable thrown = catchThrowable(() -> normalizer.normalize(request));
        assertThat(thrown).isInstanceOf(InvalidMatchRequestException.class);
        return (InvalidMatchRequestException) thrown;
    }

    @Nested
    @DisplayName("Job normalization")
    class JobTests {

        @Test
        @DisplayName("Should canonicalize a valid job")
        void shouldCanonicalizeValidJob() {
            JobRequirement job = normalizer.normalize(request(validJob().build())).job();

            assertThat(job.getId()).isEqualTo("job-1");
            assertThat(job.getCategory()).isEqualTo("electrical");
            assertThat(job.getRequiredSkills()).containsExactlyInAnyOrder("electrical", "wiring");
            assertThat(job.getUrgency()).isEqualTo(Urgency.HIGH);
            assertThat(job.getLocation()).isEqualTo(new GeoPoint(-33.8688, 151.2093));
            assertThat(job.getBudgetMin()).isEqualTo(50.0);
            assertThat(job.getBudgetMax()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("Should stamp the posting time from the clock when absent")
        void shouldDefaultPostedAt() {
            JobRequirement job = normalizer.normalize(request(validJob().build())).job();

            assertThat(job.getPostedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should keep an explicit posting time")
        void shouldKeepPostedAt() {
            Instant postedAt = Instant.parse("2026-10-12T18:00:00Z");

            JobRequirement job = normalizer.normalize(request(validJob().postedAt(postedAt).build())).job();

            assertThat(job.getPostedAt()).isEqualTo(postedAt);
        }

        @Test
        @DisplayName("Should accept a job without a usable location")
        void shouldAcceptJobWithoutLocation() {
            JobRequirement job = normalizer.normalize(request(validJob().location(List.of(95.0, 10.0)).build())).job();

            assertThat(job.hasLocation()).isFalse();
        }

        @Test
        @DisplayName("Should reject a missing job")
        void shouldRejectMissingJob() {
            assertThat(rejection(request(null)).getFields()).containsExactly("job");
        }

        @Test
        @DisplayName("Should reject a null request")
        void shouldRejectNullRequest() {
            assertThatThrownBy(() -> normalizer.normalize(null))
                    .isInstanceOf(InvalidMatchRequestException.class)
                    .hasMessageContaining("request");
        }

        @Test
        @DisplayName("Should reject an inverted budget")
        void shouldRejectInvertedBudget() {
            InvalidMatchRequestException e = rejection(request(validJob().budgetMin(200.0).build()));

            assertThat(e.getFields()).containsExactly("job.budget_min");
            assertThat(e.getMessage()).contains("must not exceed budget_max");
        }

        @Test
        @DisplayName("Should accept a budget of a single value")
        void shouldAcceptPointBudget() {
            JobRequirement job = normalizer.normalize(request(validJob().budgetMin(75.0).budgetMax(75.0).build())).job();

            assertThat(job.getBudgetMin()).isEqualTo(job.getBudgetMax());
        }

        @Test
        @DisplayName("Should reject negative and missing budgets")
        void shouldRejectBadBudgets() {
            InvalidMatchRequestException e = rejection(request(validJob().budgetMin(-1.0).budgetMax(null).build()));

            assertThat(e.getFields()).contains("job.budget_min", "job.budget_max");
        }

        @ParameterizedTest(name = "Should reject urgency ''{0}''")
        @ValueSource(strings = {"critical", "  ", "tomorrow"})
        void shouldRejectUnknownUrgency(String urgency) {
            assertThat(rejection(request(validJob().urgency(urgency).build())).getFields())
                    .containsExactly("job.urgency");
        }

        @Test
        @DisplayName("Should require skills for skill-required categories")
        void shouldRequireSkillsForCategory() {
            InvalidMatchRequestException e = rejection(request(validJob().skills(List.of(" ")).build()));

            assertThat(e.getFields()).containsExactly("job.skills");
        }

        @Test
        @DisplayName("Should allow an empty skill list for other categories")
        void shouldAllowEmptySkillsForOtherCategories() {
            JobRequirement job = normalizer.normalize(request(validJob()
                    .category("cleaning")
                    .skills(List.of())
                    .build())).job();

            assertThat(job.getRequiredSkills()).isEmpty();
        }

        @Test
        @DisplayName("Should infer skills from the description when enabled")
        void shouldInferSkillsWhenEnabled() {
            matchingConfig.setInferSkillsFromDescription(true);

            JobRequirement job = normalizer.normalize(request(validJob()
                    .category("plumbing")
                    .description("Leak under the sink")
                    .skills(null)
                    .build())).job();

            assertThat(job.getRequiredSkills()).containsExactly("plumbing");
        }

        @Test
        @DisplayName("Should report every offending field at once")
        void shouldCollectAllViolations() {
            MatchRequest request = request(JobPayload.builder().budgetMin(10.0).budgetMax(5.0).build());
            request.setTopK(0);

            InvalidMatchRequestException e = rejection(request);

            assertThat(e.getFields()).contains("job.id", "job.category", "job.budget_min", "job.urgency", "top_k");
        }
    }

    @Nested
    @DisplayName("Request options")
    class OptionsTests {

        @Test
        @DisplayName("Should use the configured top_k when absent")
        void shouldDefaultTopK() {
            assertThat(normalizer.normalize(request(validJob().build())).topK()).isEqualTo(5);
        }

        @Test
        @DisplayName("Should reject a non-positive top_k")
        void shouldRejectNonPositiveTopK() {
            MatchRequest request = request(validJob().build());
            request.setTopK(-3);

            assertThat(rejection(request).getFields()).containsExactly("top_k");
        }

        @Test
        @DisplayName("Should use default weights when none are given")
        void shouldDefaultWeights() {
            assertThat(normalizer.normalize(request(validJob().build())).weights())
                    .isEqualTo(ScoringWeights.defaults());
        }

        @Test
        @DisplayName("Should accept a valid weight override")
        void shouldAcceptWeightOverride() {
            MatchRequest request = request(validJob().build());
            request.setWeights(new WeightsPayload(0.2, 0.2, 0.2, 0.2, 0.2));

            assertThat(normalizer.normalize(request).weights()).isEqualTo(new ScoringWeights(0.2, 0.2, 0.2, 0.2, 0.2));
        }

        @Test
        @DisplayName("Should reject weights that do not sum to 1.0")
        void shouldRejectBadWeightSum() {
            MatchRequest request = request(validJob().build());
            request.setWeights(new WeightsPayload(0.5, 0.5, 0.5, 0.5, 0.5));

            assertThat(rejection(request).getFields()).containsExactly("weights");
        }

        @Test
        @DisplayName("Should reject a partial weight override")
        void shouldRejectPartialWeights() {
            MatchRequest request = request(validJob().build());
            request.setWeights(WeightsPayload.builder().skill(1.0).build());

            assertThat(rejection(request).getFields())
                    .containsExactly("weights.location", "weights.budget", "weights.availability", "weights.quality");
        }
    }

    @Nested
    @DisplayName("Provider normalization")
    class ProviderTests {

        @Test
        @DisplayName("Should canonicalize a valid provider")
        void shouldCanonicalizeValidProvider() {
            Provider provider = normalizer.normalize(request(validJob().build(), validProvider("p-1").build()))
                    .providers().get(0);

            assertThat(provider.getId()).isEqualTo("p-1");
            assertThat(provider.getSkills()).containsExactly("electrical");
            assertThat(provider.getAvailableDays()).containsExactly(DayOfWeek.MONDAY);
            assertThat(provider.getRating()).isEqualTo(4.5);
            assertThat(provider.getServiceRadiusKm()).isEqualTo(20.0);
        }

        @Test
        @DisplayName("Should fill defaults for missing optional fields")
        void shouldFillDefaults() {
            Provider provider = normalizer.normalize(request(validJob().build(),
                    ProviderPayload.builder().id("bare").build())).providers().get(0);

            assertThat(provider.hasLocation()).isFalse();
            assertThat(provider.getSkills()).isEmpty();
            assertThat(provider.getAvailableDays()).isEmpty();
            assertThat(provider.getRating()).isEqualTo(0.0);
            assertThat(provider.getCompletedJobs()).isZero();
            assertThat(provider.getHourlyRate()).isEqualTo(0.0);
            assertThat(provider.getServiceRadiusKm()).isEqualTo(25.0);
            assertThat(provider.getResponseTimeHours()).isEqualTo(24.0);
            assertThat(provider.getQualityScore()).isEqualTo(0.5);
        }

        @Test
        @DisplayName("Should clamp out-of-range values")
        void shouldClampOutOfRange() {
            Provider provider = normalizer.normalize(request(validJob().build(), validProvider("p-1")
                    .rating(7.0)
                    .completedJobs(-4)
                    .hourlyRate(-10.0)
                    .qualityScore(1.5)
                    .serviceRadiusKm(-5.0)
                    .build())).providers().get(0);

            assertThat(provider.getRating()).isEqualTo(5.0);
            assertThat(provider.getCompletedJobs()).isZero();
            assertThat(provider.getHourlyRate()).isEqualTo(0.0);
            assertThat(provider.getQualityScore()).isEqualTo(1.0);
            assertThat(provider.getServiceRadiusKm()).isEqualTo(25.0);
        }

        @Test
        @DisplayName("Should treat a malformed location as unscoreable")
        void shouldDropMalformedLocation() {
            List<Double> malformed = new ArrayList<>();
            malformed.add(null);
            malformed.add(151.0);

            Provider provider = normalizer.normalize(request(validJob().build(),
                    validProvider("p-1").location(malformed).build())).providers().get(0);

            assertThat(provider.hasLocation()).isFalse();
        }

        @Test
        @DisplayName("Should read short and mixed-case day names")
        void shouldReadDayNames() {
            Map<String, Boolean> availability = new LinkedHashMap<>();
            availability.put("Mon", true);
            availability.put("SATURDAY", true);
            availability.put("holiday", true);
            availability.put("sun", null);

            Provider provider = normalizer.normalize(request(validJob().build(),
                    validProvider("p-1").availability(availability).build())).providers().get(0);

            assertThat(provider.getAvailableDays()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.SATURDAY);
        }

        @Test
        @DisplayName("Should reject providers without an id")
        void shouldRejectProviderWithoutId() {
            InvalidMatchRequestException e = rejection(request(validJob().build(),
                    validProvider("p-1").build(), validProvider(" ").build()));

            assertThat(e.getFields()).containsExactly("providers[1].id");
        }

        @Test
        @DisplayName("Should accept an empty provider list")
        void shouldAcceptEmptyProviders() {
            MatchRequest request = request(validJob().build());
            request.setProviders(null);

            assertThat(normalizer.normalize(request).providers()).isEmpty();
        }
    }

    @Test
    @DisplayName("Day parser should accept full and three-letter names only")
    void dayParserShouldAcceptKnownForms() {
        assertThat(Normalizer.parseDay("Wednesday")).isEqualTo(DayOfWeek.WEDNESDAY);
        assertThat(Normalizer.parseDay("wed")).isEqualTo(DayOfWeek.WEDNESDAY);
        assertThat(Normalizer.parseDay("we")).isNull();
        assertThat(Normalizer.parseDay(null)).isNull();
    }
}
