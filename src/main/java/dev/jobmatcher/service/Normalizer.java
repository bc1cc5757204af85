package dev.jobmatcher.service;

import dev.jobmatcher.api.MatchRequest;
import dev.jobmatcher.api.MatchRequest.JobPayload;
import dev.jobmatcher.api.MatchRequest.ProviderPayload;
import dev.jobmatcher.api.MatchRequest.WeightsPayload;
import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.model.GeoPoint;
import dev.jobmatcher.model.InvalidMatchRequestException;
import dev.jobmatcher.model.InvalidMatchRequestException.Violation;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.Provider;
import dev.jobmatcher.model.ScoringWeights;
import dev.jobmatcher.model.Urgency;
import dev.jobmatcher.scoring.SkillMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts raw request payloads into canonical job and provider records.
 * Job-level problems are collected and rejected together; provider-level
 * anomalies fall back to safe defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Normalizer {

    private final MatchingConfig matchingConfig;
    private final ScoringWeights defaultWeights;
    private final JobAnalysisService jobAnalysisService;
    private final Clock clock;

    /**
     * Canonical form of a whole request, ready for scoring.
     */
    public record NormalizedRequest(
            JobRequirement job,
            List<Provider> providers,
            int topK,
            ScoringWeights weights) {
    }

    /**
     * Normalize and validate a request.
     *
     * @param request the raw request
     * @return the canonical request
     * @throws InvalidMatchRequestException listing every offending field
     */
    public NormalizedRequest normalize(MatchRequest request) {
        if (request == null) {
            throw new InvalidMatchRequestException(List.of(new Violation("request", "is required")));
        }

        List<Violation> violations = new ArrayList<>();
        JobRequirement job = normalizeJob(request.getJob(), violations);
        int topK = resolveTopK(request.getTopK(), violations);
        ScoringWeights weights = resolveWeights(request.getWeights(), violations);
        List<Provider> providers = normalizeProviders(request.getProviders(), violations);

        if (!violations.isEmpty()) {
            throw new InvalidMatchRequestException(violations);
        }
        return new NormalizedRequest(job, providers, topK, weights);
    }

    JobRequirement normalizeJob(JobPayload payload, List<Violation> violations) {
        if (payload == null) {
            violations.add(new Violation("job", "is required"));
            return null;
        }
        int violationsBefore = violations.size();

        String id = trimToNull(payload.getId());
        if (id == null) {
            violations.add(new Violation("job.id", "is required"));
        }

        String category = canonicalCategory(payload.getCategory());
        if (category.isEmpty()) {
            violations.add(new Violation("job.category", "is required"));
        }

        Double budgetMin = payload.getBudgetMin();
        Double budgetMax = payload.getBudgetMax();
        checkBudget("job.budget_min", budgetMin, violations);
        checkBudget("job.budget_max", budgetMax, violations);
        if (budgetMin != null && budgetMax != null && budgetMin > budgetMax) {
            violations.add(new Violation("job.budget_min", "must not exceed budget_max"));
        }

        Optional<Urgency> urgency = Urgency.parse(payload.getUrgency());
        if (trimToNull(payload.getUrgency()) == null) {
            violations.add(new Violation("job.urgency", "is required"));
        } else if (urgency.isEmpty()) {
            violations.add(new Violation("job.urgency", "unknown value '" + payload.getUrgency() + "'"));
        }

        Set<String> skills = SkillMatcher.canonicalSkills(payload.getSkills());
        if (skills.isEmpty() && matchingConfig.isInferSkillsFromDescription()) {
            skills = SkillMatcher.canonicalSkills(jobAnalysisService.analyze(payload.getDescription()).skills());
            log.debug("Job {} lists no skills, inferred {} from description", id, skills);
        }
        if (skills.isEmpty() && requiresSkills(category)) {
            violations.add(new Violation("job.skills",
                    "category '" + category + "' requires at least one skill"));
        }

        if (violations.size() > violationsBefore) {
            return null;
        }

        GeoPoint location = toGeoPoint(payload.getLocation());
        if (location == null) {
            log.warn("Job {} has no usable location {}; all location scores will be 0", id, payload.getLocation());
        }

        return JobRequirement.builder()
                .id(id)
                .title(payload.getTitle() == null ? "" : payload.getTitle().trim())
                .description(payload.getDescription() == null ? "" : payload.getDescription())
                .category(category)
                .budgetMin(budgetMin)
                .budgetMax(budgetMax)
                .location(location)
                .urgency(urgency.orElseThrow())
                .requiredSkills(skills)
                .postedAt(payload.getPostedAt() != null ? payload.getPostedAt() : clock.instant())
                .build();
    }

    List<Provider> normalizeProviders(List<ProviderPayload> payloads, List<Violation> violations) {
        if (payloads == null) {
            return List.of();
        }
        List<Provider> providers = new ArrayList<>(payloads.size());
        for (int i = 0; i < payloads.size(); i++) {
            ProviderPayload payload = payloads.get(i);
            String field = "providers[" + i + "]";
            if (payload == null) {
                violations.add(new Violation(field, "must not be null"));
                continue;
            }
            String id = trimToNull(payload.getId());
            if (id == null) {
                violations.add(new Violation(field + ".id", "is required"));
                continue;
            }
            providers.add(normalizeProvider(id, payload));
        }
        return List.copyOf(providers);
    }

    Provider normalizeProvider(String id, ProviderPayload payload) {
        MatchingConfig.Quality quality = matchingConfig.getQuality();

        GeoPoint location = toGeoPoint(payload.getLocation());
        if (location == null) {
            log.debug("Provider {} has no usable location {}; location score forced to 0", id, payload.getLocation());
        }

        return Provider.builder()
                .id(id)
                .name(payload.getName() == null ? "" : payload.getName().trim())
                .category(canonicalCategory(payload.getCategory()))
                .skills(SkillMatcher.canonicalSkills(payload.getSkills()))
                .location(location)
                .rating(bounded(id, "rating", payload.getRating(), 0.0, 0.0, 5.0))
                .completedJobs(payload.getCompletedJobs() == null ? 0 : Math.max(0, payload.getCompletedJobs()))
                .hourlyRate(bounded(id, "hourly_rate", payload.getHourlyRate(), 0.0, 0.0, Double.MAX_VALUE))
                .serviceRadiusKm(serviceRadius(id, payload.getServiceRadiusKm()))
                .availableDays(availableDays(id, payload.getAvailability()))
                .responseTimeHours(bounded(id, "response_time_hours", payload.getResponseTimeHours(),
                        quality.getDefaultResponseTimeHours(), 0.0, Double.MAX_VALUE))
                .qualityScore(bounded(id, "quality_score", payload.getQualityScore(),
                        quality.getDefaultQualityScore(), 0.0, 1.0))
                .build();
    }

    private int resolveTopK(Integer topK, List<Violation> violations) {
        if (topK == null) {
            return matchingConfig.getDefaultTopK();
        }
        if (topK <= 0) {
            violations.add(new Violation("top_k", "must be a positive integer, got " + topK));
        }
        return topK;
    }

    private ScoringWeights resolveWeights(WeightsPayload payload, List<Violation> violations) {
        if (payload == null) {
            return defaultWeights;
        }
        int violationsBefore = violations.size();
        requireWeight("weights.skill", payload.getSkill(), violations);
        requireWeight("weights.location", payload.getLocation(), violations);
        requireWeight("weights.budget", payload.getBudget(), violations);
        requireWeight("weights.availability", payload.getAvailability(), violations);
        requireWeight("weights.quality", payload.getQuality(), violations);
        if (violations.size() > violationsBefore) {
            return null;
        }
        try {
            return new ScoringWeights(payload.getSkill(), payload.getLocation(), payload.getBudget(),
                    payload.getAvailability(), payload.getQuality());
        } catch (IllegalArgumentException e) {
            violations.add(new Violation("weights", e.getMessage()));
            return null;
        }
    }

    private static void requireWeight(String field, Double value, List<Violation> violations) {
        if (value == null) {
            violations.add(new Violation(field, "is required when weights are given"));
        }
    }

    private static void checkBudget(String field, Double value, List<Violation> violations) {
        if (value == null) {
            violations.add(new Violation(field, "is required"));
        } else if (!Double.isFinite(value) || value < 0) {
            violations.add(new Violation(field, "must be a non-negative number"));
        }
    }

    private boolean requiresSkills(String category) {
        return matchingConfig.getSkillRequiredCategories().stream()
                .map(Normalizer::canonicalCategory)
                .anyMatch(category::equals);
    }

    private double serviceRadius(String providerId, Double radiusKm) {
        if (radiusKm == null || !Double.isFinite(radiusKm) || radiusKm <= 0) {
            log.debug("Provider {} has no valid service radius ({}), using default {} km",
                    providerId, radiusKm, matchingConfig.getDefaultServiceRadiusKm());
            return matchingConfig.getDefaultServiceRadiusKm();
        }
        return radiusKm;
    }

    /**
     * Availability map to the set of available days. A missing map means
     * unavailable every day.
     */
    private Set<DayOfWeek> availableDays(String providerId, Map<String, Boolean> availability) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        if (availability == null) {
            log.debug("Provider {} has no availability; treated as unavailable", providerId);
            return days;
        }
        availability.forEach((token, available) -> {
            DayOfWeek day = parseDay(token);
            if (day == null) {
                log.debug("Provider {} has unknown availability day '{}'", providerId, token);
            } else if (Boolean.TRUE.equals(available)) {
                days.add(day);
            }
        });
        return days;
    }

    static DayOfWeek parseDay(String token) {
        if (token == null) {
            return null;
        }
        String value = token.trim().toLowerCase(Locale.ROOT);
        for (DayOfWeek day : DayOfWeek.values()) {
            String name = day.name().toLowerCase(Locale.ROOT);
            if (name.equals(value) || (value.length() == 3 && name.startsWith(value))) {
                return day;
            }
        }
        return null;
    }

    static GeoPoint toGeoPoint(List<Double> coordinates) {
        if (coordinates == null || coordinates.size() != 2
                || coordinates.get(0) == null || coordinates.get(1) == null) {
            return null;
        }
        double latitude = coordinates.get(0);
        double longitude = coordinates.get(1);
        return GeoPoint.isValid(latitude, longitude) ? new GeoPoint(latitude, longitude) : null;
    }

    private static double bounded(String providerId, String field, Double value,
                                  double fallback, double min, double max) {
        if (value == null || value.isNaN()) {
            return fallback;
        }
        if (value < min || value > max) {
            double clamped = Math.max(min, Math.min(max, value));
            log.warn("Provider {} has out-of-range {} {}, clamped to {}", providerId, field, value, clamped);
            return clamped;
        }
        return value;
    }

    static String canonicalCategory(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
