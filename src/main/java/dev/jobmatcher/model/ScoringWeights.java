package dev.jobmatcher.model;

/**
 * Weight profile for aggregating component scores. Weights are non-negative
 * and sum to 1.0.
 */
public record ScoringWeights(
        double skill,
        double location,
        double budget,
        double availability,
        double quality) {

    public static final double SUM_TOLERANCE = 0.001;

    public ScoringWeights {
        if (skill < 0 || location < 0 || budget < 0 || availability < 0 || quality < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = skill + location + budget + availability + quality;
        if (Double.isNaN(sum) || Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default profile favoring skill match and availability over budget and quality.
     */
    public static ScoringWeights defaults() {
        return new ScoringWeights(0.30, 0.20, 0.15, 0.25, 0.10);
    }

    public double weightOf(ScoreComponent component) {
        return switch (component) {
            case SKILL -> skill;
            case LOCATION -> location;
            case BUDGET -> budget;
            case AVAILABILITY -> availability;
            case QUALITY -> quality;
        };
    }
}
