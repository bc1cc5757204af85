package dev.jobmatcher.model;

/**
 * Per-provider component scores, each in [0,1].
 */
public record ComponentScores(
        double skill,
        double location,
        double budget,
        double availability,
        double quality) {

    public ComponentScores {
        skill = clamp(skill);
        location = clamp(location);
        budget = clamp(budget);
        availability = clamp(availability);
        quality = clamp(quality);
    }

    public double valueOf(ScoreComponent component) {
        return switch (component) {
            case SKILL -> skill;
            case LOCATION -> location;
            case BUDGET -> budget;
            case AVAILABILITY -> availability;
            case QUALITY -> quality;
        };
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
