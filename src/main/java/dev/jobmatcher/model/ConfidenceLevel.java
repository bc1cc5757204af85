package dev.jobmatcher.model;

/**
 * Coarse confidence label derived from the aggregate match score.
 */
public enum ConfidenceLevel {
    VERY_HIGH("Very High", 0.8),
    HIGH("High", 0.6),
    MEDIUM("Medium", 0.4),
    LOW("Low", 0.0);

    private final String label;
    private final double minScore;

    ConfidenceLevel(String label, double minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    public String getLabel() {
        return label;
    }

    public static ConfidenceLevel of(double matchScore) {
        for (ConfidenceLevel level : values()) {
            if (matchScore >= level.minScore) {
                return level;
            }
        }
        return LOW;
    }
}
