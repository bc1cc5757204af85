package dev.jobmatcher.model;

/**
 * The five sub-scores combined into a match score. Declaration order is the
 * tie-break order wherever components are ranked against each other.
 */
public enum ScoreComponent {
    SKILL,
    LOCATION,
    BUDGET,
    AVAILABILITY,
    QUALITY
}
