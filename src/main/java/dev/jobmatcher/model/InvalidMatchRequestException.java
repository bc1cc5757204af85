package dev.jobmatcher.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a match request is rejected before scoring. Carries every
 * offending field found, not just the first one.
 */
public class InvalidMatchRequestException extends RuntimeException {

    private final transient List<Violation> violations;

    /**
     * One rejected field.
     */
    public record Violation(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    public InvalidMatchRequestException(List<Violation> violations) {
        super(describe(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public List<String> getFields() {
        return violations.stream().map(Violation::field).toList();
    }

    private static String describe(List<Violation> violations) {
        return "Invalid match request: " + violations.stream()
                .map(Violation::toString)
                .collect(Collectors.joining("; "));
    }
}
