package dev.jobmatcher.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Keyword-based analysis of free-text job descriptions.
 */
@Slf4j
@Service
public class JobAnalysisService {

    private static final Map<Complexity, List<String>> COMPLEXITY_TERMS = new LinkedHashMap<>();
    private static final Map<String, List<String>> SKILL_TERMS = new LinkedHashMap<>();
    private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

    static {
        COMPLEXITY_TERMS.put(Complexity.SIMPLE, List.of("simple", "basic", "quick", "small", "minor"));
        COMPLEXITY_TERMS.put(Complexity.MEDIUM, List.of("medium", "standard", "typical", "regular"));
        COMPLEXITY_TERMS.put(Complexity.COMPLEX, List.of("complex", "major", "large", "extensive", "complete"));

        SKILL_TERMS.put("electrical", List.of("electrical", "wiring", "circuit", "panel", "outlet"));
        SKILL_TERMS.put("plumbing", List.of("plumbing", "pipe", "drain", "water", "leak"));
        SKILL_TERMS.put("construction", List.of("construction", "building", "renovation", "carpentry"));
        SKILL_TERMS.put("tech", List.of("website", "app", "software", "computer", "digital"));
        SKILL_TERMS.put("automotive", List.of("car", "vehicle", "engine", "brake", "automotive"));
        SKILL_TERMS.put("landscaping", List.of("garden", "lawn", "landscape", "tree", "plant"));
        SKILL_TERMS.put("cleaning", List.of("clean", "maintenance", "janitorial", "housekeeping"));
    }

    /**
     * Estimated size of a job.
     */
    public enum Complexity {
        SIMPLE(2),
        MEDIUM(8),
        COMPLEX(24);

        private final int estimatedHours;

        Complexity(int estimatedHours) {
            this.estimatedHours = estimatedHours;
        }

        public int getEstimatedHours() {
            return estimatedHours;
        }
    }

    /**
     * Result of analyzing a description.
     */
    public record JobAnalysis(
            Complexity complexity,
            Set<String> skills,
            int estimatedHours) {
    }

    /**
     * Analyze a job description.
     *
     * @param description free text, may be null
     * @return detected complexity (MEDIUM by default), estimated hours and skill tags
     */
    public JobAnalysis analyze(String description) {
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);

        Complexity complexity = firstMatch(COMPLEXITY_TERMS, text, Complexity.MEDIUM);

        TreeSet<String> skills = new TreeSet<>();
        SKILL_TERMS.forEach((skill, terms) -> {
            if (terms.stream().anyMatch(term -> containsTerm(text, term))) {
                skills.add(skill);
            }
        });

        log.debug("Analyzed description: complexity={}, skills={}", complexity, skills);
        return new JobAnalysis(complexity, Collections.unmodifiableSortedSet(skills), complexity.getEstimatedHours());
    }

    private static <K> K firstMatch(Map<K, List<String>> table, String text, K fallback) {
        for (Map.Entry<K, List<String>> entry : table.entrySet()) {
            if (entry.getValue().stream().anyMatch(term -> containsTerm(text, term))) {
                return entry.getKey();
            }
        }
        return fallback;
    }

    /**
     * Whole-word match that also accepts plural and verb endings, so "pipes"
     * and "leaking" count but "carpentry" does not contain "car".
     */
    static boolean containsTerm(String text, String term) {
        Pattern pattern = PATTERN_CACHE.computeIfAbsent(term,
                k -> Pattern.compile("\\b" + Pattern.quote(k) + "(?:s|es|ed|ing)?\\b"));
        return pattern.matcher(text).find();
    }
}
