package dev.jobmatcher.service;

import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.model.ComponentScores;
import dev.jobmatcher.model.MatchResult;
import dev.jobmatcher.model.ScoreComponent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a short justification from the strongest and weakest component scores.
 */
@Service
@RequiredArgsConstructor
public class Explainer {

    private static final Map<ScoreComponent, String> STRENGTHS = new EnumMap<>(ScoreComponent.class);
    private static final Map<ScoreComponent, String> WEAKNESSES = new EnumMap<>(ScoreComponent.class);

    static {
        STRENGTHS.put(ScoreComponent.SKILL, "strong skill match");
        STRENGTHS.put(ScoreComponent.LOCATION, "nearby location");
        STRENGTHS.put(ScoreComponent.BUDGET, "within budget");
        STRENGTHS.put(ScoreComponent.AVAILABILITY, "good availability");
        STRENGTHS.put(ScoreComponent.QUALITY, "proven track record");

        WEAKNESSES.put(ScoreComponent.SKILL, "skill gap");
        WEAKNESSES.put(ScoreComponent.LOCATION, "outside service area");
        WEAKNESSES.put(ScoreComponent.BUDGET, "budget mismatch");
        WEAKNESSES.put(ScoreComponent.AVAILABILITY, "limited availability");
        WEAKNESSES.put(ScoreComponent.QUALITY, "limited track record");
    }

    private static final String UNKNOWN_LOCATION = "unknown location";

    private final MatchingConfig matchingConfig;

    public String explain(MatchResult result) {
        return explain(result.components(), result.isLocationKnown());
    }

    public String explain(ComponentScores scores) {
        return explain(scores, true);
    }

    /**
     * Up to two strengths, qualified by the worst weakness if there is one.
     * Equal scores are ordered by component declaration order. A location
     * weakness without coordinates is worded as unknown rather than distant.
     */
    public String explain(ComponentScores scores, boolean locationKnown) {
        MatchingConfig.Explanation thresholds = matchingConfig.getExplanation();

        List<ScoreComponent> strengths = Arrays.stream(ScoreComponent.values())
                .filter(component -> scores.valueOf(component) >= thresholds.getStrongThreshold())
                .sorted(Comparator.<ScoreComponent>comparingDouble(scores::valueOf).reversed())
                .limit(2)
                .toList();

        List<ScoreComponent> weaknesses = Arrays.stream(ScoreComponent.values())
                .filter(component -> scores.valueOf(component) <= thresholds.getWeakThreshold())
                .sorted(Comparator.<ScoreComponent>comparingDouble(scores::valueOf))
                .limit(2)
                .toList();

        Map<ScoreComponent, String> weaknessWording = WEAKNESSES;
        if (!locationKnown) {
            weaknessWording = new EnumMap<>(WEAKNESSES);
            weaknessWording.put(ScoreComponent.LOCATION, UNKNOWN_LOCATION);
        }

        String text;
        if (!strengths.isEmpty()) {
            text = phrases(strengths, STRENGTHS);
            if (!weaknesses.isEmpty()) {
                text += " but " + weaknessWording.get(weaknesses.get(0));
            }
        } else if (!weaknesses.isEmpty()) {
            text = "weak fit: " + phrases(weaknesses, weaknessWording);
        } else {
            text = "moderate match across all factors";
        }
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String phrases(List<ScoreComponent> components, Map<ScoreComponent, String> wording) {
        return components.stream().map(wording::get).collect(Collectors.joining(" and "));
    }
}
