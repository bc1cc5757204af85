package dev.jobmatcher.service;

import dev.jobmatcher.model.MatchResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders match results and truncates them to the top K.
 */
@Service
public class Ranker {

    /**
     * Best first: higher match score, then higher quality score, then lower
     * provider id.
     */
    public static final Comparator<MatchResult> RANKING_ORDER = Comparator
            .comparingDouble(MatchResult::getMatchScore).reversed()
            .thenComparing(Comparator.comparingDouble(MatchResult::getQualityScore).reversed())
            .thenComparing(MatchResult::getProviderId);

    /**
     * Rank a copy of the results. The sort is stable, so results that tie on
     * every key keep their input order.
     *
     * @param results scored results, not modified
     * @param topK    maximum number of results to return, must be positive
     * @return at most {@code topK} results, best first
     */
    public List<MatchResult> rank(List<MatchResult> results, int topK) {
        if (topK <= 0) {
            throw new IllegalArgumentException("top_k must be a positive integer, got " + topK);
        }
        List<MatchResult> sorted = new ArrayList<>(results);
        sorted.sort(RANKING_ORDER);
        return List.copyOf(sorted.subList(0, Math.min(topK, sorted.size())));
    }
}
