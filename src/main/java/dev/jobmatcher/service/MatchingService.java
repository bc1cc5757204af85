package dev.jobmatcher.service;

import dev.jobmatcher.api.MatchRequest;
import dev.jobmatcher.api.MatchResponse;
import dev.jobmatcher.config.MatchingConfig;
import dev.jobmatcher.metrics.MatchingMetrics;
import dev.jobmatcher.model.InvalidMatchRequestException;
import dev.jobmatcher.model.JobRequirement;
import dev.jobmatcher.model.MatchResult;
import dev.jobmatcher.model.Provider;
import dev.jobmatcher.model.ScoringWeights;
import dev.jobmatcher.scoring.ScoringStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import java.time.Duration;
import java.util.List;

/**
 * Main entry point of the matching engine: normalize, score every provider
 * in parallel, aggregate, rank, explain.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MatchingService {

    private final Normalizer normalizer;
    private final ScoringStrategy scoringStrategy;
    private final Aggregator aggregator;
    private final Ranker ranker;
    private final Explainer explainer;
    private final MatchingConfig matchingConfig;
    private final MatchingMetrics metrics;

    /**
     * Match a raw request and render the external response.
     *
     * @param request the raw request
     * @return Mono with the response, or an {@link InvalidMatchRequestException} error
     */
    public Mono<MatchResponse> match(MatchRequest request) {
        return Mono.fromCallable(() -> {
                    metrics.recordRequest();
                    return normalizer.normalize(request);
                })
                .doOnError(InvalidMatchRequestException.class, e -> {
                    metrics.recordRejected();
                    log.warn("Match request rejected: {}", e.getMessage());
                })
                .flatMap(normalized -> rank(normalized.job(), normalized.providers(),
                        normalized.topK(), normalized.weights())
                        .map(results -> MatchResponse.of(normalized.job().getId(), scoringStrategy.name(), results)));
    }

    /**
     * Score, rank and explain already-normalized providers.
     *
     * @param job       the job
     * @param providers candidate providers
     * @param topK      maximum number of results, must be positive
     * @param weights   weight profile for aggregation
     * @return Mono with at most {@code topK} results, best first
     */
    public Mono<List<MatchResult>> rank(JobRequirement job, List<Provider> providers, int topK, ScoringWeights weights) {
        if (topK <= 0) {
            return Mono.error(new IllegalArgumentException("top_k must be a positive integer, got " + topK));
        }
        long started = System.nanoTime();
        List<Provider> candidates = selectCandidates(job, providers);

        log.info("Matching job {} against {} candidates (strategy: {}, top_k: {})",
                job.getId(), candidates.size(), scoringStrategy.name(), topK);

        Flux<Tuple2<Long, MatchResult>> scored = Flux.fromIterable(candidates)
                .index()
                .flatMap(indexed -> Mono.fromCallable(() -> Tuples.of(indexed.getT1(),
                                scoreProvider(job, indexed.getT2(), weights)))
                        .subscribeOn(Schedulers.parallel()), Math.max(1, matchingConfig.getParallelism()));

        Duration batchTimeout = matchingConfig.getBatchTimeout();
        if (batchTimeout != null && !batchTimeout.isZero() && !batchTimeout.isNegative()) {
            scored = scored.take(batchTimeout);
        }

        // Input order is restored before ranking so full ties do not depend on thread timing
        return scored
                .collectSortedList((a, b) -> Long.compare(a.getT1(), b.getT1()))
                .map(indexed -> {
                    List<MatchResult> results = indexed.stream().map(Tuple2::getT2).toList();
                    if (results.size() < candidates.size()) {
                        log.warn("Batch timeout of {} reached for job {}: {} of {} providers scored",
                                batchTimeout, job.getId(), results.size(), candidates.size());
                    }

                    List<MatchResult> ranked = ranker.rank(results, topK).stream()
                            .map(result -> result.withExplanation(explainer.explain(result)))
                            .toList();

                    long elapsedMs = (System.nanoTime() - started) / 1_000_000;
                    metrics.recordProvidersScored(results.size());
                    metrics.recordMatchesReturned(ranked.size());
                    metrics.recordMatchLatency(scoringStrategy.name(), elapsedMs);
                    metrics.updateLastRunStats(candidates.size(), ranked.size());

                    log.info("Job {} matched: {} scored, {} returned in {} ms",
                            job.getId(), results.size(), ranked.size(), elapsedMs);
                    return ranked;
                });
    }

    private MatchResult scoreProvider(JobRequirement job, Provider provider, ScoringWeights weights) {
        return aggregator.aggregate(job, provider, scoringStrategy.score(job, provider), weights);
    }

    /**
     * Drop providers from other categories when category matching is required.
     */
    private List<Provider> selectCandidates(JobRequirement job, List<Provider> providers) {
        if (!matchingConfig.isRequireCategoryMatch()) {
            return providers;
        }
        List<Provider> sameCategory = providers.stream()
                .filter(provider -> job.getCategory().equals(provider.getCategory()))
                .toList();

        int excluded = providers.size() - sameCategory.size();
        if (excluded > 0) {
            log.debug("Excluded {} providers outside category '{}'", excluded, job.getCategory());
            metrics.recordProvidersExcluded(excluded);
        }
        return sameCategory;
    }
}
