package dev.jobmatcher.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for matching runs.
 */
@Component
public class MatchingMetrics {

    private static final String TAG_STRATEGY = "strategy";
    private final MeterRegistry registry;

    // Counters
    private final Counter requestsCounter;
    private final Counter requestsRejectedCounter;
    private final Counter providersScoredCounter;
    private final Counter providersExcludedCounter;
    private final Counter matchesReturnedCounter;

    // Gauges
    private final AtomicInteger lastRunCandidates = new AtomicInteger(0);
    private final AtomicInteger lastRunMatches = new AtomicInteger(0);

    public MatchingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.requestsCounter = Counter.builder("job_matcher_requests_total")
                .description("Total match requests received")
                .register(registry);

        this.requestsRejectedCounter = Counter.builder("job_matcher_requests_rejected_total")
                .description("Total match requests rejected by validation")
                .register(registry);

        this.providersScoredCounter = Counter.builder("job_matcher_providers_scored_total")
                .description("Total providers scored against a job")
                .register(registry);

        this.providersExcludedCounter = Counter.builder("job_matcher_providers_excluded_total")
                .description("Total providers excluded before scoring (category mismatch)")
                .register(registry);

        this.matchesReturnedCounter = Counter.builder("job_matcher_matches_returned_total")
                .description("Total ranked matches returned to callers")
                .register(registry);

        Gauge.builder("job_matcher_last_run_candidates", lastRunCandidates, AtomicInteger::get)
                .description("Candidates considered in last run")
                .register(registry);

        Gauge.builder("job_matcher_last_run_matches", lastRunMatches, AtomicInteger::get)
                .description("Matches returned in last run")
                .register(registry);
    }

    public void recordRequest() {
        requestsCounter.increment();
    }

    public void recordRejected() {
        requestsRejectedCounter.increment();
    }

    public void recordProvidersScored(int count) {
        providersScoredCounter.increment(count);
    }

    public void recordProvidersExcluded(int count) {
        providersExcludedCounter.increment(count);
    }

    public void recordMatchesReturned(int count) {
        matchesReturnedCounter.increment(count);
    }

    /**
     * Record how long one matching run took for the given strategy.
     */
    public void recordMatchLatency(String strategy, long latencyMs) {
        Timer.builder("job_matcher_match_duration")
                .description("Time to score and rank all providers for one job")
                .tag(TAG_STRATEGY, strategy)
                .register(registry)
                .record(Duration.ofMillis(latencyMs));
    }

    public void updateLastRunStats(int candidates, int matches) {
        lastRunCandidates.set(candidates);
        lastRunMatches.set(matches);
    }
}
