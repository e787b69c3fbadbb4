package dev.cohortmatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for recommendation runs.
 */
@Component
public class RecommendationMetrics {

    private static final String TAG_SOURCE = "source";
    private final MeterRegistry registry;

    // Counters
    private final Counter recommendationsCounter;
    private final Counter facilitiesMatchedCounter;
    private final Counter emptyRecommendationsCounter;
    private final Counter entriesRejectedCounter;
    private final Counter catalogUnavailableCounter;

    // Timers (per source)
    private final ConcurrentHashMap<String, Timer> fetchTimers = new ConcurrentHashMap<>();

    // Gauges
    private final AtomicInteger lastCohort = new AtomicInteger(0);
    private final AtomicInteger lastCatalogSize = new AtomicInteger(0);

    public RecommendationMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.recommendationsCounter = Counter.builder("cohort_matcher_recommendations_total")
                .description("Total recommendations produced")
                .register(registry);

        this.facilitiesMatchedCounter = Counter.builder("cohort_matcher_facilities_matched_total")
                .description("Total facilities recommended across all requests")
                .register(registry);

        this.emptyRecommendationsCounter = Counter.builder("cohort_matcher_empty_recommendations_total")
                .description("Recommendations where no facility matched the cohort")
                .register(registry);

        this.entriesRejectedCounter = Counter.builder("cohort_matcher_catalog_entries_rejected_total")
                .description("Catalog entries skipped because their range could not be parsed")
                .register(registry);

        this.catalogUnavailableCounter = Counter.builder("cohort_matcher_catalog_unavailable_total")
                .description("Requests that failed because the catalog could not be obtained")
                .register(registry);

        Gauge.builder("cohort_matcher_last_cohort", lastCohort, AtomicInteger::get)
                .description("Cohort computed by the last request")
                .register(registry);

        Gauge.builder("cohort_matcher_last_catalog_size", lastCatalogSize, AtomicInteger::get)
                .description("Usable facilities in the last loaded catalog")
                .register(registry);
    }

    /**
     * Get or create the fetch timer for a catalog source.
     */
    public Timer getFetchTimer(String source) {
        return fetchTimers.computeIfAbsent(source, name ->
                Timer.builder("cohort_matcher_catalog_fetch_duration")
                        .description("Time to fetch the catalog from a source")
                        .tag(TAG_SOURCE, name)
                        .register(registry)
        );
    }

    /**
     * Record a produced recommendation.
     */
    public void recordRecommendation(int cohort, int matched) {
        recommendationsCounter.increment();
        facilitiesMatchedCounter.increment(matched);
        if (matched == 0) {
            emptyRecommendationsCounter.increment();
        }
        lastCohort.set(cohort);
    }

    /**
     * Record the outcome of loading a catalog.
     */
    public void recordCatalogLoaded(int usable, int rejected) {
        lastCatalogSize.set(usable);
        if (rejected > 0) {
            entriesRejectedCounter.increment(rejected);
        }
    }

    /**
     * Record that a catalog source could not be read.
     */
    public void recordCatalogUnavailable(String source) {
        catalogUnavailableCounter.increment();
        Counter.builder("cohort_matcher_catalog_unavailable_by_source_total")
                .tag(TAG_SOURCE, source)
                .register(registry)
                .increment();
    }

    /**
     * Record fetch latency for a catalog source.
     */
    public void recordFetchLatency(String source, long latencyMs) {
        getFetchTimer(source).record(Duration.ofMillis(latencyMs));
    }
}
