package dev.cohortmatch.service;

import dev.cohortmatch.catalog.CatalogLoader;
import dev.cohortmatch.catalog.CatalogLoader.LoadedCatalog;
import dev.cohortmatch.catalog.CatalogProvider;
import dev.cohortmatch.catalog.CatalogUnavailableException;
import dev.cohortmatch.metrics.RecommendationMetrics;
import dev.cohortmatch.model.Facility;
import dev.cohortmatch.model.Recommendation;
import dev.cohortmatch.model.UserInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Scores a profile and filters the active catalog by the resulting cohort.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private final CatalogProvider catalogProvider;
    private final CatalogLoader catalogLoader;
    private final CohortScorer cohortScorer;
    private final FacilityMatcher facilityMatcher;
    private final RecommendationMetrics metrics;

    /**
     * Fetch the catalog from the active provider and recommend facilities for the profile.
     * Fails with {@link CatalogUnavailableException} when the catalog cannot be fetched.
     *
     * @param user validated profile
     * @return the recommendation
     */
    public Mono<Recommendation> recommend(UserInput user) {
        return loadCatalog()
                .map(catalog -> recommend(user, catalog.facilities()));
    }

    /**
     * Recommend facilities from an already loaded catalog.
     *
     * @param user    profile to score
     * @param catalog canonical catalog
     * @return the recommendation, with an empty list when nothing matches
     */
    public Recommendation recommend(UserInput user, List<Facility> catalog) {
        int cohort = cohortScorer.score(user);
        List<String> facilities = facilityMatcher.match(cohort, catalog);

        metrics.recordRecommendation(cohort, facilities.size());
        log.info("Cohort {}: {} of {} facilities recommended",
                cohort, facilities.size(), catalog == null ? 0 : catalog.size());
        return new Recommendation(cohort, facilities);
    }

    /**
     * Fetch and parse the catalog, dropping unusable entries.
     */
    public Mono<LoadedCatalog> loadCatalog() {
        String source = catalogProvider.getName();

        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return catalogProvider.fetchEntries()
                    .collectList()
                    .doOnTerminate(() -> metrics.recordFetchLatency(source, System.currentTimeMillis() - start));
        })
                .onErrorMap(e -> !(e instanceof CatalogUnavailableException),
                        e -> new CatalogUnavailableException(source, String.valueOf(e.getMessage()), e))
                .doOnError(CatalogUnavailableException.class, e -> {
                    log.error("Catalog unavailable: {}", e.getMessage());
                    metrics.recordCatalogUnavailable(source);
                })
                .map(entries -> {
                    LoadedCatalog catalog = catalogLoader.load(entries);
                    metrics.recordCatalogLoaded(catalog.facilities().size(), catalog.rejected().size());
                    if (catalog.hasRejections()) {
                        log.warn("Catalog from {}: {} entries skipped", source, catalog.rejected().size());
                    }
                    return catalog;
                });
    }
}
