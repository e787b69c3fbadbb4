package dev.cohortmatch.catalog.impl;

import dev.cohortmatch.catalog.CatalogProvider;
import dev.cohortmatch.catalog.CatalogUnavailableException;
import dev.cohortmatch.model.CatalogEntry;
import dev.cohortmatch.repository.FacilityRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * Catalog read from the {@code facilities} table.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "catalog.source", havingValue = "database")
public class DatabaseCatalogProvider implements CatalogProvider {

    private final FacilityRepository facilityRepository;

    public DatabaseCatalogProvider(FacilityRepository facilityRepository) {
        this.facilityRepository = facilityRepository;
        log.info("Using database facility catalog");
    }

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public Flux<CatalogEntry> fetchEntries() {
        return Flux.defer(() -> Flux.fromIterable(facilityRepository.findAllByOrderByIdAsc()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(row -> new CatalogEntry(row.getName(), row.getCohortRange()))
                .onErrorMap(DataAccessException.class,
                        e -> new CatalogUnavailableException(getName(), e.getMostSpecificCause().getMessage(), e));
    }
}
