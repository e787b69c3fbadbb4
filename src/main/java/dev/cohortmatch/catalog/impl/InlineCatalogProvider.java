package dev.cohortmatch.catalog.impl;

import dev.cohortmatch.catalog.CatalogProvider;
import dev.cohortmatch.config.CatalogConfig;
import dev.cohortmatch.model.CatalogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Catalog declared in application.yml under 'catalog.facilities'.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "catalog.source", havingValue = "inline", matchIfMissing = true)
public class InlineCatalogProvider implements CatalogProvider {

    private final CatalogConfig catalogConfig;

    public InlineCatalogProvider(CatalogConfig catalogConfig) {
        this.catalogConfig = catalogConfig;
        log.info("Using inline facility catalog ({} entries)", catalogConfig.getFacilities().size());
    }

    @Override
    public String getName() {
        return "inline";
    }

    @Override
    public Flux<CatalogEntry> fetchEntries() {
        return Flux.defer(() -> Flux.fromIterable(catalogConfig.getFacilities()))
                .map(facility -> new CatalogEntry(facility.getName(), facility.getRange()));
    }
}
