package dev.cohortmatch.catalog;

import dev.cohortmatch.model.CatalogEntry;
import reactor.core.publisher.Flux;

/**
 * Supplies the raw facility catalog.
 * Exactly one implementation is active, chosen by {@code catalog.source}.
 */
public interface CatalogProvider {

    /**
     * Name of this source (e.g. "inline", "database").
     */
    String getName();

    /**
     * Fetch the catalog entries in catalog order.
     * Fails with {@link CatalogUnavailableException} when the catalog cannot be read.
     */
    Flux<CatalogEntry> fetchEntries();
}
