package dev.cohortmatch.catalog;

import dev.cohortmatch.model.CatalogEntry;
import dev.cohortmatch.model.Facility;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw catalog entries into canonical facilities.
 * Entries that fail to parse are skipped and reported instead of failing the whole catalog.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogLoader {

    private final FacilityRangeParser rangeParser;

    /**
     * Entry dropped from the catalog.
     */
    public record RejectedEntry(String name, String cohortRange, String reason) {
    }

    /**
     * Parsed catalog plus the entries that were dropped from it.
     */
    public record LoadedCatalog(List<Facility> facilities, List<RejectedEntry> rejected) {

        public LoadedCatalog {
            facilities = List.copyOf(facilities);
            rejected = List.copyOf(rejected);
        }

        public boolean hasRejections() {
            return !rejected.isEmpty();
        }
    }

    /**
     * Parse every entry, preserving input order.
     *
     * @param entries raw entries, may be null or empty
     * @return the usable facilities and the rejected entries
     */
    public LoadedCatalog load(List<CatalogEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return new LoadedCatalog(List.of(), List.of());
        }

        List<Facility> facilities = new ArrayList<>(entries.size());
        List<RejectedEntry> rejected = new ArrayList<>();

        for (CatalogEntry entry : entries) {
            if (entry == null) {
                log.warn("Skipping catalog entry: null entry");
                rejected.add(new RejectedEntry(null, null, "null entry"));
                continue;
            }
            try {
                facilities.add(rangeParser.parse(entry));
            } catch (CatalogEntryException e) {
                log.warn("Skipping catalog entry: {}", e.getMessage());
                rejected.add(new RejectedEntry(entry.name(), entry.cohortRange(), e.getMessage()));
            }
        }

        log.debug("Catalog loaded: {} facilities, {} rejected", facilities.size(), rejected.size());
        return new LoadedCatalog(facilities, rejected);
    }
}
