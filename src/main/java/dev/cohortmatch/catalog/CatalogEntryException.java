package dev.cohortmatch.catalog;

import lombok.Getter;

/**
 * A single catalog entry whose eligibility range cannot be used.
 * Recovered by {@link CatalogLoader}: the entry is dropped and the rest of the catalog is kept.
 */
@Getter
public class CatalogEntryException extends RuntimeException {

    private final String entryName;
    private final String cohortRange;

    public CatalogEntryException(String entryName, String cohortRange, String reason) {
        super("Catalog entry '" + entryName + "' has unusable range '" + cohortRange + "': " + reason);
        this.entryName = entryName;
        this.cohortRange = cohortRange;
    }

    public CatalogEntryException(String entryName, String cohortRange, String reason, Throwable cause) {
        this(entryName, cohortRange, reason);
        initCause(cause);
    }
}
