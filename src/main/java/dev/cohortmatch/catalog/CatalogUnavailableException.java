package dev.cohortmatch.catalog;

import lombok.Getter;

/**
 * The facility catalog could not be obtained at all. Never retried by the core.
 */
@Getter
public class CatalogUnavailableException extends RuntimeException {

    private final String source;

    public CatalogUnavailableException(String source, String message, Throwable cause) {
        super("Catalog source '" + source + "' unavailable: " + message, cause);
        this.source = source;
    }

    public CatalogUnavailableException(String source, String message) {
        this(source, message, null);
    }
}
