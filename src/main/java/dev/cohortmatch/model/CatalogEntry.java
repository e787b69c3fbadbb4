package dev.cohortmatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Catalog row as a provider delivers it, before the range text is parsed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogEntry(
        @JsonProperty("name") String name,
        @JsonProperty("cohort_range") String cohortRange) {
}
