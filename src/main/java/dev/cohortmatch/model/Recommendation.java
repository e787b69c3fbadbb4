package dev.cohortmatch.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Computed cohort and the names of the facilities whose range contains it,
 * in catalog order. An empty list means nothing matched.
 */
public record Recommendation(
        @JsonProperty("cohort") int cohort,
        @JsonProperty("recommended_facilities") List<String> recommendedFacilities) {

    public Recommendation {
        recommendedFacilities = recommendedFacilities == null ? List.of() : List.copyOf(recommendedFacilities);
    }

    public boolean hasMatches() {
        return !recommendedFacilities.isEmpty();
    }
}
