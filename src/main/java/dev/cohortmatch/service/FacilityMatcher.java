package dev.cohortmatch.service;

import dev.cohortmatch.model.Facility;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Selects the facilities whose half-open range contains a cohort.
 * No match yields an empty list; there is no placeholder entry.
 */
@Slf4j
@Service
public class FacilityMatcher {

    /**
     * Names of all facilities eligible for the cohort, in catalog order.
     *
     * @param cohort  computed cohort
     * @param catalog canonical catalog, may be null or empty
     * @return matching names, empty when nothing matches
     */
    public List<String> match(int cohort, List<Facility> catalog) {
        if (catalog == null || catalog.isEmpty()) {
            return List.of();
        }

        List<String> matches = catalog.stream()
                .filter(facility -> facility.contains(cohort))
                .map(Facility::name)
                .toList();

        log.debug("Cohort {} matched {} of {} facilities", cohort, matches.size(), catalog.size());
        return matches;
    }
}
