package dev.cohortmatch.model;

/**
 * Catalog facility eligible for cohorts in {@code [lowInclusive, highExclusive)}.
 */
public record Facility(String name, int lowInclusive, int highExclusive) {

    public Facility {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Facility name must not be blank");
        }
        if (lowInclusive > highExclusive) {
            throw new IllegalArgumentException(
                    "Facility '" + name + "' has inverted range " + lowInclusive + "-" + highExclusive);
        }
    }

    public boolean contains(int cohort) {
        return lowInclusive <= cohort && cohort < highExclusive;
    }
}
