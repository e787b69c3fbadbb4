package dev.cohortmatch.catalog;

import dev.cohortmatch.model.CatalogEntry;
import dev.cohortmatch.model.Facility;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses textual cohort ranges such as {@code "10-30"} into {@link Facility} values.
 * Bounds may be negative ({@code "-10-5"}, {@code "-20--5"}); the upper bound is exclusive.
 */
@Component
public class FacilityRangeParser {

    private static final Pattern RANGE = Pattern.compile("^\\s*(-?\\d+)\\s*-\\s*(-?\\d+)\\s*$");

    /**
     * Convert a raw entry into its canonical form.
     *
     * @throws CatalogEntryException if the name is blank or the range is malformed or inverted
     */
    public Facility parse(CatalogEntry entry) {
        String name = entry.name();
        String range = entry.cohortRange();

        if (name == null || name.isBlank()) {
            throw new CatalogEntryException(name, range, "blank facility name");
        }
        if (range == null || range.isBlank()) {
            throw new CatalogEntryException(name, range, "missing range");
        }

        Matcher matcher = RANGE.matcher(range);
        if (!matcher.matches()) {
            throw new CatalogEntryException(name, range, "expected '<low>-<high>'");
        }

        int low = parseBound(name, range, matcher.group(1));
        int high = parseBound(name, range, matcher.group(2));
        if (low > high) {
            throw new CatalogEntryException(name, range, "lower bound exceeds upper bound");
        }
        return new Facility(name.trim(), low, high);
    }

    private int parseBound(String name, String range, String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new CatalogEntryException(name, range, "bound out of range: " + digits, e);
        }
    }
}
