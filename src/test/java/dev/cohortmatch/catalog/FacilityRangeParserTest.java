package dev.cohortmatch.catalog;

import dev.cohortmatch.model.CatalogEntry;
import dev.cohortmatch.model.Facility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FacilityRangeParserTest {

    private FacilityRangeParser parser;

    @BeforeEach
    void setUp() {
        parser = new FacilityRangeParser();
    }

    @Nested
    @DisplayName("Valid ranges")
    class ValidRangeTests {

        @ParameterizedTest(name = "''{0}'' -> [{1}, {2})")
        @CsvSource(delimiter = '|', value = {
                "10-30|10|30",
                " 20 - 50 |20|50",
                "-10-5|-10|5",
                "-20--5|-20|-5",
                "7-7|7|7"
        })
        void shouldParseRange(String range, int low, int high) {
            Facility facility = parser.parse(new CatalogEntry("Gym", range));

            assertThat(facility.lowInclusive()).isEqualTo(low);
            assertThat(facility.highExclusive()).isEqualTo(high);
        }

        @Test
        @DisplayName("Should trim the facility name")
        void shouldTrimName() {
            Facility facility = parser.parse(new CatalogEntry("  Gym ", "10-30"));

            assertThat(facility.name()).isEqualTo("Gym");
        }
    }

    @Nested
    @DisplayName("Malformed ranges")
    class MalformedRangeTests {

        @ParameterizedTest(name = "''{0}'' is rejected")
        @ValueSource(strings = {"1030", "10:30", "ten-thirty", "10-", "-30", "10-30-50", "10.5-30", "99999999999-1"})
        void shouldRejectMalformedRange(String range) {
            assertThatThrownBy(() -> parser.parse(new CatalogEntry("Gym", range)))
                    .isInstanceOf(CatalogEntryException.class)
                    .satisfies(e -> {
                        CatalogEntryException ex = (CatalogEntryException) e;
                        assertThat(ex.getEntryName()).isEqualTo("Gym");
                        assertThat(ex.getCohortRange()).isEqualTo(range);
                    });
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   "})
        void shouldRejectMissingRange(String range) {
            assertThatThrownBy(() -> parser.parse(new CatalogEntry("Gym", range)))
                    .isInstanceOf(CatalogEntryException.class)
                    .hasMessageContaining("missing range");
        }

        @Test
        @DisplayName("Should reject an inverted range")
        void shouldRejectInvertedRange() {
            assertThatThrownBy(() -> parser.parse(new CatalogEntry("Gym", "60-30")))
                    .isInstanceOf(CatalogEntryException.class)
                    .hasMessageContaining("lower bound exceeds upper bound");
        }

        @Test
        @DisplayName("Should reject a blank name")
        void shouldRejectBlankName() {
            assertThatThrownBy(() -> parser.parse(new CatalogEntry(" ", "10-30")))
                    .isInstanceOf(CatalogEntryException.class)
                    .hasMessageContaining("blank facility name");
        }
    }
}
