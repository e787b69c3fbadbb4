package dev.cohortmatch.service;

import dev.cohortmatch.model.Facility;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FacilityMatcherTest {

    private FacilityMatcher matcher;

    private final List<Facility> twoRanges = List.of(
            new Facility("A", 10, 30),
            new Facility("B", 30, 60));

    @BeforeEach
    void setUp() {
        matcher = new FacilityMatcher();
    }

    @Nested
    @DisplayName("Half-open ranges")
    class HalfOpenTests {

        @Test
        @DisplayName("Should match the range containing the cohort")
        void shouldMatchContainingRange() {
            assertThat(matcher.match(25, twoRanges)).containsExactly("A");
        }

        @Test
        @DisplayName("Should match only the range starting at a shared boundary")
        void shouldTreatUpperBoundAsExclusive() {
            assertThat(matcher.match(30, twoRanges)).containsExactly("B");
        }

        @Test
        @DisplayName("Should include the lower bound")
        void shouldIncludeLowerBound() {
            assertThat(matcher.match(10, twoRanges)).containsExactly("A");
        }

        @ParameterizedTest(name = "cohort {0} matches nothing")
        @ValueSource(ints = {9, 60, 61, -5, Integer.MIN_VALUE, Integer.MAX_VALUE})
        void shouldReturnEmptyListOutsideAllRanges(int cohort) {
            assertThat(matcher.match(cohort, twoRanges)).isEmpty();
        }

        @Test
        @DisplayName("Should never match an empty range")
        void shouldNotMatchEmptyRange() {
            assertThat(matcher.match(5, List.of(new Facility("Closed", 5, 5)))).isEmpty();
        }

        @Test
        @DisplayName("Should match ranges with negative bounds")
        void shouldMatchNegativeRanges() {
            List<Facility> catalog = List.of(new Facility("Rehab", -20, 10));

            assertThat(matcher.match(-9, catalog)).containsExactly("Rehab");
        }
    }

    @Nested
    @DisplayName("Catalog handling")
    class CatalogTests {

        @Test
        @DisplayName("Should return empty list for empty catalog")
        void shouldReturnEmptyForEmptyCatalog() {
            assertThat(matcher.match(25, List.of())).isEmpty();
        }

        @Test
        @DisplayName("Should return empty list for null catalog")
        void shouldReturnEmptyForNullCatalog() {
            assertThat(matcher.match(25, null)).isEmpty();
        }

        @Test
        @DisplayName("Should preserve catalog order among matches")
        void shouldPreserveCatalogOrder() {
            List<Facility> catalog = List.of(
                    new Facility("Zeta stadium", 0, 100),
                    new Facility("Gym", 30, 60),
                    new Facility("Alpha pool", 20, 50),
                    new Facility("Track", 40, 70));

            assertThat(matcher.match(45, catalog))
                    .containsExactly("Zeta stadium", "Gym", "Alpha pool", "Track");
        }

        @Test
        @DisplayName("Should match the original default catalog")
        void shouldMatchDefaultCatalog() {
            List<Facility> catalog = List.of(
                    new Facility("Фитнес-центр", 20, 50),
                    new Facility("Открытый стадион", 10, 40),
                    new Facility("Тренажерный зал", 30, 60),
                    new Facility("Стадион для соревновательной подготовки", 40, 70));

            assertThat(matcher.match(33, catalog))
                    .containsExactly("Фитнес-центр", "Открытый стадион", "Тренажерный зал");
            assertThat(matcher.match(64, catalog))
                    .containsExactly("Стадион для соревновательной подготовки");
        }
    }
}
