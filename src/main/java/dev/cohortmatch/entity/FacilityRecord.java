package dev.cohortmatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row of the {@code facilities} table.
 * The range is stored as text, e.g. "10-30", and parsed when the catalog is loaded.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "facilities", indexes = {
        @Index(name = "idx_facility_name", columnList = "name")
})
public class FacilityRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(name = "cohort_range", nullable = false)
    private String cohortRange;
}
