package dev.cohortmatch.repository;

import dev.cohortmatch.entity.FacilityRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Read access to the facility catalog table.
 */
@Repository
public interface FacilityRepository extends JpaRepository<FacilityRecord, Long> {

    /**
     * All facilities in insertion order.
     */
    List<FacilityRecord> findAllByOrderByIdAsc();
}
