package com.labtrace.lims.api.repository;

import com.labtrace.lims.api.domain.Sample;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SampleRepository extends JpaRepository<Sample, UUID> {
    /**
     * Sample with everything a certificate shows: client, job and each test with its catalogue references.
     */
    @EntityGraph(
        attributePaths = {
            "client",
            "job",
            "testAssignments",
            "testAssignments.section",
            "testAssignments.method",
            "testAssignments.specification",
            "testAssignments.testDefinition",
        }
    )
    Optional<Sample> findWithReportDataById(UUID id);

    /**
     * Row lock that serializes version allocation per sample.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Sample s where s.id = :id")
    Optional<Sample> findByIdForUpdate(@Param("id") UUID id);
}
