package com.labtrace.lims.api.repository;

import com.labtrace.lims.api.domain.ReportVersion;
import com.labtrace.lims.api.domain.enumeration.ReportStatus;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ReportVersionRepository extends JpaRepository<ReportVersion, UUID> {
    @Query("select coalesce(max(r.version), 0) from ReportVersion r where r.sampleId = :sampleId")
    int findMaxVersion(@Param("sampleId") UUID sampleId);

    List<ReportVersion> findBySampleIdOrderByVersionDesc(UUID sampleId);

    Optional<ReportVersion> findFirstBySampleIdOrderByVersionDesc(UUID sampleId);

    List<ReportVersion> findBySampleIdAndStatus(UUID sampleId, ReportStatus status);
}
