package com.labtrace.lims.api.repository;

import com.labtrace.lims.api.domain.LabSettings;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LabSettingsRepository extends JpaRepository<LabSettings, UUID> {
    Optional<LabSettings> findFirstByOrderByCreatedDateAsc();
}
