package com.labtrace.lims.api.repository;

import com.labtrace.lims.api.domain.TestPack;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TestPackRepository extends JpaRepository<TestPack, UUID> {
    @EntityGraph(attributePaths = { "definitions", "definitions.section", "definitions.method", "definitions.specification" })
    Optional<TestPack> findWithDefinitionsById(UUID id);
}
