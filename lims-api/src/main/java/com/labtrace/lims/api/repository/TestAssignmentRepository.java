package com.labtrace.lims.api.repository;

import com.labtrace.lims.api.domain.TestAssignment;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TestAssignmentRepository extends JpaRepository<TestAssignment, UUID> {}
