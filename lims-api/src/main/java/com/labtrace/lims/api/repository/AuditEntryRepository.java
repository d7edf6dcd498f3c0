package com.labtrace.lims.api.repository;

import com.labtrace.lims.api.domain.AuditEntry;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.repository.Repository;

/**
 * Append-only access to the audit ledger: insert and read methods only.
 */
public interface AuditEntryRepository extends Repository<AuditEntry, UUID> {
    <S extends AuditEntry> S saveAndFlush(S entry);

    Optional<AuditEntry> findById(UUID id);

    Page<AuditEntry> findAll(Specification<AuditEntry> spec, Pageable pageable);

    long count();
}
