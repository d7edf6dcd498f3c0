package com.labtrace.lims.api;

import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Minimal client, job and sample rows for integration tests. Codes are random so runs never collide on the shared
 * database, where audit entries and report versions cannot be deleted. The pool runs without auto-commit, so rows are
 * written in their own transaction.
 */
public final class LabFixtures {

    private LabFixtures() {}

    public static UUID insertSample(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager).execute(status -> insertSample(jdbcTemplate));
    }

    private static UUID insertSample(JdbcTemplate jdbcTemplate) {
        UUID clientId = UUID.randomUUID();
        UUID jobId = UUID.randomUUID();
        UUID sampleId = UUID.randomUUID();
        String suffix = sampleId.toString().substring(0, 8);
        jdbcTemplate.update("INSERT INTO client (id, name, created_by) VALUES (?, ?, 'it')", clientId, "Acme Pharma " + suffix);
        jdbcTemplate.update("INSERT INTO job (id, job_number, client_id, created_by) VALUES (?, ?, ?, 'it')", jobId, "J-" + suffix, clientId);
        jdbcTemplate.update(
            "INSERT INTO sample (id, sample_code, job_id, client_id, sample_description, created_by) VALUES (?, ?, ?, ?, 'Raw material', 'it')",
            sampleId,
            "S-" + suffix,
            jobId,
            clientId
        );
        return sampleId;
    }
}
