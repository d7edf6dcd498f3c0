package com.labtrace.lims.api.management.health;

import com.labtrace.lims.api.repository.AuditEntryRepository;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class AuditLedgerHealthIndicator implements HealthIndicator {

    private final AuditEntryRepository repository;

    public AuditLedgerHealthIndicator(AuditEntryRepository repository) {
        this.repository = repository;
    }

    @Override
    public Health health() {
        try {
            long entries = repository.count();
            return Health.up().withDetail("auditLedger", "reachable").withDetail("entries", entries).build();
        } catch (RuntimeException e) {
            return Health.down(e).withDetail("auditLedger", "unreachable").build();
        }
    }
}
