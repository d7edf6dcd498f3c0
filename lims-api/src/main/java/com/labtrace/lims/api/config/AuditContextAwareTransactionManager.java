package com.labtrace.lims.api.config;

import com.labtrace.lims.api.service.audit.AuditContextHolder;
import com.labtrace.lims.api.service.audit.StorageContextPropagator;
import com.labtrace.lims.common.audit.AuditContext;
import jakarta.persistence.EntityManagerFactory;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.TransactionDefinition;

/**
 * JPA transaction manager that hands the request's audit context to the database session at the start of every
 * read-write transaction. The only place the thread-bound context is read.
 * <p>
 * Propagation failures are logged and the transaction goes on; audit writes still require an explicit context.
 */
public class AuditContextAwareTransactionManager extends JpaTransactionManager {

    private static final long serialVersionUID = 1L;

    private static final Logger log = LoggerFactory.getLogger(AuditContextAwareTransactionManager.class);

    private final transient StorageContextPropagator propagator;

    public AuditContextAwareTransactionManager(EntityManagerFactory entityManagerFactory, StorageContextPropagator propagator) {
        super(entityManagerFactory);
        this.propagator = propagator;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        super.doBegin(transaction, definition);
        propagateAuditContext(definition);
    }

    void propagateAuditContext(TransactionDefinition definition) {
        if (definition.isReadOnly()) {
            return;
        }
        Optional<AuditContext> context = AuditContextHolder.current().filter(AuditContext::isAttributable);
        if (context.isEmpty()) {
            return;
        }
        try {
            propagator.propagate(context.get());
        } catch (RuntimeException ex) {
            log.warn("[AUDIT_CONTEXT_PROPAGATION_FAIL] actor={} : {}", context.get().actorId(), ex.getMessage(), ex);
        }
    }
}
