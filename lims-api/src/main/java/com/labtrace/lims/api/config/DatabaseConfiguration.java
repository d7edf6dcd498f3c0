package com.labtrace.lims.api.config;

import com.labtrace.lims.api.service.audit.JdbcStorageContextPropagator;
import com.labtrace.lims.api.service.audit.NoopStorageContextPropagator;
import com.labtrace.lims.api.service.audit.StorageContextPropagator;
import jakarta.persistence.EntityManagerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@Configuration
@EnableJpaRepositories({ "com.labtrace.lims.api.repository" })
@EnableJpaAuditing(auditorAwareRef = "springSecurityAuditorAware")
@EnableTransactionManagement
public class DatabaseConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfiguration.class);

    @Bean
    public StorageContextPropagator storageContextPropagator(AuditProperties auditProperties, JdbcTemplate jdbcTemplate) {
        if (auditProperties.getCapture().isEnabled()) {
            log.info("Database capture triggers enabled: audit context is propagated to each read-write transaction");
            return new JdbcStorageContextPropagator(jdbcTemplate);
        }
        log.debug("Database capture triggers disabled");
        return new NoopStorageContextPropagator();
    }

    @Bean
    public PlatformTransactionManager transactionManager(EntityManagerFactory entityManagerFactory, StorageContextPropagator propagator) {
        return new AuditContextAwareTransactionManager(entityManagerFactory, propagator);
    }
}
