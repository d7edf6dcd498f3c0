package com.labtrace.lims.api.service.audit;

import com.labtrace.lims.common.audit.AuditContext;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Savepoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * PostgreSQL implementation: transaction-local {@code lims.*} settings read by the capture triggers.
 * <p>
 * Runs under a savepoint so a failed {@code set_config} does not poison the surrounding transaction.
 */
public class JdbcStorageContextPropagator implements StorageContextPropagator {

    private static final Logger log = LoggerFactory.getLogger(JdbcStorageContextPropagator.class);

    static final String SET_CONTEXT_SQL =
        "select set_config('lims.actor_id', ?, true), set_config('lims.actor_email', ?, true), " +
        "set_config('lims.ip', ?, true), set_config('lims.user_agent', ?, true)";

    private final JdbcTemplate jdbcTemplate;

    public JdbcStorageContextPropagator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void propagate(AuditContext context) {
        jdbcTemplate.execute(
            (ConnectionCallback<Void>) connection -> {
                Savepoint savepoint = connection.getAutoCommit() ? null : connection.setSavepoint();
                try (PreparedStatement statement = connection.prepareStatement(SET_CONTEXT_SQL)) {
                    statement.setString(1, context.actorId());
                    statement.setString(2, context.actorEmail());
                    statement.setString(3, context.ip());
                    statement.setString(4, context.userAgent());
                    statement.execute();
                } catch (SQLException ex) {
                    if (savepoint != null) {
                        connection.rollback(savepoint);
                    }
                    throw ex;
                }
                if (savepoint != null) {
                    connection.releaseSavepoint(savepoint);
                }
                log.trace("Propagated audit context of actor {} to database session", context.actorId());
                return null;
            }
        );
    }
}
