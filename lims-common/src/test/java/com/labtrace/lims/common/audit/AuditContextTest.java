package com.labtrace.lims.common.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AuditContextTest {

    @Test
    void missingProvenanceFallsBackToSentinels() {
        AuditContext context = AuditContext.of("user-1", "analyst@lab.test", " ", null);

        assertThat(context.ip()).isEqualTo(AuditContext.UNKNOWN_IP);
        assertThat(context.userAgent()).isEqualTo(AuditContext.UNKNOWN_AGENT);
        assertThat(context.isAttributable()).isTrue();
    }

    @Test
    void contextWithoutEmailIsNotAttributable() {
        AuditContext context = AuditContext.of("user-1", "  ", "10.0.0.1", "curl");

        assertThat(context.isAttributable()).isFalse();
        assertThatThrownBy(context::requireAttributable).isInstanceOf(AuditContextMissingException.class);
    }

    @Test
    void transactionTagIsCopiedIntoNewContext() {
        AuditContext context = AuditContext.of("user-1", "analyst@lab.test", "10.0.0.1", "curl");

        AuditContext tagged = context.withTransactionTag("tx-1");

        assertThat(tagged.transactionTag()).isEqualTo("tx-1");
        assertThat(context.transactionTag()).isNull();
        assertThat(tagged.actorId()).isEqualTo("user-1");
    }
}
