package com.labtrace.lims.common.security.policy;

import static org.assertj.core.api.Assertions.assertThat;

import com.labtrace.lims.common.security.AuthoritiesConstants;
import java.util.List;
import org.junit.jupiter.api.Test;

class RoleMatrixAccessPolicyTest {

    private final RoleMatrixAccessPolicy policy = new RoleMatrixAccessPolicy();

    @Test
    void adminMayDoEverything() {
        for (LabResource resource : LabResource.values()) {
            for (LabAction action : LabAction.values()) {
                assertThat(policy.authorize(List.of(AuthoritiesConstants.ADMIN), action, resource).allowed()).isTrue();
            }
        }
    }

    @Test
    void labManagerExportsAndApprovesReports() {
        List<String> authorities = List.of(AuthoritiesConstants.LAB_MANAGER);

        assertThat(policy.authorize(authorities, LabAction.EXPORT, LabResource.REPORT).allowed()).isTrue();
        assertThat(policy.authorize(authorities, LabAction.APPROVE, LabResource.REPORT).allowed()).isTrue();
        assertThat(policy.authorize(authorities, LabAction.READ, LabResource.AUDIT_LOG).allowed()).isTrue();
    }

    @Test
    void analystCannotFinalizeReports() {
        AccessDecision decision = policy.authorize(List.of(AuthoritiesConstants.ANALYST), LabAction.FINALIZE, LabResource.REPORT);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).contains("FINALIZE").contains("REPORT");
    }

    @Test
    void anyGrantedRoleIsEnough() {
        List<String> authorities = List.of(AuthoritiesConstants.SALES_ACCOUNTING, AuthoritiesConstants.ANALYST);

        assertThat(policy.authorize(authorities, LabAction.EDIT_RESULTS, LabResource.TEST_ASSIGNMENT).allowed()).isTrue();
    }

    @Test
    void callerWithoutLabRoleIsDenied() {
        AccessDecision decision = policy.authorize(List.of("SCOPE_openid"), LabAction.READ, LabResource.SAMPLE);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("No laboratory role granted");
    }

    @Test
    void clientCannotReadAuditLog() {
        assertThat(policy.authorize(List.of(AuthoritiesConstants.CLIENT), LabAction.READ, LabResource.AUDIT_LOG).allowed()).isFalse();
    }
}
