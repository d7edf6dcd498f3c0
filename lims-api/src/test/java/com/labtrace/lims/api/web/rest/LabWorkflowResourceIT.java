package com.labtrace.lims.api.web.rest;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.labtrace.lims.api.IntegrationTest;
import com.labtrace.lims.api.LabFixtures;
import com.labtrace.lims.api.service.audit.AuditFieldMaps;
import com.labtrace.lims.common.security.AuthoritiesConstants;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@AutoConfigureMockMvc
@IntegrationTest
class LabWorkflowResourceIT {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private UUID sampleId;

    @BeforeEach
    void setUp() {
        sampleId = LabFixtures.insertSample(jdbcTemplate, transactionManager);
    }

    private static JwtRequestPostProcessor labManager() {
        return jwt().jwt(token ->
            token.subject("manager-42").claim("email", "manager42@lab.test").claim("roles", List.of("LAB_MANAGER"))
        );
    }

    private UUID insertCompletedAssignment() {
        UUID sectionId = UUID.randomUUID();
        UUID methodId = UUID.randomUUID();
        UUID assignmentId = UUID.randomUUID();
        String suffix = assignmentId.toString().substring(0, 8);
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            jdbcTemplate.update("INSERT INTO section (id, code, name, created_by) VALUES (?, ?, 'Chemistry', 'it')", sectionId, "CHEM-" + suffix);
            jdbcTemplate.update("INSERT INTO test_method (id, code, name, created_by) VALUES (?, ?, 'USP 791', 'it')", methodId, "M-" + suffix);
            jdbcTemplate.update(
                "INSERT INTO test_assignment (id, sample_id, section_id, method_id, custom_test_name, status, result, created_by) " +
                "VALUES (?, ?, ?, ?, 'pH', 'COMPLETED', '7.1', 'it')",
                assignmentId,
                sampleId,
                sectionId,
                methodId
            );
        });
        return assignmentId;
    }

    @Test
    void sampleEditIsAttributedToTokenSubjectInLedger() throws Exception {
        mockMvc
            .perform(
                patch("/api/samples/{id}", sampleId)
                    .with(labManager())
                    .with(csrf())
                    .header(HttpHeaders.USER_AGENT, "LabBrowser/1.0")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"comments\": \"Chilled on receipt\"}")
            )
            .andExpect(status().isOk());

        mockMvc
            .perform(
                get("/api/audit").param("subjectType", AuditFieldMaps.SAMPLE).param("subjectId", sampleId.toString()).with(labManager())
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalElements").value(1))
            .andExpect(jsonPath("$.data.content[0].actorId").value("manager-42"))
            .andExpect(jsonPath("$.data.content[0].actorEmail").value("manager42@lab.test"))
            .andExpect(jsonPath("$.data.content[0].userAgent").value("LabBrowser/1.0"))
            .andExpect(jsonPath("$.data.content[0].changes.comments.new").value("Chilled on receipt"));
    }

    @Test
    void checkerSignOffStampsAssignmentAndIsAudited() throws Exception {
        UUID assignmentId = insertCompletedAssignment();

        mockMvc
            .perform(put("/api/test-assignments/{id}/review", assignmentId).with(labManager()).with(csrf()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("REVIEWED"))
            .andExpect(jsonPath("$.data.checkedBy").value("manager42@lab.test"))
            .andExpect(jsonPath("$.data.checkedDate").isNotEmpty());

        mockMvc
            .perform(
                get("/api/audit")
                    .param("subjectType", AuditFieldMaps.TEST_ASSIGNMENT)
                    .param("subjectId", assignmentId.toString())
                    .with(labManager())
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.totalElements").value(1))
            .andExpect(jsonPath("$.data.content[0].action").value("UPDATE"))
            .andExpect(jsonPath("$.data.content[0].changes.status.new").value("REVIEWED"))
            .andExpect(jsonPath("$.data.content[0].changes.checkedBy.new").value("manager42@lab.test"));

        mockMvc
            .perform(put("/api/test-assignments/{id}/review", assignmentId).with(labManager()).with(csrf()))
            .andExpect(status().isBadRequest());
        mockMvc
            .perform(put("/api/test-assignments/{id}/release", assignmentId).with(labManager()).with(csrf()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("RELEASED"));
    }

    @Test
    @WithMockUser(authorities = { AuthoritiesConstants.ADMIN })
    void mutationWithoutAttributableIdentityIsRejected() throws Exception {
        mockMvc
            .perform(
                patch("/api/samples/{id}", sampleId).with(csrf()).contentType(MediaType.APPLICATION_JSON).content("{\"urgent\": true}")
            )
            .andExpect(status().isUnauthorized());
    }

    @Test
    @WithMockUser(authorities = { AuthoritiesConstants.ANALYST })
    void ledgerIsHiddenFromAnalysts() throws Exception {
        mockMvc.perform(get("/api/audit")).andExpect(status().isForbidden());
    }

    @Test
    void anonymousLedgerReadIsUnauthorized() throws Exception {
        mockMvc.perform(get("/api/audit")).andExpect(status().isUnauthorized());
    }
}
