package com.labtrace.lims.api.web.rest;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.labtrace.lims.api.domain.enumeration.TestAssignmentStatus;
import com.labtrace.lims.api.security.LabAccessGuard;
import com.labtrace.lims.api.service.lab.SampleService;
import com.labtrace.lims.api.service.lab.SampleUpdateRequest;
import com.labtrace.lims.api.service.lab.SampleView;
import com.labtrace.lims.api.service.lab.TestAssignmentService;
import com.labtrace.lims.api.service.lab.TestAssignmentView;
import com.labtrace.lims.api.web.filter.AuditContextFilter;
import com.labtrace.lims.api.web.rest.errors.ExceptionTranslator;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.security.policy.LabAction;
import com.labtrace.lims.common.security.policy.LabResource;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class SampleResourceTest {

    private static final AuditContext CONTEXT = AuditContext.of("user-1", "analyst@lab.test", "10.0.0.7", "Mozilla/5.0");

    @Mock
    private SampleService sampleService;

    @Mock
    private TestAssignmentService testAssignmentService;

    @Mock
    private LabAccessGuard accessGuard;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new SampleResource(sampleService, testAssignmentService, accessGuard))
            .setControllerAdvice(new ExceptionTranslator())
            .build();
    }

    private static SampleView sample(UUID id, BigDecimal temperature) {
        return new SampleView(id, "S-100", null, null, null, null, "Raw material", null, temperature, null, null, false, false, null, null);
    }

    @Test
    void patchUpdatesSampleWithCallerContext() throws Exception {
        UUID id = UUID.randomUUID();
        when(sampleService.updateSample(eq(id), any(SampleUpdateRequest.class), eq(CONTEXT))).thenReturn(sample(id, new BigDecimal("8")));

        mockMvc
            .perform(
                patch("/api/samples/{id}", id)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"temperature\": 8}")
                    .requestAttr(AuditContextFilter.CONTEXT_ATTRIBUTE, CONTEXT)
            )
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.temperature").value(8));

        verify(accessGuard).check(LabAction.UPDATE, LabResource.SAMPLE);
    }

    @Test
    void oversizedFieldAnswers400() throws Exception {
        String batch = StringUtils.repeat('x', 65);

        mockMvc
            .perform(
                patch("/api/samples/{id}", UUID.randomUUID())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"sampleBatch\": \"" + batch + "\"}")
                    .requestAttr(AuditContextFilter.CONTEXT_ATTRIBUTE, CONTEXT)
            )
            .andExpect(status().isBadRequest());

        verify(sampleService, never()).updateSample(any(), any(), any());
    }

    @Test
    void mutationWithoutContextAnswers401() throws Exception {
        mockMvc.perform(post("/api/samples/{id}/release", UUID.randomUUID())).andExpect(status().isUnauthorized());

        verify(sampleService, never()).releaseSample(any(), any());
    }

    @Test
    void applyingTestPackAnswers201WithDrafts() throws Exception {
        UUID sampleId = UUID.randomUUID();
        UUID packId = UUID.randomUUID();
        LocalDate due = LocalDate.of(2025, 11, 17);
        when(testAssignmentService.applyTestPack(sampleId, packId, CONTEXT)).thenReturn(
            List.of(
                new TestAssignmentView(UUID.randomUUID(), sampleId, "pH", TestAssignmentStatus.DRAFT, due, null, null, null, false, null, null, null, null),
                new TestAssignmentView(UUID.randomUUID(), sampleId, "TPC", TestAssignmentStatus.DRAFT, due, null, null, null, false, null, null, null, null)
            )
        );

        mockMvc
            .perform(post("/api/samples/{id}/test-packs/{packId}", sampleId, packId).requestAttr(AuditContextFilter.CONTEXT_ATTRIBUTE, CONTEXT))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.length()").value(2))
            .andExpect(jsonPath("$.data[1].testName").value("TPC"));

        verify(accessGuard).check(LabAction.ASSIGN, LabResource.TEST_ASSIGNMENT);
    }
}
