package com.labtrace.lims.api.web.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.labtrace.lims.api.security.LabAccessGuard;
import com.labtrace.lims.api.service.audit.AuditEntryQueryService;
import com.labtrace.lims.api.service.audit.AuditEntryView;
import com.labtrace.lims.api.service.audit.AuditGroupView;
import com.labtrace.lims.api.service.audit.AuditPage;
import com.labtrace.lims.api.service.audit.AuditSearchCriteria;
import com.labtrace.lims.api.service.error.RecordNotFoundException;
import com.labtrace.lims.api.web.rest.errors.ExceptionTranslator;
import com.labtrace.lims.common.audit.AuditAction;
import com.labtrace.lims.common.security.policy.LabAction;
import com.labtrace.lims.common.security.policy.LabResource;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class AuditTrailResourceTest {

    @Mock
    private AuditEntryQueryService queryService;

    @Mock
    private LabAccessGuard accessGuard;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AuditTrailResource(queryService, accessGuard))
            .setControllerAdvice(new ExceptionTranslator())
            .build();
    }

    private static AuditEntryView view(String subjectId, String tag) {
        return new AuditEntryView(
            UUID.randomUUID(),
            "user-1",
            "analyst@lab.test",
            "10.0.0.7",
            "Mozilla/5.0",
            AuditAction.UPDATE,
            "Sample",
            subjectId,
            Map.of("temperature", Map.of("old", 5, "new", 8)),
            null,
            tag,
            Instant.parse("2025-11-14T08:00:00Z")
        );
    }

    @Test
    void listPassesFiltersAndWrapsPage() throws Exception {
        when(queryService.query(any(AuditSearchCriteria.class), eq(1), eq(20))).thenReturn(
            new AuditPage<>(List.of(view("S-1", null)), 21, 1, 20)
        );

        mockMvc
            .perform(get("/api/audit").param("subjectType", "Sample").param("action", "UPDATE").param("page", "1").param("size", "20"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.data.totalElements").value(21))
            .andExpect(jsonPath("$.data.totalPages").value(2))
            .andExpect(jsonPath("$.data.content[0].subjectId").value("S-1"))
            .andExpect(jsonPath("$.data.content[0].changes.temperature.new").value(8));

        ArgumentCaptor<AuditSearchCriteria> criteria = ArgumentCaptor.forClass(AuditSearchCriteria.class);
        verify(queryService).query(criteria.capture(), eq(1), eq(20));
        assertThat(criteria.getValue().subjectType()).isEqualTo("Sample");
        assertThat(criteria.getValue().action()).isEqualTo(AuditAction.UPDATE);
        verify(accessGuard).check(LabAction.READ, LabResource.AUDIT_LOG);
    }

    @Test
    void groupedListReturnsGroups() throws Exception {
        AuditGroupView group = new AuditGroupView(
            "tx-1",
            "tx-1",
            Instant.parse("2025-11-14T08:00:00Z"),
            "user-1",
            "analyst@lab.test",
            "10.0.0.7",
            "Mozilla/5.0",
            List.of(view("T-1", "tx-1"), view("T-2", "tx-1"))
        );
        when(queryService.queryGrouped(any(AuditSearchCriteria.class), eq(0), eq(0))).thenReturn(new AuditPage<>(List.of(group), 2, 0, 50));

        mockMvc
            .perform(get("/api/audit").param("grouped", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.content[0].groupKey").value("tx-1"))
            .andExpect(jsonPath("$.data.content[0].entries.length()").value(2))
            .andExpect(jsonPath("$.data.totalElements").value(2));
    }

    @Test
    void unknownEntryAnswers404() throws Exception {
        UUID id = UUID.randomUUID();
        when(queryService.getById(id)).thenThrow(new RecordNotFoundException("AuditEntry", id));

        mockMvc.perform(get("/api/audit/{id}", id)).andExpect(status().isNotFound()).andExpect(jsonPath("$.status").value("ERROR"));
    }

    @Test
    void ledgerCannotBeModifiedOverHttp() throws Exception {
        UUID id = UUID.randomUUID();

        mockMvc.perform(put("/api/audit/{id}", id)).andExpect(status().isMethodNotAllowed());
        mockMvc.perform(delete("/api/audit/{id}", id)).andExpect(status().isMethodNotAllowed());
        verify(queryService, never()).getById(any());
    }

    @Test
    void deniedCallerAnswers403() throws Exception {
        doThrow(new AccessDeniedException("Role ANALYST may not READ AUDIT_LOG")).when(accessGuard).check(LabAction.READ, LabResource.AUDIT_LOG);

        mockMvc.perform(get("/api/audit")).andExpect(status().isForbidden());
        verify(queryService, never()).query(any(), anyInt(), anyInt());
    }

    @Test
    void invalidActionFilterAnswers400() throws Exception {
        mockMvc.perform(get("/api/audit").param("action", "PURGE")).andExpect(status().isBadRequest());
    }
}
