package com.labtrace.lims.api.service.lab;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.labtrace.lims.api.domain.Sample;
import com.labtrace.lims.api.repository.SampleRepository;
import com.labtrace.lims.api.service.audit.AuditFieldMaps;
import com.labtrace.lims.api.service.audit.AuditTrailService;
import com.labtrace.lims.api.service.error.RecordNotFoundException;
import com.labtrace.lims.common.audit.AuditContext;
import com.labtrace.lims.common.audit.AuditContextMissingException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SampleServiceTest {

    private static final UUID SAMPLE_ID = UUID.randomUUID();
    private static final AuditContext CONTEXT = AuditContext.of("user-1", "analyst@lab.test", "10.0.0.7", "Mozilla/5.0");

    @Mock
    private SampleRepository sampleRepository;

    @Mock
    private AuditTrailService auditTrailService;

    private SampleService service;
    private Sample sample;

    @BeforeEach
    void setUp() {
        service = new SampleService(sampleRepository, auditTrailService);
        sample = new Sample();
        sample.setId(SAMPLE_ID);
        sample.setSampleCode("S-100");
        sample.setTemperature(new BigDecimal("5"));
        sample.setStorageConditions("Ambient");
    }

    private static SampleUpdateRequest temperature(BigDecimal value) {
        return new SampleUpdateRequest(null, null, null, null, null, value, null, null, null, null, null, null, null, null, null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void temperatureChangeIsAuditedWithOldAndNewValue() {
        when(sampleRepository.findById(SAMPLE_ID)).thenReturn(Optional.of(sample));
        when(sampleRepository.saveAndFlush(sample)).thenReturn(sample);

        SampleView view = service.updateSample(SAMPLE_ID, temperature(new BigDecimal("8")), CONTEXT);

        assertThat(sample.getTemperature()).isEqualByComparingTo("8");
        assertThat(sample.getStorageConditions()).isEqualTo("Ambient");
        assertThat(view).isNotNull();
        ArgumentCaptor<Map<String, Object>> before = ArgumentCaptor.forClass(Map.class);
        ArgumentCaptor<Map<String, Object>> after = ArgumentCaptor.forClass(Map.class);
        verify(auditTrailService).logUpdate(eq(CONTEXT), eq(AuditFieldMaps.SAMPLE), eq(SAMPLE_ID), before.capture(), after.capture());
        assertThat(before.getValue().get("temperature")).isEqualTo(new BigDecimal("5"));
        assertThat(after.getValue().get("temperature")).isEqualTo(new BigDecimal("8"));
    }

    @Test
    void releaseStampsDateAndGivesReason() {
        when(sampleRepository.findById(SAMPLE_ID)).thenReturn(Optional.of(sample));
        when(sampleRepository.saveAndFlush(sample)).thenReturn(sample);

        service.releaseSample(SAMPLE_ID, CONTEXT);

        assertThat(sample.isReleased()).isTrue();
        assertThat(sample.getReleaseDate()).isNotNull();
        verify(auditTrailService).logUpdate(eq(CONTEXT), eq(AuditFieldMaps.SAMPLE), eq(SAMPLE_ID), any(), any(), eq("Sample released"));
    }

    @Test
    void unknownSampleIsNotFound() {
        when(sampleRepository.findById(SAMPLE_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.updateSample(SAMPLE_ID, temperature(BigDecimal.ONE), CONTEXT))
            .isInstanceOf(RecordNotFoundException.class);
    }

    @Test
    void unattributableContextIsRejectedBeforeAnyWrite() {
        AuditContext anonymous = AuditContext.of(null, null, null, null);

        assertThatThrownBy(() -> service.releaseSample(SAMPLE_ID, anonymous)).isInstanceOf(AuditContextMissingException.class);
        verify(sampleRepository, never()).saveAndFlush(any(Sample.class));
    }
}
