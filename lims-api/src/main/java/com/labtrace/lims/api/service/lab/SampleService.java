package com.labtrace.lims.api.service.lab;

import com.labtrace.lims.api.domain.Sample;
import com.labtrace.lims.api.repository.SampleRepository;
import com.labtrace.lims.api.service.audit.AuditFieldMaps;
import com.labtrace.lims.api.service.audit.AuditTrailService;
import com.labtrace.lims.api.service.error.RecordNotFoundException;
import com.labtrace.lims.common.audit.AuditContext;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SampleService {

    private static final Logger log = LoggerFactory.getLogger(SampleService.class);

    private final SampleRepository sampleRepository;
    private final AuditTrailService auditTrailService;

    public SampleService(SampleRepository sampleRepository, AuditTrailService auditTrailService) {
        this.sampleRepository = sampleRepository;
        this.auditTrailService = auditTrailService;
    }

    /**
     * Applies the non-null fields of {@code request}. A request that changes nothing writes no audit entry.
     */
    public SampleView updateSample(UUID sampleId, SampleUpdateRequest request, AuditContext context) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(context, "context").requireAttributable();
        Sample sample = load(sampleId);
        Map<String, Object> before = AuditFieldMaps.sample(sample);

        apply(request.dateDue(), sample::setDateDue);
        apply(request.rmSupplier(), sample::setRmSupplier);
        apply(request.sampleDescription(), sample::setSampleDescription);
        apply(request.uinCode(), sample::setUinCode);
        apply(request.sampleBatch(), sample::setSampleBatch);
        apply(request.temperature(), sample::setTemperature);
        apply(request.storageConditions(), sample::setStorageConditions);
        apply(request.comments(), sample::setComments);
        apply(request.expiredRawMaterial(), sample::setExpiredRawMaterial);
        apply(request.postIrradiatedRawMaterial(), sample::setPostIrradiatedRawMaterial);
        apply(request.stabilityStudy(), sample::setStabilityStudy);
        apply(request.urgent(), sample::setUrgent);
        apply(request.allMicroTestsAssigned(), sample::setAllMicroTestsAssigned);
        apply(request.allChemistryTestsAssigned(), sample::setAllChemistryTestsAssigned);
        apply(request.retest(), sample::setRetest);

        Sample saved = sampleRepository.saveAndFlush(sample);
        auditTrailService.logUpdate(context, AuditFieldMaps.SAMPLE, saved.getId(), before, AuditFieldMaps.sample(saved));
        return SampleView.from(saved);
    }

    public SampleView releaseSample(UUID sampleId, AuditContext context) {
        Objects.requireNonNull(context, "context").requireAttributable();
        Sample sample = load(sampleId);
        Map<String, Object> before = AuditFieldMaps.sample(sample);
        sample.setReleased(true);
        sample.setReleaseDate(Instant.now());
        Sample saved = sampleRepository.saveAndFlush(sample);
        auditTrailService.logUpdate(context, AuditFieldMaps.SAMPLE, saved.getId(), before, AuditFieldMaps.sample(saved), "Sample released");
        log.info("Sample {} released by {}", saved.getSampleCode(), context.actorEmail());
        return SampleView.from(saved);
    }

    private Sample load(UUID sampleId) {
        return sampleRepository.findById(sampleId).orElseThrow(() -> new RecordNotFoundException("Sample", sampleId));
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
