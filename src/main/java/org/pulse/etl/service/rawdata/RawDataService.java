package org.pulse.etl.service.rawdata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.pulse.etl.exceptions.RawDataNotFoundException;
import org.pulse.etl.models.dto.ExtractionPage;
import org.pulse.etl.models.dto.QueueMessage;
import org.pulse.etl.models.dto.RawDataPage;
import org.pulse.etl.models.dto.RawDataRecordDTO;
import org.pulse.etl.models.entity.EtlJob;
import org.pulse.etl.models.entity.RawExtractionData;
import org.pulse.etl.models.enums.EtlStage;
import org.pulse.etl.models.enums.JobType;
import org.pulse.etl.models.enums.ProcessingStatus;
import org.pulse.etl.repository.RawExtractionDataRepository;
import org.pulse.etl.service.queue.QueueManager;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class RawDataService {

    public static final String ITEMS_FIELD = "items";
    public static final String NEXT_CURSOR_FIELD = "next_cursor";
    public static final String JOB_ID_FIELD = "job_id";
    public static final String JOB_TYPE_FIELD = "job_type";

    private final RawExtractionDataRepository rawExtractionDataRepository;
    private final QueueManager queueManager;

    public RawExtractionData store(EtlJob job, ExtractionPage page, String externalId, Map<String, Object> metadata) {
        Map<String, Object> rawData = new LinkedHashMap<>();
        rawData.put(ITEMS_FIELD, page.items());
        rawData.put(NEXT_CURSOR_FIELD, page.nextCursor());

        RawExtractionData row = new RawExtractionData();
        row.setTenantId(job.getTenantId());
        row.setIntegrationId(job.getIntegrationId());
        row.setEntityType(page.entityType());
        row.setExternalId(externalId);
        row.setRawData(rawData);
        row.setExtractionMetadata(metadata);
        row.setProcessingStatus(ProcessingStatus.PENDING);
        row.setCreatedAt(Instant.now());
        return rawExtractionDataRepository.save(row);
    }

    /**
     * Claims a row for transformation. Completed rows are never claimed again,
     * so a redelivered message becomes a no-op.
     */
    @Transactional
    public boolean markProcessing(Long rawDataId) {
        return rawExtractionDataRepository.transition(rawDataId,
                EnumSet.of(ProcessingStatus.PENDING, ProcessingStatus.PROCESSING, ProcessingStatus.FAILED),
                ProcessingStatus.PROCESSING) == 1;
    }

    @Transactional
    public void markCompleted(Long rawDataId) {
        RawExtractionData row = get(rawDataId);
        row.setProcessingStatus(ProcessingStatus.COMPLETED);
        row.setProcessedAt(Instant.now());
        row.setErrorDetails(null);
        rawExtractionDataRepository.save(row);
    }

    @Transactional
    public void markFailed(Long rawDataId, Map<String, Object> errorDetails) {
        RawExtractionData row = get(rawDataId);
        row.setProcessingStatus(ProcessingStatus.FAILED);
        row.setProcessedAt(Instant.now());
        row.setErrorDetails(errorDetails);
        rawExtractionDataRepository.save(row);
    }

    @Transactional
    public RawDataRecordDTO updateStatus(Long rawDataId, ProcessingStatus status, Map<String, Object> errorDetails) {
        RawExtractionData row = get(rawDataId);
        row.setProcessingStatus(status);
        row.setErrorDetails(status == ProcessingStatus.FAILED ? errorDetails : null);
        row.setProcessedAt(status == ProcessingStatus.COMPLETED || status == ProcessingStatus.FAILED ? Instant.now() : null);
        return toDto(rawExtractionDataRepository.save(row));
    }

    /**
     * Queues a stored batch for transformation again without touching the external API.
     * The status reset commits before the message is published.
     */
    public RawDataRecordDTO reprocess(Long rawDataId) {
        RawExtractionData row = get(rawDataId);
        if (row.getProcessingStatus() == ProcessingStatus.PROCESSING) {
            throw new IllegalStateException("Raw data " + rawDataId + " is being processed right now");
        }
        row.setProcessingStatus(ProcessingStatus.PENDING);
        row.setErrorDetails(null);
        row.setProcessedAt(null);
        RawExtractionData saved = rawExtractionDataRepository.save(row);

        Map<String, Object> metadata = Optional.ofNullable(saved.getExtractionMetadata()).orElse(Map.of());
        queueManager.publish(EtlStage.TRANSFORM, QueueMessage.builder()
                .tenantId(saved.getTenantId())
                .integrationId(saved.getIntegrationId())
                .jobId(metadata.get(JOB_ID_FIELD) instanceof Number number ? number.longValue() : null)
                .jobType(jobType(saved.getId(), metadata.get(JOB_TYPE_FIELD)))
                .entityType(saved.getEntityType())
                .rawDataId(saved.getId())
                .priority(QueueMessage.DEFAULT_PRIORITY)
                .build());
        log.info("Raw data {} ({}) queued for reprocessing", saved.getId(), saved.getEntityType());
        return toDto(saved);
    }

    private static JobType jobType(Long rawDataId, Object value) {
        if (!(value instanceof String name)) {
            return null;
        }
        try {
            return JobType.valueOf(name);
        } catch (IllegalArgumentException exception) {
            log.warn("Raw data {} names unknown job type '{}'; reprocessing without one", rawDataId, name);
            return null;
        }
    }

    @Transactional(readOnly = true)
    public RawExtractionData get(Long rawDataId) {
        return rawExtractionDataRepository.findById(rawDataId)
                .orElseThrow(() -> new RawDataNotFoundException(rawDataId));
    }

    @Transactional(readOnly = true)
    public RawDataRecordDTO getRecord(Long rawDataId) {
        return toDto(get(rawDataId));
    }

    @Transactional(readOnly = true)
    public RawDataPage list(Long tenantId, ProcessingStatus status, int page, int size) {
        int pageSize = Math.min(Math.max(size, 1), 200);
        Pageable pageable = PageRequest.of(Math.max(page, 0), pageSize, Sort.by(Sort.Direction.DESC, "id"));

        Page<RawExtractionData> result;
        if (tenantId != null && status != null) {
            result = rawExtractionDataRepository.findByTenantIdAndProcessingStatus(tenantId, status, pageable);
        } else if (tenantId != null) {
            result = rawExtractionDataRepository.findByTenantId(tenantId, pageable);
        } else if (status != null) {
            result = rawExtractionDataRepository.findByProcessingStatus(status, pageable);
        } else {
            result = rawExtractionDataRepository.findAll(pageable);
        }

        return new RawDataPage(
                result.getContent().stream().map(this::toDto).toList(),
                tenantId,
                status,
                result.getTotalElements(),
                result.getTotalPages(),
                result.getNumber(),
                result.getSize()
        );
    }

    public Map<ProcessingStatus, Long> countsByStatus() {
        Map<ProcessingStatus, Long> counts = new LinkedHashMap<>();
        for (ProcessingStatus status : ProcessingStatus.values()) {
            counts.put(status, rawExtractionDataRepository.countByProcessingStatus(status));
        }
        return counts;
    }

    private RawDataRecordDTO toDto(RawExtractionData row) {
        return new RawDataRecordDTO(
                row.getId(),
                row.getTenantId(),
                row.getIntegrationId(),
                row.getEntityType(),
                row.getExternalId(),
                row.getProcessingStatus(),
                row.getRawData(),
                row.getExtractionMetadata(),
                row.getErrorDetails(),
                row.getCreatedAt(),
                row.getProcessedAt()
        );
    }
}
