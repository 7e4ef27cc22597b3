package com.example.catalogsync.service;

import com.example.catalogsync.dto.SyncCounts;
import com.example.catalogsync.dto.SyncReport;
import com.example.catalogsync.entity.SyncRun;
import com.example.catalogsync.exception.ResourceNotFoundException;
import com.example.catalogsync.repository.SyncRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Stores the report of every run in the history table.
 */
@Service
public class SyncRunService {

    private static final Logger log = LoggerFactory.getLogger(SyncRunService.class);

    private final SyncRunRepository repository;
    private final ObjectMapper objectMapper;

    public SyncRunService(SyncRunRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * Persist a report and set its run id.
     */
    @Transactional
    public SyncReport record(SyncReport report) {
        SyncCounts counts = report.getCounts() != null ? report.getCounts() : new SyncCounts();
        SyncRun run = SyncRun.builder()
                .family(report.getFamily())
                .status(report.getStatus())
                .startedAt(report.getStartedAt() != null ? report.getStartedAt() : LocalDateTime.now())
                .finishedAt(report.getFinishedAt())
                .createdCount(counts.getCreated())
                .updatedCount(counts.getUpdated())
                .unchangedCount(counts.getUnchanged())
                .deletedCount(counts.getDeleted())
                .markedForReviewCount(counts.getMarkedForReview())
                .errorCount(counts.getErrors())
                .message(truncate(report.getMessage(), 2048))
                .reportJson(toJson(report))
                .build();
        SyncRun saved = repository.save(run);
        report.setRunId(saved.getId());
        log.info("Recorded {} run {} with status {}", report.getFamily(), saved.getId(), report.getStatus());
        return report;
    }

    @Transactional(readOnly = true)
    public List<SyncRun> getRuns(String family) {
        if (family == null || family.isBlank()) {
            return repository.findAllByOrderByStartedAtDesc();
        }
        return repository.findByFamilyOrderByStartedAtDesc(family);
    }

    /**
     * The full report of a stored run.
     */
    @Transactional(readOnly = true)
    public SyncReport getReport(Long id) {
        SyncRun run = repository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("SyncRun", String.valueOf(id)));
        if (run.getReportJson() == null) {
            return SyncReport.builder()
                    .runId(run.getId())
                    .family(run.getFamily())
                    .status(run.getStatus())
                    .message(run.getMessage())
                    .startedAt(run.getStartedAt())
                    .finishedAt(run.getFinishedAt())
                    .build();
        }
        try {
            SyncReport report = objectMapper.readValue(run.getReportJson(), SyncReport.class);
            report.setRunId(run.getId());
            return report;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored report of run " + id + " is not readable", e);
        }
    }

    private String toJson(SyncReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize report of {}: {}", report.getFamily(), e.getMessage());
            return null;
        }
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
