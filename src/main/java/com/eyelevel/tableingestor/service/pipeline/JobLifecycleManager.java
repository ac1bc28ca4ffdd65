package com.eyelevel.tableingestor.service.pipeline;

import com.eyelevel.tableingestor.model.DocumentPageRecord;
import com.eyelevel.tableingestor.model.ErrorCode;
import com.eyelevel.tableingestor.model.ExtractedDocument;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.IssueSeverity;
import com.eyelevel.tableingestor.model.JobIssue;
import com.eyelevel.tableingestor.model.JobState;
import com.eyelevel.tableingestor.model.Kind;
import com.eyelevel.tableingestor.model.UploadEvent;
import com.eyelevel.tableingestor.model.UploadedFile;
import com.eyelevel.tableingestor.repository.DocumentPageRecordRepository;
import com.eyelevel.tableingestor.repository.IngestionJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Owns every state change of an {@link IngestionJob}.
 * <p>
 * All methods use {@code Propagation.REQUIRES_NEW} so each change is committed immediately and
 * stays visible even when the surrounding work is rolled back. Transitions are checked against
 * {@link JobState}; an illegal one throws {@link IllegalStateException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleManager {

    private final IngestionJobRepository jobRepository;
    private final DocumentPageRecordRepository pageRecordRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestionJob createJob(UploadEvent event) {
        IngestionJob job = new IngestionJob();
        job.setBucket(event.bucket());
        job.setFileKey(event.key());
        job.setState(JobState.RECEIVED);
        job.setCurrentStage("Awaiting worker");
        IngestionJob saved = jobRepository.save(job);
        log.info("[JobId: {}] Created ingestion job for s3://{}/{}", saved.getId(), event.bucket(), event.key());
        return saved;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestionJob start(Long jobId) {
        IngestionJob job = findJob(jobId);
        job.setStartedAt(LocalDateTime.now());
        job.setAttempts(1);
        job.setCurrentStage(PipelineStage.FETCH.getDescription());
        return jobRepository.save(job);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void incrementAttempts(Long jobId) {
        IngestionJob job = findJob(jobId);
        job.setAttempts(job.getAttempts() + 1);
        jobRepository.save(job);
        log.info("[JobId: {}] Retrying, attempt {}", jobId, job.getAttempts());
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordFetched(Long jobId, UploadedFile file) {
        IngestionJob job = findJob(jobId);
        job.setFileName(file.fileName());
        job.setExtension(file.extension());
        job.setDeclaredContentType(file.getDeclaredContentType());
        job.setSizeBytes(file.getSizeBytes());
        job.setContentHash(file.getContentHash());
        jobRepository.save(job);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void transition(Long jobId, JobState next, PipelineStage stage) {
        IngestionJob job = findJob(jobId);
        moveTo(job, next);
        job.setCurrentStage(stage.getDescription());
        jobRepository.save(job);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordKind(Long jobId, Kind kind) {
        IngestionJob job = findJob(jobId);
        job.setKind(kind);
        jobRepository.save(job);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markSchemaReady(Long jobId, String tableName) {
        IngestionJob job = findJob(jobId);
        moveTo(job, JobState.SCHEMA_READY);
        job.setTableName(tableName);
        job.setCurrentStage(PipelineStage.SCHEMA.getDescription());
        jobRepository.save(job);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void addIssues(Long jobId, List<JobIssue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        IngestionJob job = findJob(jobId);
        job.getIssues().addAll(issues);
        jobRepository.save(job);
    }

    /**
     * Stores every page slot of an extracted document, failed pages included.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void saveDocument(Long jobId, ExtractedDocument document) {
        pageRecordRepository.deleteAllByJobId(jobId);
        pageRecordRepository.saveAll(document.pages().stream()
                .map(page -> DocumentPageRecord.builder()
                        .jobId(jobId)
                        .pageNumber(page.pageNumber())
                        .text(page.text())
                        .ok(page.ok())
                        .build())
                .toList());
    }

    /**
     * Finishes a loaded job; any recorded warning makes it {@link JobState#COMPLETED_WITH_WARNINGS}.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestionJob complete(Long jobId, int rowsLoaded) {
        IngestionJob job = findJob(jobId);
        JobState terminal = job.hasWarnings() ? JobState.COMPLETED_WITH_WARNINGS : JobState.COMPLETED;
        moveTo(job, terminal);
        job.setRowsLoaded(rowsLoaded);
        job.setCurrentStage(PipelineStage.DONE.getDescription());
        job.setFinishedAt(LocalDateTime.now());
        IngestionJob saved = jobRepository.save(job);
        log.info("[JobId: {}] Job finished as {} with {} rows loaded into '{}'.", jobId, terminal, rowsLoaded,
                job.getTableName());
        return saved;
    }

    /**
     * Finishes a job whose content was already ingested by {@code original}, reusing its outcome.
     * The original's warnings are copied so a reused COMPLETED_WITH_WARNINGS still itemizes them.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public IngestionJob completeAsDuplicate(Long jobId, IngestionJob original) {
        IngestionJob job = findJob(jobId);
        original.getIssues().stream()
                .filter(issue -> issue.getSeverity() == IssueSeverity.WARNING)
                .map(issue -> JobIssue.warning(issue.getCode(), issue.getMessage()))
                .forEach(job.getIssues()::add);
        if (original.getState() == JobState.COMPLETED_WITH_WARNINGS && !job.hasWarnings()) {
            job.getIssues().add(JobIssue.warning(ErrorCode.ALREADY_LOADED, String.format(
                    "Outcome reused from job %d, which completed with warnings.", original.getId())));
        }
        moveTo(job, original.getState());
        job.setKind(original.getKind());
        job.setTableName(original.getTableName());
        job.setRowsLoaded(0);
        job.setDuplicateOfJobId(original.getId());
        job.setRemark("Identical content already ingested by job " + original.getId());
        job.setCurrentStage(PipelineStage.DONE.getDescription());
        job.setFinishedAt(LocalDateTime.now());
        IngestionJob saved = jobRepository.save(job);
        log.info("[JobId: {}] Content unchanged since job {}; reusing its outcome {}.", jobId, original.getId(),
                original.getState());
        return saved;
    }

    /**
     * Marks a job FAILED. Never throws, so a failure while recording a failure cannot escape a worker.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(Long jobId, ErrorCode errorCode, String errorMessage) {
        try {
            IngestionJob job = jobRepository.findById(jobId).orElse(null);
            if (job == null) {
                log.error("Cannot fail job: IngestionJob with ID {} not found.", jobId);
                return;
            }
            if (job.getState().isTerminal()) {
                log.warn("[JobId: {}] Job is already {}; not marking it FAILED.", jobId, job.getState());
                return;
            }
            moveTo(job, JobState.FAILED);
            job.setErrorCode(errorCode);
            job.setErrorMessage(errorMessage);
            job.getIssues().add(JobIssue.error(errorCode, errorMessage));
            job.setFinishedAt(LocalDateTime.now());
            jobRepository.save(job);
            log.error("[JobId: {}] Job FAILED with {}: {}", jobId, errorCode, errorMessage);
        } catch (final Exception e) {
            log.error("CRITICAL: Failed to record failure for IngestionJob ID: {}. The job state may be inconsistent.",
                    jobId, e);
        }
    }

    private IngestionJob findJob(Long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalStateException("IngestionJob not found with ID " + jobId));
    }

    private void moveTo(IngestionJob job, JobState next) {
        if (!job.getState().canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Illegal transition of job %d from %s to %s",
                    job.getId(), job.getState(), next));
        }
        job.setState(next);
    }
}
