package com.eyelevel.tableingestor.service.pipeline;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.exception.IngestionException;
import com.eyelevel.tableingestor.exception.UnsupportedFileTypeException;
import com.eyelevel.tableingestor.model.ErrorCode;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.JobIssue;
import com.eyelevel.tableingestor.model.JobState;
import com.eyelevel.tableingestor.model.Kind;
import com.eyelevel.tableingestor.model.ParsedTable;
import com.eyelevel.tableingestor.model.UploadedFile;
import com.eyelevel.tableingestor.repository.IngestionJobRepository;
import com.eyelevel.tableingestor.service.classify.FileClassifier;
import com.eyelevel.tableingestor.service.csv.CsvStructureResult;
import com.eyelevel.tableingestor.service.csv.CsvStructurer;
import com.eyelevel.tableingestor.service.load.LoadRequest;
import com.eyelevel.tableingestor.service.load.LoadResult;
import com.eyelevel.tableingestor.service.load.TableLoader;
import com.eyelevel.tableingestor.service.ocr.OcrExtractor;
import com.eyelevel.tableingestor.service.ocr.OcrResult;
import com.eyelevel.tableingestor.service.schema.SchemaSynthesizer;
import com.eyelevel.tableingestor.service.storage.ObjectStore;
import com.eyelevel.tableingestor.service.storage.StoredObject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Drives one job through the ingestion state machine:
 * {@code RECEIVED -> CLASSIFYING -> STRUCTURING|EXTRACTING -> SCHEMA_READY -> LOADING -> terminal}.
 * <p>
 * Stages run strictly in order on the calling worker thread. Transient store failures are retried
 * with backoff; everything else ends the job as FAILED with the error code carried by the
 * exception. {@link #process(Long)} never throws, so one file cannot disturb another.
 */
@Slf4j
@Service
public class IngestionOrchestrator {

    private final IngestionConfig config;
    private final JobLifecycleManager lifecycle;
    private final IngestionJobRepository jobRepository;
    private final ObjectStore objectStore;
    private final FileClassifier classifier;
    private final CsvStructurer csvStructurer;
    private final OcrExtractor ocrExtractor;
    private final SchemaSynthesizer schemaSynthesizer;
    private final TableLoader tableLoader;
    private final StageRunner stageRunner;
    private final RetryTemplate retryTemplate;

    public IngestionOrchestrator(IngestionConfig config, JobLifecycleManager lifecycle,
                                 IngestionJobRepository jobRepository, ObjectStore objectStore,
                                 FileClassifier classifier, CsvStructurer csvStructurer, OcrExtractor ocrExtractor,
                                 SchemaSynthesizer schemaSynthesizer, TableLoader tableLoader,
                                 StageRunner stageRunner,
                                 @Qualifier("transientStoreRetryTemplate") RetryTemplate retryTemplate) {
        this.config = config;
        this.lifecycle = lifecycle;
        this.jobRepository = jobRepository;
        this.objectStore = objectStore;
        this.classifier = classifier;
        this.csvStructurer = csvStructurer;
        this.ocrExtractor = ocrExtractor;
        this.schemaSynthesizer = schemaSynthesizer;
        this.tableLoader = tableLoader;
        this.stageRunner = stageRunner;
        this.retryTemplate = retryTemplate;
    }

    public void process(Long jobId) {
        final String contextInfo = "JobId: " + jobId;
        try {
            IngestionJob job = lifecycle.start(jobId);
            log.info("[{}] Processing s3://{}/{}", contextInfo, job.getBucket(), job.getFileKey());

            UploadedFile file = fetch(job, contextInfo);
            lifecycle.recordFetched(jobId, file);

            Optional<IngestionJob> original = jobRepository
                    .findFirstByBucketAndFileKeyAndContentHashAndStateInAndIdNotOrderByIdAsc(file.getBucket(),
                            file.getKey(), file.getContentHash(), JobState.SUCCESSFUL_TERMINAL_STATES, jobId);
            if (original.isPresent()) {
                lifecycle.completeAsDuplicate(jobId, original.get());
                return;
            }

            lifecycle.transition(jobId, JobState.CLASSIFYING, PipelineStage.CLASSIFY);
            Kind kind = classifier.classify(file);
            lifecycle.recordKind(jobId, kind);
            log.info("[{}] '{}' classified as {}.", contextInfo, file.fileName(), kind);

            ParsedTable table = switch (kind) {
                case CSV -> structure(jobId, file, contextInfo);
                case IMAGE, PDF -> extract(jobId, file, kind, contextInfo);
                case UNSUPPORTED -> throw new UnsupportedFileTypeException(String.format(
                        "File '%s' is not a CSV, PDF or supported image", file.fileName()));
            };

            lifecycle.markSchemaReady(jobId, table.getTableName());
            lifecycle.transition(jobId, JobState.LOADING, PipelineStage.LOAD);
            LoadRequest request = new LoadRequest(jobId, file.getBucket() + "/" + file.getKey(),
                    file.getContentHash(), contextInfo);
            LoadResult result = withRetry(jobId, () -> tableLoader.load(table, request));
            if (result.alreadyLoaded()) {
                lifecycle.addIssues(jobId, List.of(JobIssue.warning(ErrorCode.ALREADY_LOADED, String.format(
                        "Identical content was already loaded into '%s' by job %d; no rows inserted.",
                        result.tableName(), result.loadedByJobId()))));
            }
            lifecycle.complete(jobId, result.rowsInserted());
        } catch (IngestionException e) {
            log.warn("[{}] Ingestion failed with {}: {}", contextInfo, e.getErrorCode(), e.getMessage());
            lifecycle.fail(jobId, e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("[{}] Unexpected error during ingestion.", contextInfo, e);
            lifecycle.fail(jobId, ErrorCode.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private UploadedFile fetch(IngestionJob job, String contextInfo) {
        StoredObject stored = withRetry(job.getId(), () -> stageRunner.run(PipelineStage.FETCH,
                config.getTimeouts().getFetch(), contextInfo,
                () -> objectStore.get(job.getBucket(), job.getFileKey())));
        return UploadedFile.builder()
                .bucket(job.getBucket())
                .key(job.getFileKey())
                .declaredContentType(stored.contentType())
                .sizeBytes(stored.sizeBytes())
                .contentHash(DigestUtils.sha256Hex(stored.content()))
                .content(stored.content())
                .build();
    }

    private ParsedTable structure(Long jobId, UploadedFile file, String contextInfo) {
        lifecycle.transition(jobId, JobState.STRUCTURING, PipelineStage.STRUCTURE);
        CsvStructureResult structured = stageRunner.run(PipelineStage.STRUCTURE, config.getTimeouts().getStructure(),
                contextInfo, () -> csvStructurer.structure(file.getContent(), contextInfo));
        lifecycle.addIssues(jobId, structured.warnings());
        return schemaSynthesizer.fromCsv(file.getKey(), structured);
    }

    private ParsedTable extract(Long jobId, UploadedFile file, Kind kind, String contextInfo) {
        lifecycle.transition(jobId, JobState.EXTRACTING, PipelineStage.EXTRACT);
        OcrResult ocr = stageRunner.run(PipelineStage.EXTRACT, config.getTimeouts().getExtract(), contextInfo,
                () -> ocrExtractor.extract(file.getContent(), kind, file.getKey(), contextInfo));
        lifecycle.saveDocument(jobId, ocr.document());
        lifecycle.addIssues(jobId, ocr.warnings());
        return schemaSynthesizer.fromDocument(ocr.document());
    }

    private <T> T withRetry(Long jobId, Supplier<T> operation) {
        return retryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                lifecycle.incrementAttempts(jobId);
            }
            return operation.get();
        });
    }
}
