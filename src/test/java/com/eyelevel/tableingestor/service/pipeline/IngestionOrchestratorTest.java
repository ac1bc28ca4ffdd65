package com.eyelevel.tableingestor.service.pipeline;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.exception.ObjectNotFoundException;
import com.eyelevel.tableingestor.exception.TransientStoreException;
import com.eyelevel.tableingestor.model.ErrorCode;
import com.eyelevel.tableingestor.model.ExtractedDocument;
import com.eyelevel.tableingestor.model.ExtractedPage;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.JobIssue;
import com.eyelevel.tableingestor.model.JobState;
import com.eyelevel.tableingestor.model.Kind;
import com.eyelevel.tableingestor.model.ParsedTable;
import com.eyelevel.tableingestor.repository.IngestionJobRepository;
import com.eyelevel.tableingestor.service.classify.FileClassifier;
import com.eyelevel.tableingestor.service.csv.CsvStructurer;
import com.eyelevel.tableingestor.service.load.LoadRequest;
import com.eyelevel.tableingestor.service.load.LoadResult;
import com.eyelevel.tableingestor.service.load.TableLoader;
import com.eyelevel.tableingestor.service.ocr.OcrExtractor;
import com.eyelevel.tableingestor.service.ocr.OcrResult;
import com.eyelevel.tableingestor.service.schema.SchemaSynthesizer;
import com.eyelevel.tableingestor.service.storage.ObjectStore;
import com.eyelevel.tableingestor.service.storage.StoredObject;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.retry.support.RetryTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Drives the orchestrator with the real classifier, CSV structurer and schema synthesizer; the
 * object store, OCR, loader and job bookkeeping are mocked.
 */
@ExtendWith(MockitoExtension.class)
class IngestionOrchestratorTest {

    private static final Long JOB_ID = 7L;
    private static final String BUCKET = "uploads";
    private static final byte[] SALES_CSV = """
            Date,Amount,Region
            2024-01-01,100,North
            2024-01-02,200,South
            """.getBytes(StandardCharsets.UTF_8);

    @Mock
    private JobLifecycleManager lifecycle;

    @Mock
    private IngestionJobRepository jobRepository;

    @Mock
    private ObjectStore objectStore;

    @Mock
    private OcrExtractor ocrExtractor;

    @Mock
    private TableLoader tableLoader;

    private IngestionConfig config;
    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        config = new IngestionConfig();
        RetryTemplate retryTemplate = RetryTemplate.builder()
                .maxAttempts(3)
                .retryOn(TransientStoreException.class)
                .traversingCauses()
                .noBackoff()
                .build();
        orchestrator = new IngestionOrchestrator(config, lifecycle, jobRepository, objectStore,
                new FileClassifier(config), new CsvStructurer(config), ocrExtractor, new SchemaSynthesizer(config),
                tableLoader, new StageRunner(new SimpleAsyncTaskExecutor("stage-test-")), retryTemplate);
    }

    @Test
    @DisplayName("Should load a CSV file into the table named after it")
    void process_csvHappyPath() {
        givenJobFor("incoming/sales_2024.csv", SALES_CSV);
        when(tableLoader.load(any(ParsedTable.class), any(LoadRequest.class)))
                .thenReturn(new LoadResult("sales_2024", 2, false, JOB_ID));

        orchestrator.process(JOB_ID);

        ArgumentCaptor<ParsedTable> table = ArgumentCaptor.forClass(ParsedTable.class);
        ArgumentCaptor<LoadRequest> request = ArgumentCaptor.forClass(LoadRequest.class);
        verify(tableLoader).load(table.capture(), request.capture());
        assertEquals("sales_2024", table.getValue().getTableName());
        assertEquals(List.of("date", "amount", "region"), table.getValue().columnNames());
        assertEquals(2, table.getValue().getRows().size());
        assertEquals("uploads/incoming/sales_2024.csv", request.getValue().sourceKey());
        assertEquals(DigestUtils.sha256Hex(SALES_CSV), request.getValue().contentHash());

        verify(lifecycle).recordKind(JOB_ID, Kind.CSV);
        verify(lifecycle).transition(JOB_ID, JobState.CLASSIFYING, PipelineStage.CLASSIFY);
        verify(lifecycle).transition(JOB_ID, JobState.STRUCTURING, PipelineStage.STRUCTURE);
        verify(lifecycle).markSchemaReady(JOB_ID, "sales_2024");
        verify(lifecycle).transition(JOB_ID, JobState.LOADING, PipelineStage.LOAD);
        verify(lifecycle).complete(JOB_ID, 2);
        verify(lifecycle, never()).fail(anyLong(), any(), anyString());
        verifyNoInteractions(ocrExtractor);
    }

    @Test
    @DisplayName("Should fail an unsupported file before any table is touched")
    void process_unsupportedFile() {
        givenJobFor("docs/readme.txt", "just some notes".getBytes(StandardCharsets.UTF_8));

        orchestrator.process(JOB_ID);

        verify(lifecycle).recordKind(JOB_ID, Kind.UNSUPPORTED);
        verify(lifecycle).fail(eq(JOB_ID), eq(ErrorCode.UNSUPPORTED_FILE_TYPE), contains("readme.txt"));
        verify(lifecycle, never()).markSchemaReady(anyLong(), anyString());
        verifyNoInteractions(tableLoader, ocrExtractor);
    }

    @Test
    @DisplayName("Should reuse the outcome of an earlier job for unchanged content")
    void process_duplicateContent() {
        givenJobFor("incoming/sales_2024.csv", SALES_CSV);
        IngestionJob original = new IngestionJob();
        original.setId(3L);
        original.setState(JobState.COMPLETED);
        when(jobRepository.findFirstByBucketAndFileKeyAndContentHashAndStateInAndIdNotOrderByIdAsc(BUCKET,
                "incoming/sales_2024.csv", DigestUtils.sha256Hex(SALES_CSV), JobState.SUCCESSFUL_TERMINAL_STATES,
                JOB_ID)).thenReturn(Optional.of(original));

        orchestrator.process(JOB_ID);

        verify(lifecycle).completeAsDuplicate(JOB_ID, original);
        verify(lifecycle, never()).transition(anyLong(), any(), any());
        verifyNoInteractions(tableLoader);
    }

    @Test
    @DisplayName("Should record the OCR document and its page warnings before loading")
    void process_pdfWithFailedPage() {
        byte[] pdf = "%PDF-1.7 fake".getBytes(StandardCharsets.US_ASCII);
        givenJobFor("scans/invoice.pdf", pdf);
        ExtractedDocument document = new ExtractedDocument("scans/invoice.pdf", List.of(
                new ExtractedPage(1, "Invoice 42", true),
                ExtractedPage.failed(2),
                new ExtractedPage(3, "Total 10", true)));
        List<JobIssue> warnings = List.of(JobIssue.warning(ErrorCode.OCR_PAGE_FAILURE, "Page 2 could not be extracted"));
        when(ocrExtractor.extract(pdf, Kind.PDF, "scans/invoice.pdf", "JobId: 7"))
                .thenReturn(new OcrResult(document, warnings));
        when(tableLoader.load(any(ParsedTable.class), any(LoadRequest.class)))
                .thenReturn(new LoadResult("ocr_text", 2, false, JOB_ID));

        orchestrator.process(JOB_ID);

        verify(lifecycle).transition(JOB_ID, JobState.EXTRACTING, PipelineStage.EXTRACT);
        verify(lifecycle).saveDocument(JOB_ID, document);
        verify(lifecycle).addIssues(JOB_ID, warnings);
        verify(lifecycle).markSchemaReady(JOB_ID, "ocr_text");
        verify(lifecycle).complete(JOB_ID, 2);
    }

    @Test
    @DisplayName("Should retry transient fetch failures and count the attempts")
    void process_retriesTransientFailure() {
        givenJob("incoming/sales_2024.csv");
        when(objectStore.get(BUCKET, "incoming/sales_2024.csv"))
                .thenThrow(new TransientStoreException("503 Slow Down", null))
                .thenReturn(new StoredObject(SALES_CSV, "text/csv", SALES_CSV.length));
        when(tableLoader.load(any(ParsedTable.class), any(LoadRequest.class)))
                .thenReturn(new LoadResult("sales_2024", 2, false, JOB_ID));

        orchestrator.process(JOB_ID);

        verify(objectStore, times(2)).get(BUCKET, "incoming/sales_2024.csv");
        verify(lifecycle).incrementAttempts(JOB_ID);
        verify(lifecycle).complete(JOB_ID, 2);
    }

    @Test
    @DisplayName("Should fail with the transient error code once retries are exhausted")
    void process_transientFailureExhausted() {
        givenJob("incoming/sales_2024.csv");
        when(objectStore.get(BUCKET, "incoming/sales_2024.csv"))
                .thenThrow(new TransientStoreException("connection reset", null));

        orchestrator.process(JOB_ID);

        verify(objectStore, times(3)).get(BUCKET, "incoming/sales_2024.csv");
        verify(lifecycle).fail(eq(JOB_ID), eq(ErrorCode.TRANSIENT_STORE_ERROR), anyString());
    }

    @Test
    @DisplayName("Should fail without retrying when the object does not exist")
    void process_missingObject() {
        givenJob("incoming/gone.csv");
        when(objectStore.get(BUCKET, "incoming/gone.csv")).thenThrow(new ObjectNotFoundException("no such key"));

        orchestrator.process(JOB_ID);

        verify(objectStore, times(1)).get(BUCKET, "incoming/gone.csv");
        verify(lifecycle).fail(JOB_ID, ErrorCode.OBJECT_NOT_FOUND, "no such key");
    }

    @Test
    @DisplayName("Should warn when the loader finds the content already loaded")
    void process_alreadyLoaded() {
        givenJobFor("incoming/sales_2024.csv", SALES_CSV);
        when(tableLoader.load(any(ParsedTable.class), any(LoadRequest.class)))
                .thenReturn(new LoadResult("sales_2024", 0, true, 3L));

        orchestrator.process(JOB_ID);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<JobIssue>> issues = ArgumentCaptor.forClass(List.class);
        verify(lifecycle, atLeastOnce()).addIssues(eq(JOB_ID), issues.capture());
        assertTrue(issues.getAllValues().stream().flatMap(List::stream)
                .anyMatch(issue -> issue.getCode() == ErrorCode.ALREADY_LOADED));
        verify(lifecycle).complete(JOB_ID, 0);
    }

    @Test
    @DisplayName("Should abort a stage that exceeds its time budget")
    void process_stageTimeout() {
        config.getTimeouts().setExtract(Duration.ofMillis(100));
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
        givenJobFor("photos/receipt.png", png);
        when(ocrExtractor.extract(any(), any(), anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        });

        orchestrator.process(JOB_ID);

        verify(lifecycle).fail(eq(JOB_ID), eq(ErrorCode.TIMEOUT_EXCEEDED), contains("EXTRACT"));
        verifyNoInteractions(tableLoader);
    }

    @Test
    @DisplayName("Should turn unexpected errors into an internal failure instead of throwing")
    void process_unexpectedError() {
        when(lifecycle.start(JOB_ID)).thenThrow(new IllegalStateException("IngestionJob not found with ID 7"));

        assertDoesNotThrow(() -> orchestrator.process(JOB_ID));

        verify(lifecycle).fail(eq(JOB_ID), eq(ErrorCode.INTERNAL_ERROR), contains("IllegalStateException"));
    }

    private void givenJobFor(String key, byte[] content) {
        givenJob(key);
        when(objectStore.get(BUCKET, key)).thenReturn(new StoredObject(content, null, content.length));
    }

    private void givenJob(String key) {
        IngestionJob job = new IngestionJob();
        job.setId(JOB_ID);
        job.setBucket(BUCKET);
        job.setFileKey(key);
        job.setState(JobState.RECEIVED);
        when(lifecycle.start(JOB_ID)).thenReturn(job);
    }
}
