package com.eyelevel.tableingestor.controller;

import com.eyelevel.tableingestor.dto.common.ApiResponse;
import com.eyelevel.tableingestor.dto.ingestion.DocumentResponse;
import com.eyelevel.tableingestor.dto.ingestion.JobStatusResponse;
import com.eyelevel.tableingestor.dto.ingestion.UploadEventRequest;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.UploadEvent;
import com.eyelevel.tableingestor.service.pipeline.IngestionTrigger;
import com.eyelevel.tableingestor.service.query.JobQueryService;
import com.eyelevel.tableingestor.service.upload.UploadService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST controller for triggering ingestion and reading job status.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/ingestion")
@RequiredArgsConstructor
@Validated
public class IngestionController implements IngestionApi {

    private final IngestionTrigger ingestionTrigger;
    private final UploadService uploadService;
    private final JobQueryService jobQueryService;

    // --- 1. TRIGGER ENDPOINTS ---

    @Override
    @PostMapping("/v1/events")
    public ResponseEntity<ApiResponse<JobStatusResponse>> submitEvent(@Valid @RequestBody final UploadEventRequest request) {
        log.info("Received upload event for s3://{}/{}", request.getBucket(), request.getKey());

        IngestionJob job = ingestionTrigger.accept(new UploadEvent(request.getBucket(), request.getKey()));

        return accepted(JobStatusResponse.from(job), "Upload event accepted for ingestion.");
    }

    @Override
    @PostMapping(value = "/v1/uploads", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ApiResponse<JobStatusResponse>> uploadFile(
            @RequestPart("file") final MultipartFile file,
            @RequestParam(value = "bucket", required = false) final String bucket,
            @RequestParam(value = "key", required = false) final String key,
            @RequestParam(value = "overwrite", defaultValue = "false") final boolean overwrite) {

        log.info("Received file upload: name={}, size={}, bucket={}, key={}, overwrite={}",
                file.getOriginalFilename(), file.getSize(), bucket, key, overwrite);

        IngestionJob job = uploadService.upload(file, bucket, key, overwrite);

        return accepted(JobStatusResponse.from(job), "File stored and scheduled for ingestion.");
    }

    // --- 2. STATUS ENDPOINTS ---

    @Override
    @GetMapping("/v1/jobs/{jobId}")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getJob(
            @PathVariable("jobId") @Positive(message = "Job ID must be a positive number.") final Long jobId) {

        ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(jobQueryService.getJob(jobId))
                .displayMessage("Job status retrieved successfully.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/jobs")
    public ResponseEntity<ApiResponse<List<JobStatusResponse>>> findJobs(
            @RequestParam("bucket") @NotBlank(message = "The 'bucket' parameter cannot be empty.") final String bucket,
            @RequestParam("key") @NotBlank(message = "The 'key' parameter cannot be empty.") final String key) {

        List<JobStatusResponse> jobs = jobQueryService.findJobs(bucket, key);

        ApiResponse<List<JobStatusResponse>> response = ApiResponse.<List<JobStatusResponse>>builder()
                .response(jobs)
                .displayMessage(String.format("Found %d job(s) for the object.", jobs.size()))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/jobs/{jobId}/document")
    public ResponseEntity<ApiResponse<DocumentResponse>> getDocument(
            @PathVariable("jobId") @Positive(message = "Job ID must be a positive number.") final Long jobId) {

        ApiResponse<DocumentResponse> response = ApiResponse.<DocumentResponse>builder()
                .response(jobQueryService.getDocument(jobId))
                .displayMessage("Extracted document retrieved successfully.")
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    private ResponseEntity<ApiResponse<JobStatusResponse>> accepted(JobStatusResponse job, String message) {
        ApiResponse<JobStatusResponse> response = ApiResponse.<JobStatusResponse>builder()
                .response(job)
                .displayMessage(message)
                .showMessage(true)
                .statusCode(HttpStatus.ACCEPTED.value())
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
