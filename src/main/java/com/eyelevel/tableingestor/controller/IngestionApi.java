package com.eyelevel.tableingestor.controller;

import com.eyelevel.tableingestor.dto.common.ApiResponse;
import com.eyelevel.tableingestor.dto.ingestion.DocumentResponse;
import com.eyelevel.tableingestor.dto.ingestion.JobStatusResponse;
import com.eyelevel.tableingestor.dto.ingestion.UploadEventRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@Tag(name = "Ingestion", description = "Endpoints for triggering file ingestion and monitoring ingestion jobs.")
public interface IngestionApi {

    @Operation(summary = "Submit Upload Event",
            description = "Accepts a {bucket, key} upload event, records a RECEIVED job and schedules it on the worker pool. Equivalent to a bucket notification arriving on the queue.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Event accepted and job scheduled.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Accepted", value = """
                                    {
                                        "displayMessage": "Upload event accepted for ingestion.",
                                        "response": {
                                            "jobId": 7,
                                            "bucket": "uploads",
                                            "fileKey": "incoming/sales_2024.csv",
                                            "state": "RECEIVED",
                                            "currentStage": "Awaiting worker",
                                            "attempts": 0,
                                            "issues": []
                                        },
                                        "showMessage": true,
                                        "statusCode": 202
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing bucket or key.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> submitEvent(@Valid @RequestBody UploadEventRequest request);

    @Operation(summary = "Upload File",
            description = "Stores a file in the object store and triggers its ingestion. The key defaults to the file name and the bucket to the configured upload bucket.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "File stored and job scheduled.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Empty file or no target bucket.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - Object exists and overwrite is false.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> uploadFile(
            @Parameter(description = "The file to ingest.", required = true)
            @RequestPart("file") MultipartFile file,
            @Parameter(description = "Target bucket. Defaults to the configured upload bucket.", example = "uploads")
            @RequestParam(value = "bucket", required = false) String bucket,
            @Parameter(description = "Target object key. Defaults to the uploaded file name.", example = "incoming/invoice.pdf")
            @RequestParam(value = "key", required = false) String key,
            @Parameter(description = "If true, replaces an existing object with the same key.")
            @RequestParam(value = "overwrite", defaultValue = "false") boolean overwrite);

    @Operation(summary = "Get Job Status",
            description = "Returns the state, current stage, target table and itemized warnings and errors of an ingestion job.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Completed with warnings", value = """
                                    {
                                        "displayMessage": "Job status retrieved successfully.",
                                        "response": {
                                            "jobId": 7,
                                            "bucket": "uploads",
                                            "fileKey": "scans/invoice.pdf",
                                            "kind": "PDF",
                                            "state": "COMPLETED_WITH_WARNINGS",
                                            "currentStage": "Completed",
                                            "attempts": 1,
                                            "tableName": "ocr_text",
                                            "rowsLoaded": 41,
                                            "issues": [
                                                {"severity": "WARNING", "code": "OCR_PAGE_FAILURE", "message": "Page 2 could not be read"}
                                            ]
                                        },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<JobStatusResponse>> getJob(
            @Parameter(description = "The ID of the ingestion job.", required = true, example = "7")
            @PathVariable("jobId") Long jobId);

    @Operation(summary = "Find Jobs For Object",
            description = "Lists every ingestion job recorded for an object key, newest first.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Jobs retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<JobStatusResponse>>> findJobs(
            @Parameter(description = "Bucket of the object.", required = true, example = "uploads")
            @RequestParam("bucket") String bucket,
            @Parameter(description = "Key of the object.", required = true, example = "incoming/sales_2024.csv")
            @RequestParam("key") String key);

    @Operation(summary = "Get Extracted Document",
            description = "Returns the page-by-page OCR text stored for an image or PDF job, failed pages included.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Document retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found or no document stored.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<DocumentResponse>> getDocument(
            @Parameter(description = "The ID of the ingestion job.", required = true, example = "7")
            @PathVariable("jobId") Long jobId);
}
