package com.eyelevel.tableingestor.dto.ingestion;

import com.eyelevel.tableingestor.model.ErrorCode;
import com.eyelevel.tableingestor.model.IngestionJob;
import com.eyelevel.tableingestor.model.JobIssue;
import com.eyelevel.tableingestor.model.JobState;
import com.eyelevel.tableingestor.model.Kind;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.List;

@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Status of an ingestion job with its itemized warnings and errors.")
public class JobStatusResponse {
    private final Long jobId;
    private final String bucket;
    private final String fileKey;
    private final String contentHash;
    private final Kind kind;
    private final JobState state;
    private final String currentStage;
    private final int attempts;
    private final ErrorCode errorCode;
    private final String errorMessage;
    private final String tableName;
    private final Integer rowsLoaded;
    private final Long duplicateOfJobId;
    private final List<JobIssue> issues;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;

    public static JobStatusResponse from(IngestionJob job) {
        return JobStatusResponse.builder()
                .jobId(job.getId())
                .bucket(job.getBucket())
                .fileKey(job.getFileKey())
                .contentHash(job.getContentHash())
                .kind(job.getKind())
                .state(job.getState())
                .currentStage(job.getCurrentStage())
                .attempts(job.getAttempts())
                .errorCode(job.getErrorCode())
                .errorMessage(job.getErrorMessage())
                .tableName(job.getTableName())
                .rowsLoaded(job.getRowsLoaded())
                .duplicateOfJobId(job.getDuplicateOfJobId())
                .issues(List.copyOf(job.getIssues()))
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .build();
    }
}
