package com.eyelevel.tableingestor.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One ingestion run for one upload event. Once it reaches a terminal state only its status
 * fields may change.
 */
@Entity
@Table(name = "ingestion_job", indexes = {
        @Index(name = "idx_ingestion_job_source", columnList = "bucket, fileKey, contentHash")
})
@Data
public class IngestionJob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String bucket;

    @Column(nullable = false, length = 1024)
    private String fileKey;

    private String fileName;

    private String extension;

    private String declaredContentType;

    private Long sizeBytes;

    @Column(length = 64)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    private Kind kind;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState state;

    @Column
    private String currentStage;

    @Column(nullable = false)
    private int attempts;

    @Enumerated(EnumType.STRING)
    private ErrorCode errorCode;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private String tableName;

    private Integer rowsLoaded;

    /**
     * Set when this job reused the outcome of an earlier job that ingested identical content.
     */
    private Long duplicateOfJobId;

    @Column(columnDefinition = "TEXT")
    private String remark;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "ingestion_job_issue", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "issue_order")
    private List<JobIssue> issues = new ArrayList<>();

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;

    @Transient
    public boolean hasWarnings() {
        return issues.stream().anyMatch(issue -> issue.getSeverity() == IssueSeverity.WARNING);
    }
}
