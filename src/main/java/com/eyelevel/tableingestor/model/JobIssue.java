package com.eyelevel.tableingestor.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One itemized warning or error recorded against a job.
 */
@Data
@Embeddable
@NoArgsConstructor
@AllArgsConstructor
public class JobIssue {

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private IssueSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ErrorCode code;

    @Column(columnDefinition = "TEXT")
    private String message;

    public static JobIssue warning(ErrorCode code, String message) {
        return new JobIssue(IssueSeverity.WARNING, code, message);
    }

    public static JobIssue error(ErrorCode code, String message) {
        return new JobIssue(IssueSeverity.ERROR, code, message);
    }
}
