package com.eyelevel.tableingestor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A persisted page slot of the document extracted for an OCR job, including pages that failed.
 */
@Entity
@Table(name = "ingestion_document_page",
        uniqueConstraints = @UniqueConstraint(name = "uk_document_page", columnNames = {"jobId", "pageNumber"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentPageRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long jobId;

    @Column(nullable = false)
    private int pageNumber;

    @Column(columnDefinition = "TEXT")
    private String text;

    @Column(nullable = false)
    private boolean ok;
}
