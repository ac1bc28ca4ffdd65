package com.eyelevel.tableingestor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Ledger of committed loads. Written in the same transaction as the data rows, so a given
 * content hash from a given object is loaded into a table at most once.
 */
@Entity
@Table(name = "ingestion_table_load",
        uniqueConstraints = @UniqueConstraint(name = "uk_table_load_source",
                columnNames = {"tableName", "sourceKey", "contentHash"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableLoad {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tableName;

    @Column(nullable = false, length = 1100)
    private String sourceKey;

    @Column(nullable = false, length = 64)
    private String contentHash;

    @Column(nullable = false)
    private Long jobId;

    @Column(nullable = false)
    private int rowCount;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime loadedAt;
}
