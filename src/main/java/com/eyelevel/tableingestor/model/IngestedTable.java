package com.eyelevel.tableingestor.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * Registry entry for a table created by the loader. The read side only exposes registered tables.
 */
@Entity
@Table(name = "ingested_table")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestedTable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String tableName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TableOrigin origin;

    @Column(columnDefinition = "TEXT")
    private String columnsJson;

    @Column(nullable = false)
    private long totalRows;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
