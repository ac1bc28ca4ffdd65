package com.eyelevel.tableingestor.dto.table;

import com.eyelevel.tableingestor.model.TableColumn;
import com.eyelevel.tableingestor.model.TableOrigin;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.List;

@Schema(description = "A table created by the ingestion pipeline.")
public record TableSummary(String tableName, TableOrigin origin, List<TableColumn> columns, long totalRows,
                           LocalDateTime createdAt, LocalDateTime updatedAt) {
}
