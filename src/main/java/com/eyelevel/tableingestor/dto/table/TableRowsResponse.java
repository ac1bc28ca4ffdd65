package com.eyelevel.tableingestor.dto.table;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

@Schema(description = "A page of rows from an ingested table, each row keyed by column name.")
public record TableRowsResponse(String tableName, int limit, long offset, List<Map<String, Object>> rows) {
}
