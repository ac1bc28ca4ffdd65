package com.eyelevel.tableingestor.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * In-memory tabular data ready for loading. Rows are keyed by {@link ColumnSpec#getSanitizedName()}
 * and hold typed values ({@code Long}, {@code Double}, {@code LocalDate}, {@code String} or {@code null}).
 */
@Value
@Builder
public class ParsedTable {
    String tableName;
    TableOrigin origin;
    @Singular
    List<ColumnSpec> columns;
    @Singular
    List<Map<String, Object>> rows;

    public List<String> columnNames() {
        return columns.stream().map(ColumnSpec::getSanitizedName).toList();
    }
}
