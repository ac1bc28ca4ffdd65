package com.eyelevel.tableingestor.model;

import lombok.Builder;
import lombok.Value;

/**
 * A single column of a {@link ParsedTable}.
 * {@code sanitizedName} is unique within its table, lowercase and limited to {@code [a-z0-9_]}.
 */
@Value
@Builder
public class ColumnSpec {
    String rawHeader;
    String sanitizedName;
    ColumnType inferredType;

    public static ColumnSpec of(String name, ColumnType type) {
        return new ColumnSpec(name, name, type);
    }
}
