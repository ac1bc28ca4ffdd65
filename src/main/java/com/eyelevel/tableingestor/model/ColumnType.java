package com.eyelevel.tableingestor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.sql.Types;

/**
 * The column types the schema synthesizer can infer, with their SQL column definitions.
 */
@Getter
@RequiredArgsConstructor
public enum ColumnType {
    TEXT("VARCHAR"),
    INTEGER("BIGINT"),
    REAL("DOUBLE PRECISION"),
    DATE("DATE");

    private final String sqlType;

    /**
     * Maps a JDBC type code reported by database metadata back onto a column type.
     *
     * @param jdbcType a {@link Types} constant.
     * @return the matching column type; unknown codes are treated as {@link #TEXT}.
     */
    public static ColumnType fromJdbcType(int jdbcType) {
        return switch (jdbcType) {
            case Types.BIGINT, Types.INTEGER, Types.SMALLINT, Types.TINYINT -> INTEGER;
            case Types.DOUBLE, Types.FLOAT, Types.REAL, Types.NUMERIC, Types.DECIMAL -> REAL;
            case Types.DATE -> DATE;
            default -> TEXT;
        };
    }
}
