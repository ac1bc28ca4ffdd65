package com.eyelevel.tableingestor.model;

/**
 * Name and type of a column of an ingested table, as stored in the table registry.
 */
public record TableColumn(String name, ColumnType type) {

    public static TableColumn from(ColumnSpec column) {
        return new TableColumn(column.getSanitizedName(), column.getInferredType());
    }
}
