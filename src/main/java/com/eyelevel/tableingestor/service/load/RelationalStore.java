package com.eyelevel.tableingestor.service.load;

import com.eyelevel.tableingestor.model.ColumnSpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dynamic-table access to the relational store. Calls made inside a Spring-managed transaction
 * join it, so inserts can be grouped with other writes.
 */
public interface RelationalStore {

    /**
     * @return the columns of the table in ordinal order, or empty if the table does not exist.
     */
    Optional<List<ColumnSpec>> describeTable(String tableName);

    void createTableIfNotExists(String tableName, List<ColumnSpec> columns);

    /**
     * @return the number of rows written.
     */
    int insertRows(String tableName, List<ColumnSpec> columns, List<Map<String, Object>> rows);

    /**
     * Reads a page of rows as column-name keyed maps in table column order.
     */
    List<Map<String, Object>> selectRows(String tableName, List<String> columnNames, int limit, long offset);
}
