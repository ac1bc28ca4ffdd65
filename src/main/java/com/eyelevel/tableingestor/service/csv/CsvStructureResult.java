package com.eyelevel.tableingestor.service.csv;

import com.eyelevel.tableingestor.model.ColumnSpec;
import com.eyelevel.tableingestor.model.JobIssue;

import java.util.List;
import java.util.Map;

/**
 * Typed columns and rows parsed from a delimited file, plus warnings for rows that were skipped.
 */
public record CsvStructureResult(List<ColumnSpec> columns, List<Map<String, Object>> rows, List<JobIssue> warnings) {
}
