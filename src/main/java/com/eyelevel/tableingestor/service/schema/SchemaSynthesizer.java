package com.eyelevel.tableingestor.service.schema;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.model.ColumnSpec;
import com.eyelevel.tableingestor.model.ColumnType;
import com.eyelevel.tableingestor.model.ExtractedDocument;
import com.eyelevel.tableingestor.model.ExtractedPage;
import com.eyelevel.tableingestor.model.ParsedTable;
import com.eyelevel.tableingestor.model.TableOrigin;
import com.eyelevel.tableingestor.service.csv.CsvStructureResult;
import com.eyelevel.tableingestor.service.csv.IdentifierSanitizer;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the target table for parsed content. Both paths are deterministic: the same input
 * always yields the same table name and column set.
 */
@Component
@RequiredArgsConstructor
public class SchemaSynthesizer {

    public static final String SOURCE_FILE = "source_file";
    public static final String PAGE_NUMBER = "page_number";
    public static final String LINE_NUMBER = "line_number";
    public static final String TEXT = "text";

    public static final List<ColumnSpec> OCR_COLUMNS = List.of(
            ColumnSpec.of(SOURCE_FILE, ColumnType.TEXT),
            ColumnSpec.of(PAGE_NUMBER, ColumnType.INTEGER),
            ColumnSpec.of(LINE_NUMBER, ColumnType.INTEGER),
            ColumnSpec.of(TEXT, ColumnType.TEXT));

    private final IngestionConfig config;

    /**
     * Table name of a delimited file: its base name without directories and extension, sanitized.
     */
    public static String tableNameFor(String key) {
        return IdentifierSanitizer.tableName(FilenameUtils.getBaseName(key));
    }

    public ParsedTable fromCsv(String key, CsvStructureResult structured) {
        return ParsedTable.builder()
                .tableName(tableNameFor(key))
                .origin(TableOrigin.CSV)
                .columns(structured.columns())
                .rows(structured.rows())
                .build();
    }

    /**
     * Maps a document onto the shared OCR table: one row per non-blank line, numbered from 1
     * within each page. Failed pages contribute no rows.
     */
    public ParsedTable fromDocument(ExtractedDocument document) {
        ParsedTable.ParsedTableBuilder table = ParsedTable.builder()
                .tableName(ocrTableName())
                .origin(TableOrigin.OCR)
                .columns(OCR_COLUMNS);
        for (ExtractedPage page : document.pages()) {
            if (!page.ok() || page.text() == null) {
                continue;
            }
            long lineNumber = 0;
            for (String line : page.text().lines().map(String::strip).filter(l -> !l.isEmpty()).toList()) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put(SOURCE_FILE, document.sourceFile());
                row.put(PAGE_NUMBER, (long) page.pageNumber());
                row.put(LINE_NUMBER, ++lineNumber);
                row.put(TEXT, line);
                table.row(row);
            }
        }
        return table.build();
    }

    public String ocrTableName() {
        return IdentifierSanitizer.tableName(config.getOcr().getTableName());
    }
}
