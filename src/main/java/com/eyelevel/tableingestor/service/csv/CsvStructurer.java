package com.eyelevel.tableingestor.service.csv;

import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.exception.EmptyContentException;
import com.eyelevel.tableingestor.model.ColumnSpec;
import com.eyelevel.tableingestor.model.ColumnType;
import com.eyelevel.tableingestor.model.ErrorCode;
import com.eyelevel.tableingestor.model.JobIssue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses delimited text into sanitized, typed columns and rows.
 * <p>
 * The first non-empty record is the header. Records whose field count differs from the header
 * are skipped with a {@link ErrorCode#MALFORMED_CSV_ROW} warning; the remaining rows are kept.
 * Column types are inferred over the complete column before any value is converted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CsvStructurer {

    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t', '|'};
    private static final char BOM = '\uFEFF';

    private final IngestionConfig config;

    public CsvStructureResult structure(byte[] content, String contextInfo) {
        String text = decode(content);
        char delimiter = resolveDelimiter(text);
        log.info("[{}] Structuring {} characters of delimited text with delimiter '{}'.", contextInfo, text.length(),
                printable(delimiter));

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setIgnoreEmptyLines(true)
                .build();

        List<String> rawHeaders = null;
        List<CSVRecord> records = new ArrayList<>();
        List<JobIssue> warnings = new ArrayList<>();

        try (CSVParser parser = CSVParser.parse(text, format)) {
            Iterator<CSVRecord> iterator = parser.iterator();
            while (iterator.hasNext()) {
                CSVRecord record = iterator.next();
                if (isBlank(record)) {
                    continue;
                }
                if (rawHeaders == null) {
                    rawHeaders = record.toList();
                    continue;
                }
                if (record.size() != rawHeaders.size()) {
                    String message = String.format("Record %d has %d fields, expected %d; row skipped.",
                            record.getRecordNumber(), record.size(), rawHeaders.size());
                    log.warn("[{}] {}", contextInfo, message);
                    warnings.add(JobIssue.warning(ErrorCode.MALFORMED_CSV_ROW, message));
                    continue;
                }
                records.add(record);
            }
        } catch (UncheckedIOException | IOException e) {
            // Rows tokenized before the error are kept; the rest of the file is unreadable.
            String message = String.format("Parsing stopped after %d rows: %s", records.size(), e.getMessage());
            log.warn("[{}] {}", contextInfo, message);
            warnings.add(JobIssue.warning(ErrorCode.MALFORMED_CSV_ROW, message));
        }

        if (rawHeaders == null) {
            throw new EmptyContentException("Delimited file has no header line");
        }

        List<ColumnSpec> columns = buildColumns(rawHeaders, records);
        List<Map<String, Object>> rows = new ArrayList<>(records.size());
        for (CSVRecord record : records) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                ColumnSpec column = columns.get(i);
                row.put(column.getSanitizedName(), ColumnTypeInferrer.convert(record.get(i), column.getInferredType()));
            }
            rows.add(row);
        }
        log.info("[{}] Structured {} columns and {} rows ({} warnings).", contextInfo, columns.size(), rows.size(),
                warnings.size());
        return new CsvStructureResult(columns, rows, warnings);
    }

    private List<ColumnSpec> buildColumns(List<String> rawHeaders, List<CSVRecord> records) {
        List<String> names = IdentifierSanitizer.columnNames(rawHeaders);
        List<ColumnSpec> columns = new ArrayList<>(names.size());
        for (int i = 0; i < names.size(); i++) {
            List<String> values = new ArrayList<>(records.size());
            for (CSVRecord record : records) {
                values.add(record.get(i));
            }
            ColumnType type = ColumnTypeInferrer.infer(values);
            columns.add(ColumnSpec.builder()
                    .rawHeader(rawHeaders.get(i))
                    .sanitizedName(names.get(i))
                    .inferredType(type)
                    .build());
        }
        return columns;
    }

    private String decode(byte[] content) {
        String text = new String(content, Charset.forName(config.getCsv().getCharset()));
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }

    private char resolveDelimiter(String text) {
        String configured = config.getCsv().getDelimiter();
        if (StringUtils.hasLength(configured)) {
            return "\\t".equals(configured) ? '\t' : configured.charAt(0);
        }
        return inferDelimiter(text);
    }

    /**
     * Picks the candidate occurring most often outside quotes in the first non-empty line.
     * Ties and lines without any candidate resolve to a comma.
     */
    static char inferDelimiter(String text) {
        String firstLine = text.lines().filter(line -> !line.isBlank()).findFirst().orElse("");
        int[] counts = new int[CANDIDATE_DELIMITERS.length];
        boolean quoted = false;
        for (char c : firstLine.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
                continue;
            }
            if (quoted) {
                continue;
            }
            for (int i = 0; i < CANDIDATE_DELIMITERS.length; i++) {
                if (c == CANDIDATE_DELIMITERS[i]) {
                    counts[i]++;
                }
            }
        }
        int best = 0;
        boolean tie = false;
        for (int i = 1; i < counts.length; i++) {
            if (counts[i] > counts[best]) {
                best = i;
                tie = false;
            } else if (counts[i] == counts[best]) {
                tie = true;
            }
        }
        if (counts[best] == 0 || tie) {
            return ',';
        }
        return CANDIDATE_DELIMITERS[best];
    }

    private static boolean isBlank(CSVRecord record) {
        for (String value : record) {
            if (StringUtils.hasText(value)) {
                return false;
            }
        }
        return true;
    }

    private static String printable(char delimiter) {
        return delimiter == '\t' ? "\\t" : String.valueOf(delimiter);
    }
}
