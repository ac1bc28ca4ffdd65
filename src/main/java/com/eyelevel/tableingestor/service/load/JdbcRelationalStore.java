package com.eyelevel.tableingestor.service.load;

import com.eyelevel.tableingestor.model.ColumnSpec;
import com.eyelevel.tableingestor.model.ColumnType;
import com.eyelevel.tableingestor.service.csv.IdentifierSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * {@link RelationalStore} on Spring's {@link JdbcTemplate}. Every identifier is validated and
 * double-quoted, so table and column names are stored lowercase on both H2 and PostgreSQL.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcRelationalStore implements RelationalStore {

    private final JdbcTemplate jdbcTemplate;

    private void execute(String sql) {
        log.debug("Executing statement: {}", sql);
        jdbcTemplate.execute(sql);
    }

    @Override
    public Optional<List<ColumnSpec>> describeTable(String tableName) {
        requireValidIdentifier(tableName);
        List<ColumnSpec> columns = jdbcTemplate.execute((ConnectionCallback<List<ColumnSpec>>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            String pattern = escapeLikePattern(tableName, metaData.getSearchStringEscape());
            // keyed by ordinal position
            Map<Integer, ColumnSpec> found = new TreeMap<>();
            try (ResultSet rs = metaData.getColumns(connection.getCatalog(), connection.getSchema(), pattern, null)) {
                while (rs.next()) {
                    if (tableName.equals(rs.getString("TABLE_NAME"))) {
                        found.put(rs.getInt("ORDINAL_POSITION"), ColumnSpec.of(rs.getString("COLUMN_NAME"),
                                ColumnType.fromJdbcType(rs.getInt("DATA_TYPE"))));
                    }
                }
            }
            return new ArrayList<>(found.values());
        });
        log.debug("Described table {}: {} columns", tableName, columns == null ? 0 : columns.size());
        return columns == null || columns.isEmpty() ? Optional.empty() : Optional.of(columns);
    }

    @Override
    public void createTableIfNotExists(String tableName, List<ColumnSpec> columns) {
        String definition = columns.stream()
                .map(column -> quote(column.getSanitizedName()) + " " + column.getInferredType().getSqlType())
                .collect(Collectors.joining(", "));
        execute("CREATE TABLE IF NOT EXISTS " + quote(tableName) + " (" + definition + ")");
    }

    @Override
    public int insertRows(String tableName, List<ColumnSpec> columns, List<Map<String, Object>> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        String columnList = columns.stream().map(c -> quote(c.getSanitizedName())).collect(Collectors.joining(", "));
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + quote(tableName) + " (" + columnList + ") VALUES (" + placeholders + ")";

        List<Object[]> batch = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                values[i] = toJdbcValue(row.get(columns.get(i).getSanitizedName()));
            }
            batch.add(values);
        }
        jdbcTemplate.batchUpdate(sql, batch);
        return rows.size();
    }

    @Override
    public List<Map<String, Object>> selectRows(String tableName, List<String> columnNames, int limit, long offset) {
        String columnList = columnNames.stream().map(JdbcRelationalStore::quote).collect(Collectors.joining(", "));
        String sql = "SELECT " + columnList + " FROM " + quote(tableName) + " LIMIT ? OFFSET ?";
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < columnNames.size(); i++) {
                Object value = rs.getObject(i + 1);
                row.put(columnNames.get(i), value instanceof java.sql.Date date ? date.toLocalDate() : value);
            }
            return row;
        }, limit, offset);
    }

    static String quote(String identifier) {
        requireValidIdentifier(identifier);
        return "\"" + identifier + "\"";
    }

    private static void requireValidIdentifier(String identifier) {
        if (!IdentifierSanitizer.isValid(identifier)) {
            throw new IllegalArgumentException("Unsafe SQL identifier: " + identifier);
        }
    }

    private static Object toJdbcValue(Object value) {
        return value instanceof LocalDate date ? java.sql.Date.valueOf(date) : value;
    }

    private static String escapeLikePattern(String name, String escape) {
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape).replace("_", escape + "_").replace("%", escape + "%");
    }
}
