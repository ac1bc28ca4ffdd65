package com.eyelevel.tableingestor.service.query;

import com.eyelevel.tableingestor.common.json.JsonParser;
import com.eyelevel.tableingestor.dto.table.TableRowsResponse;
import com.eyelevel.tableingestor.dto.table.TableSummary;
import com.eyelevel.tableingestor.exception.ResourceNotFoundException;
import com.eyelevel.tableingestor.model.ColumnSpec;
import com.eyelevel.tableingestor.model.IngestedTable;
import com.eyelevel.tableingestor.model.TableColumn;
import com.eyelevel.tableingestor.repository.IngestedTableRepository;
import com.eyelevel.tableingestor.service.load.RelationalStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Read-side access to tables created by the loader. Only tables in the registry are readable, so
 * arbitrary database tables can never be reached through a caller-supplied name.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableQueryService {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    private final IngestedTableRepository tableRepository;
    private final RelationalStore relationalStore;
    private final JsonParser jsonParser;

    public List<TableSummary> listTables() {
        return tableRepository.findAllByOrderByTableNameAsc().stream()
                .map(this::toSummary)
                .toList();
    }

    public TableRowsResponse fetchRows(String tableName, Integer limit, Long offset) {
        IngestedTable table = tableRepository.findByTableName(tableName)
                .orElseThrow(() -> new ResourceNotFoundException("Table not found: " + tableName));
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : limit;
        long effectiveOffset = offset == null ? 0L : offset;
        if (effectiveLimit < 1 || effectiveLimit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (effectiveOffset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }

        List<String> columnNames = columnNamesOf(table);
        log.debug("Reading {} rows from '{}' at offset {}", effectiveLimit, tableName, effectiveOffset);
        return new TableRowsResponse(table.getTableName(), effectiveLimit, effectiveOffset,
                relationalStore.selectRows(table.getTableName(), columnNames, effectiveLimit, effectiveOffset));
    }

    private List<String> columnNamesOf(IngestedTable table) {
        List<TableColumn> registered = parseColumns(table);
        if (!registered.isEmpty()) {
            return registered.stream().map(TableColumn::name).toList();
        }
        return relationalStore.describeTable(table.getTableName())
                .map(columns -> columns.stream().map(ColumnSpec::getSanitizedName).toList())
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Table is registered but missing from the database: " + table.getTableName()));
    }

    private TableSummary toSummary(IngestedTable table) {
        return new TableSummary(table.getTableName(), table.getOrigin(), parseColumns(table), table.getTotalRows(),
                table.getCreatedAt(), table.getUpdatedAt());
    }

    private List<TableColumn> parseColumns(IngestedTable table) {
        if (table.getColumnsJson() == null || table.getColumnsJson().isBlank()) {
            return List.of();
        }
        return Arrays.asList(jsonParser.parseObject(table.getColumnsJson(), TableColumn[].class));
    }
}
