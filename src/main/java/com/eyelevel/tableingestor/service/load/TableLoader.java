package com.eyelevel.tableingestor.service.load;

import com.eyelevel.tableingestor.common.json.JsonSerializer;
import com.eyelevel.tableingestor.config.IngestionConfig;
import com.eyelevel.tableingestor.exception.IngestionException;
import com.eyelevel.tableingestor.exception.SchemaConflictException;
import com.eyelevel.tableingestor.exception.StageTimeoutException;
import com.eyelevel.tableingestor.exception.TableLoadException;
import com.eyelevel.tableingestor.exception.TransientStoreException;
import com.eyelevel.tableingestor.model.ColumnSpec;
import com.eyelevel.tableingestor.model.ColumnType;
import com.eyelevel.tableingestor.model.IngestedTable;
import com.eyelevel.tableingestor.model.ParsedTable;
import com.eyelevel.tableingestor.model.TableColumn;
import com.eyelevel.tableingestor.model.TableLoad;
import com.eyelevel.tableingestor.repository.IngestedTableRepository;
import com.eyelevel.tableingestor.repository.TableLoadRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Creates the target table when absent and writes a file's rows in one transaction together with
 * the load ledger entry and the table registry update. An existing table with different columns
 * is never altered; the load fails with a schema conflict instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableLoader {

    private static final String STAGE = "LOAD";

    private final IngestionConfig config;
    private final RelationalStore relationalStore;
    private final TableLockRegistry tableLockRegistry;
    private final PlatformTransactionManager transactionManager;
    private final TableLoadRepository tableLoadRepository;
    private final IngestedTableRepository ingestedTableRepository;
    private final JsonSerializer jsonSerializer;

    public LoadResult load(ParsedTable table, LoadRequest request) {
        Duration budget = config.getTimeouts().getLoad();
        return tableLockRegistry.withLock(table.getTableName(), budget, () -> {
            try {
                return loadInTransaction(table, request, budget);
            } catch (RuntimeException e) {
                throw translate(table.getTableName(), budget, e);
            }
        });
    }

    private void ensureTable(ParsedTable table, String contextInfo) {
        String tableName = table.getTableName();
        Optional<List<ColumnSpec>> existing = relationalStore.describeTable(tableName);
        if (existing.isEmpty()) {
            log.info("[{}] Creating table '{}' with columns {}.", contextInfo, tableName, table.columnNames());
            relationalStore.createTableIfNotExists(tableName, table.getColumns());
            existing = relationalStore.describeTable(tableName);
            if (existing.isEmpty()) {
                throw new TableLoadException("Table '" + tableName + "' could not be created", null);
            }
        }
        checkCompatible(tableName, existing.get(), table.getColumns());
    }

    /**
     * Compatible iff both sides have the same column names and every column has the same type.
     */
    static void checkCompatible(String tableName, List<ColumnSpec> existing, List<ColumnSpec> wanted) {
        Map<String, ColumnType> existingTypes = existing.stream()
                .collect(Collectors.toMap(ColumnSpec::getSanitizedName, ColumnSpec::getInferredType));
        Map<String, ColumnType> wantedTypes = wanted.stream()
                .collect(Collectors.toMap(ColumnSpec::getSanitizedName, ColumnSpec::getInferredType));
        if (existingTypes.equals(wantedTypes)) {
            return;
        }
        throw new SchemaConflictException(String.format("Table '%s' exists with columns %s but the file needs %s",
                tableName, describe(existing), describe(wanted)));
    }

    /**
     * Table creation, row insert, ledger entry and registry update share one transaction. On
     * PostgreSQL the DDL is transactional too, so a failed or timed-out load leaves no empty table
     * behind; on engines whose DDL auto-commits (H2, MySQL) the created table survives empty.
     */
    private LoadResult loadInTransaction(ParsedTable table, LoadRequest request, Duration budget) {
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        transaction.setTimeout((int) Math.max(1, budget.toSeconds()));
        return transaction.execute(status -> {
            String tableName = table.getTableName();
            Optional<TableLoad> previous = tableLoadRepository.findByTableNameAndSourceKeyAndContentHash(tableName,
                    request.sourceKey(), request.contentHash());
            if (previous.isPresent()) {
                log.info("[{}] Content of '{}' was already loaded into '{}' by job {}; skipping insert.",
                        request.contextInfo(), request.sourceKey(), tableName, previous.get().getJobId());
                return new LoadResult(tableName, 0, true, previous.get().getJobId());
            }

            ensureTable(table, request.contextInfo());
            int inserted = relationalStore.insertRows(tableName, table.getColumns(), table.getRows());
            tableLoadRepository.save(TableLoad.builder()
                    .tableName(tableName)
                    .sourceKey(request.sourceKey())
                    .contentHash(request.contentHash())
                    .jobId(request.jobId())
                    .rowCount(inserted)
                    .build());
            updateRegistry(table, inserted);
            log.info("[{}] Inserted {} rows into '{}'.", request.contextInfo(), inserted, tableName);
            return new LoadResult(tableName, inserted, false, request.jobId());
        });
    }

    private void updateRegistry(ParsedTable table, int inserted) {
        IngestedTable entry = ingestedTableRepository.findByTableName(table.getTableName())
                .orElseGet(() -> IngestedTable.builder()
                        .tableName(table.getTableName())
                        .origin(table.getOrigin())
                        .build());
        entry.setColumnsJson(jsonSerializer.serialize(table.getColumns().stream().map(TableColumn::from).toList()));
        entry.setTotalRows(entry.getTotalRows() + inserted);
        ingestedTableRepository.save(entry);
    }

    private RuntimeException translate(String tableName, Duration budget, RuntimeException e) {
        if (e instanceof IngestionException) {
            return e;
        }
        if (e instanceof QueryTimeoutException || e instanceof TransactionTimedOutException) {
            return new StageTimeoutException(STAGE, budget, e);
        }
        if (e instanceof TransientDataAccessException || e instanceof RecoverableDataAccessException
                || e instanceof DataAccessResourceFailureException || e instanceof CannotCreateTransactionException) {
            return new TransientStoreException("Transient failure loading table '" + tableName + "': "
                    + e.getMessage(), e);
        }
        if (e instanceof DataAccessException || e instanceof TransactionException) {
            return new TableLoadException("Failed to load table '" + tableName + "': " + e.getMessage(), e);
        }
        return e;
    }

    private static String describe(List<ColumnSpec> columns) {
        return columns.stream()
                .map(column -> column.getSanitizedName() + " " + column.getInferredType())
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
