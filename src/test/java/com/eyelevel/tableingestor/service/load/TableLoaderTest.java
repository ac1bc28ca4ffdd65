package com.eyelevel.tableingestor.service.load;

import com.eyelevel.tableingestor.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.tableingestor.exception.IngestionException;
import com.eyelevel.tableingestor.exception.SchemaConflictException;
import com.eyelevel.tableingestor.model.ColumnSpec;
import com.eyelevel.tableingestor.model.ColumnType;
import com.eyelevel.tableingestor.model.IngestedTable;
import com.eyelevel.tableingestor.model.ParsedTable;
import com.eyelevel.tableingestor.model.TableOrigin;
import com.eyelevel.tableingestor.repository.IngestedTableRepository;
import com.eyelevel.tableingestor.repository.TableLoadRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against the in-memory H2 database. Test methods are not wrapped in a transaction so the
 * loader's own transaction commits exactly as in production; every test uses its own table.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({TableLoader.class, JdbcRelationalStore.class, TableLockRegistry.class, JacksonJsonSerializer.class,
        TableLoaderTest.JsonConfig.class})
class TableLoaderTest {

    @TestConfiguration
    static class JsonConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }
    }

    private static final List<ColumnSpec> SALES_COLUMNS = List.of(
            ColumnSpec.of("date", ColumnType.DATE),
            ColumnSpec.of("amount", ColumnType.REAL),
            ColumnSpec.of("region", ColumnType.TEXT));

    @Autowired
    private TableLoader tableLoader;

    @Autowired
    private RelationalStore relationalStore;

    @Autowired
    private IngestedTableRepository ingestedTableRepository;

    @Autowired
    private TableLoadRepository tableLoadRepository;

    @Test
    @DisplayName("Should create the table, insert the rows and register the table")
    void load_createsAndRegistersTable() {
        ParsedTable table = salesTable("sales_create", 5);

        LoadResult result = tableLoader.load(table, request(1L, "uploads/sales_create.csv", "hash-1"));

        assertEquals(5, result.rowsInserted());
        assertFalse(result.alreadyLoaded());
        assertEquals(SALES_COLUMNS, relationalStore.describeTable("sales_create").orElseThrow());
        List<Map<String, Object>> rows = relationalStore.selectRows("sales_create",
                List.of("date", "amount", "region"), 100, 0);
        assertEquals(5, rows.size());
        assertEquals(LocalDate.of(2024, 1, 1), rows.get(0).get("date"));

        IngestedTable registered = ingestedTableRepository.findByTableName("sales_create").orElseThrow();
        assertEquals(TableOrigin.CSV, registered.getOrigin());
        assertEquals(5, registered.getTotalRows());
        assertTrue(registered.getColumnsJson().contains("\"amount\""));
        assertTrue(tableLoadRepository.findByTableNameAndSourceKeyAndContentHash("sales_create",
                "uploads/sales_create.csv", "hash-1").isPresent());
    }

    @Test
    @DisplayName("Should not insert the same content from the same object twice")
    void load_identicalReloadIsSkipped() {
        ParsedTable table = salesTable("sales_reload", 3);
        tableLoader.load(table, request(1L, "uploads/sales_reload.csv", "hash-a"));

        LoadResult second = tableLoader.load(table, request(2L, "uploads/sales_reload.csv", "hash-a"));

        assertTrue(second.alreadyLoaded());
        assertEquals(0, second.rowsInserted());
        assertEquals(1L, second.loadedByJobId());
        assertEquals(3, relationalStore.selectRows("sales_reload", List.of("date"), 100, 0).size());
        assertEquals(3, ingestedTableRepository.findByTableName("sales_reload").orElseThrow().getTotalRows());
    }

    @Test
    @DisplayName("Should append changed content with a compatible schema to the existing table")
    void load_appendsCompatibleContent() {
        tableLoader.load(salesTable("sales_append", 2), request(1L, "uploads/sales_append.csv", "hash-a"));

        LoadResult second = tableLoader.load(salesTable("sales_append", 4),
                request(2L, "uploads/sales_append.csv", "hash-b"));

        assertEquals(4, second.rowsInserted());
        assertEquals(6, relationalStore.selectRows("sales_append", List.of("region"), 100, 0).size());
        assertEquals(6, ingestedTableRepository.findByTableName("sales_append").orElseThrow().getTotalRows());
        assertEquals(2, relationalStore.selectRows("sales_append", List.of("region"), 100, 4).size());
    }

    @Test
    @DisplayName("Should fail with a schema conflict and leave the existing table untouched")
    void load_conflictingSchema() {
        tableLoader.load(salesTable("sales_conflict", 2), request(1L, "uploads/sales_conflict.csv", "hash-a"));
        ParsedTable changed = ParsedTable.builder()
                .tableName("sales_conflict")
                .origin(TableOrigin.CSV)
                .columns(List.of(ColumnSpec.of("date", ColumnType.DATE),
                        ColumnSpec.of("amount", ColumnType.TEXT),
                        ColumnSpec.of("region", ColumnType.TEXT)))
                .row(Map.of("date", LocalDate.of(2024, 2, 1), "amount", "n/a", "region", "North"))
                .build();

        LoadRequest request = request(2L, "uploads/sales_conflict.csv", "hash-b");
        SchemaConflictException e = assertThrows(SchemaConflictException.class,
                () -> tableLoader.load(changed, request));

        assertTrue(e.getMessage().contains("sales_conflict"));
        assertEquals(SALES_COLUMNS, relationalStore.describeTable("sales_conflict").orElseThrow());
        assertEquals(2, relationalStore.selectRows("sales_conflict", List.of("amount"), 100, 0).size());
    }

    @Test
    @DisplayName("Should treat column order as irrelevant when checking compatibility")
    void checkCompatible_ignoresOrder() {
        List<ColumnSpec> reversed = List.of(SALES_COLUMNS.get(2), SALES_COLUMNS.get(1), SALES_COLUMNS.get(0));

        assertDoesNotThrow(() -> TableLoader.checkCompatible("t", SALES_COLUMNS, reversed));
        assertThrows(SchemaConflictException.class, () -> TableLoader.checkCompatible("t", SALES_COLUMNS,
                List.of(SALES_COLUMNS.get(0), SALES_COLUMNS.get(1))));
    }

    @Test
    @DisplayName("Should roll back every row of a file when one row of its batch fails")
    void load_failingRowRollsBackWholeFile() {
        tableLoader.load(salesTable("sales_rollback", 2), request(1L, "uploads/sales_rollback.csv", "hash-a"));
        ParsedTable broken = salesTable("sales_rollback", 5);
        broken.getRows().get(3).put("amount", "not-a-number");

        LoadRequest request = request(2L, "uploads/sales_rollback.csv", "hash-b");
        assertThrows(IngestionException.class, () -> tableLoader.load(broken, request));

        assertEquals(2, relationalStore.selectRows("sales_rollback", List.of("region"), 100, 0).size());
        assertTrue(tableLoadRepository.findByTableNameAndSourceKeyAndContentHash("sales_rollback",
                "uploads/sales_rollback.csv", "hash-b").isEmpty());
        assertEquals(2, ingestedTableRepository.findByTableName("sales_rollback").orElseThrow().getTotalRows());
    }

    @Test
    @DisplayName("Should load concurrent files into shared and separate tables completely and without deadlock")
    void load_concurrentFiles() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<LoadResult>> results = List.of(
                    pool.submit(() -> loadAfter(start, salesTable("sales_shared", 3), request(1L, "uploads/a/sales_shared.csv", "hash-a"))),
                    pool.submit(() -> loadAfter(start, salesTable("sales_shared", 4), request(2L, "uploads/b/sales_shared.csv", "hash-b"))),
                    pool.submit(() -> loadAfter(start, salesTable("sales_east", 2), request(3L, "uploads/sales_east.csv", "hash-c"))),
                    pool.submit(() -> loadAfter(start, salesTable("sales_west", 6), request(4L, "uploads/sales_west.csv", "hash-d"))));
            start.countDown();

            int inserted = 0;
            for (Future<LoadResult> result : results) {
                inserted += result.get(30, TimeUnit.SECONDS).rowsInserted();
            }
            assertEquals(15, inserted);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(SALES_COLUMNS, relationalStore.describeTable("sales_shared").orElseThrow());
        assertEquals(SALES_COLUMNS, relationalStore.describeTable("sales_east").orElseThrow());
        assertEquals(SALES_COLUMNS, relationalStore.describeTable("sales_west").orElseThrow());
        assertEquals(7, relationalStore.selectRows("sales_shared", List.of("region"), 100, 0).size());
        assertEquals(2, relationalStore.selectRows("sales_east", List.of("region"), 100, 0).size());
        assertEquals(6, relationalStore.selectRows("sales_west", List.of("region"), 100, 0).size());
        assertEquals(7, ingestedTableRepository.findByTableName("sales_shared").orElseThrow().getTotalRows());
    }

    private LoadResult loadAfter(CountDownLatch start, ParsedTable table, LoadRequest request)
            throws InterruptedException {
        start.await();
        return tableLoader.load(table, request);
    }

    private static ParsedTable salesTable(String tableName, int rowCount) {
        ParsedTable.ParsedTableBuilder builder = ParsedTable.builder()
                .tableName(tableName)
                .origin(TableOrigin.CSV)
                .columns(SALES_COLUMNS);
        for (int i = 0; i < rowCount; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("date", LocalDate.of(2024, 1, 1).plusDays(i));
            row.put("amount", 10.0 * (i + 1));
            row.put("region", i % 2 == 0 ? "North" : "South");
            builder.row(row);
        }
        return builder.build();
    }

    private static LoadRequest request(Long jobId, String sourceKey, String contentHash) {
        return new LoadRequest(jobId, sourceKey, contentHash, "JobId: " + jobId);
    }
}
