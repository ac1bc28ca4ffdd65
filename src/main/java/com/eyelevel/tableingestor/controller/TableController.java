package com.eyelevel.tableingestor.controller;

import com.eyelevel.tableingestor.dto.common.ApiResponse;
import com.eyelevel.tableingestor.dto.table.TableRowsResponse;
import com.eyelevel.tableingestor.dto.table.TableSummary;
import com.eyelevel.tableingestor.service.query.TableQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/tables")
@RequiredArgsConstructor
@Validated
public class TableController implements TableApi {

    private final TableQueryService tableQueryService;

    @Override
    @GetMapping("/v1")
    public ResponseEntity<ApiResponse<List<TableSummary>>> listTables() {
        List<TableSummary> tables = tableQueryService.listTables();

        ApiResponse<List<TableSummary>> response = ApiResponse.<List<TableSummary>>builder()
                .response(tables)
                .displayMessage(String.format("Found %d table(s).", tables.size()))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/{tableName}/rows")
    public ResponseEntity<ApiResponse<TableRowsResponse>> getRows(
            @PathVariable("tableName") final String tableName,
            @RequestParam(value = "limit", required = false) final Integer limit,
            @RequestParam(value = "offset", required = false) final Long offset) {

        log.debug("Reading rows of table '{}' (limit={}, offset={})", tableName, limit, offset);
        TableRowsResponse rows = tableQueryService.fetchRows(tableName, limit, offset);

        ApiResponse<TableRowsResponse> response = ApiResponse.<TableRowsResponse>builder()
                .response(rows)
                .displayMessage(String.format("Retrieved %d row(s) from '%s'.", rows.rows().size(), tableName))
                .showMessage(true)
                .statusCode(HttpStatus.OK.value())
                .build();

        return ResponseEntity.ok(response);
    }
}
