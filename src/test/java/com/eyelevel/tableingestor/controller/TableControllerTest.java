package com.eyelevel.tableingestor.controller;

import com.eyelevel.tableingestor.dto.table.TableRowsResponse;
import com.eyelevel.tableingestor.dto.table.TableSummary;
import com.eyelevel.tableingestor.exception.ResourceNotFoundException;
import com.eyelevel.tableingestor.exception.handler.GlobalExceptionHandler;
import com.eyelevel.tableingestor.model.ColumnType;
import com.eyelevel.tableingestor.model.TableColumn;
import com.eyelevel.tableingestor.model.TableOrigin;
import com.eyelevel.tableingestor.service.query.TableQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class TableControllerTest {

    @Mock
    private TableQueryService tableQueryService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new TableController(tableQueryService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should list ingested tables")
    void listTables() throws Exception {
        when(tableQueryService.listTables()).thenReturn(List.of(new TableSummary("sales_2024", TableOrigin.CSV,
                List.of(new TableColumn("amount", ColumnType.REAL)), 5, null, null)));

        mockMvc.perform(get("/tables/v1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response[0].tableName").value("sales_2024"))
                .andExpect(jsonPath("$.response[0].columns[0].type").value("REAL"))
                .andExpect(jsonPath("$.response[0].totalRows").value(5));
    }

    @Test
    @DisplayName("Should return a page of rows and pass paging through")
    void getRows() throws Exception {
        when(tableQueryService.fetchRows("sales_2024", 2, 4L)).thenReturn(new TableRowsResponse("sales_2024", 2, 4L,
                List.of(Map.of("region", "North"), Map.of("region", "South"))));

        mockMvc.perform(get("/tables/v1/sales_2024/rows").param("limit", "2").param("offset", "4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response.rows.length()").value(2))
                .andExpect(jsonPath("$.response.rows[1].region").value("South"));
    }

    @Test
    @DisplayName("Should answer 404 for a table that was not created by ingestion")
    void getRows_unknownTable() throws Exception {
        when(tableQueryService.fetchRows("pg_user", null, null))
                .thenThrow(new ResourceNotFoundException("Table not found: pg_user"));

        mockMvc.perform(get("/tables/v1/pg_user/rows"))
                .andExpect(status().isNotFound());
    }
}
