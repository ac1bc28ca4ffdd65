package com.eyelevel.tableingestor.controller;

import com.eyelevel.tableingestor.dto.common.ApiResponse;
import com.eyelevel.tableingestor.dto.table.TableRowsResponse;
import com.eyelevel.tableingestor.dto.table.TableSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Tables", description = "Read-only access to the tables created by ingestion.")
public interface TableApi {

    @Operation(summary = "List Tables", description = "Lists every table created by the pipeline with its columns and row count.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Tables retrieved.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Found 1 table(s).",
                                        "response": [
                                            {
                                                "tableName": "t_sales_2024",
                                                "origin": "CSV",
                                                "columns": [
                                                    {"name": "c_id", "type": "INTEGER"},
                                                    {"name": "c_amount", "type": "REAL"}
                                                ],
                                                "totalRows": 2
                                            }
                                        ],
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """)))
    })
    ResponseEntity<ApiResponse<List<TableSummary>>> listTables();

    @Operation(summary = "Read Table Rows", description = "Returns a page of rows from an ingested table. Only tables created by the pipeline are readable.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Rows retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - limit or offset out of range.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Table not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<TableRowsResponse>> getRows(
            @Parameter(description = "Name of the ingested table.", required = true, example = "t_sales_2024")
            @PathVariable("tableName") String tableName,
            @Parameter(description = "Maximum number of rows to return (1-1000).", example = "100")
            @RequestParam(value = "limit", required = false) Integer limit,
            @Parameter(description = "Number of rows to skip.", example = "0")
            @RequestParam(value = "offset", required = false) Long offset);
}
