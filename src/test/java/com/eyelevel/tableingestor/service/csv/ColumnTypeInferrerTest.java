package com.eyelevel.tableingestor.service.csv;

import com.eyelevel.tableingestor.model.ColumnType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ColumnTypeInferrerTest {

    @Test
    @DisplayName("Should prefer integer over real over date over text")
    void infer_precedence() {
        assertEquals(ColumnType.INTEGER, ColumnTypeInferrer.infer(List.of("1", "-20", "+300")));
        assertEquals(ColumnType.REAL, ColumnTypeInferrer.infer(List.of("1", "2.5", "1e3")));
        assertEquals(ColumnType.DATE, ColumnTypeInferrer.infer(List.of("2024-01-05", "2024-02-29")));
        assertEquals(ColumnType.TEXT, ColumnTypeInferrer.infer(List.of("1", "2024-01-05")));
        assertEquals(ColumnType.TEXT, ColumnTypeInferrer.infer(List.of("North", "South")));
    }

    @Test
    @DisplayName("Should ignore blank cells and type an all-blank column as text")
    void infer_blankCells() {
        assertEquals(ColumnType.INTEGER, ColumnTypeInferrer.infer(Arrays.asList("1", "", null, " 2 ")));
        assertEquals(ColumnType.TEXT, ColumnTypeInferrer.infer(Arrays.asList("", null, "  ")));
        assertEquals(ColumnType.TEXT, ColumnTypeInferrer.infer(List.of()));
    }

    @Test
    @DisplayName("Should not accept impossible dates or integers beyond 64 bits")
    void infer_rejectsOutOfRange() {
        assertEquals(ColumnType.TEXT, ColumnTypeInferrer.infer(List.of("2023-02-30")));
        assertEquals(ColumnType.TEXT, ColumnTypeInferrer.infer(List.of("99999999999999999999")));
        assertEquals(ColumnType.INTEGER, ColumnTypeInferrer.infer(List.of("9223372036854775807")));
    }

    @Test
    @DisplayName("Should keep oversized identifiers verbatim as text instead of rounding them to a real")
    void infer_oversizedIntegerKeepsDigits() {
        List<String> ids = List.of("1", "12345678901234567891", "2.5");

        ColumnType type = ColumnTypeInferrer.infer(ids);

        assertEquals(ColumnType.TEXT, type);
        assertEquals("12345678901234567891", ColumnTypeInferrer.convert("12345678901234567891", type));
    }

    @Test
    @DisplayName("Should convert values to the column's Java type")
    void convert_values() {
        assertEquals(42L, ColumnTypeInferrer.convert(" 42 ", ColumnType.INTEGER));
        assertEquals(2.5d, ColumnTypeInferrer.convert("2.5", ColumnType.REAL));
        assertEquals(LocalDate.of(2024, 1, 5), ColumnTypeInferrer.convert("2024-01-05", ColumnType.DATE));
        assertEquals(" as is ", ColumnTypeInferrer.convert(" as is ", ColumnType.TEXT));
        assertNull(ColumnTypeInferrer.convert("", ColumnType.INTEGER));
        assertNull(ColumnTypeInferrer.convert(null, ColumnType.TEXT));
    }
}
