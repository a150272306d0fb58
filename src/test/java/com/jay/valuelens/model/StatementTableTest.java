package com.jay.valuelens.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatementTableTest {

    @Test
    @DisplayName("short rows are padded with missing values, long rows truncated")
    void rowsAlignedToPeriods() {
        StatementTable t = StatementTable.builder("2024", "2023", "2022")
            .row("Short", 1.0)
            .row("Long", 1.0, 2.0, 3.0, 4.0)
            .build();
        assertEquals(Arrays.asList(1.0, null, null), t.row("Short").orElseThrow());
        assertEquals(List.of(1.0, 2.0, 3.0), t.row("Long").orElseThrow());
    }

    @Test
    @DisplayName("later changes to the source collections do not leak into the table")
    void immutableOnceBuilt() {
        List<Double> values = new ArrayList<>(List.of(1.0, 2.0));
        Map<String, List<Double>> rows = new LinkedHashMap<>();
        rows.put("Revenue", values);
        StatementTable t = StatementTable.of(List.of("2024", "2023"), rows);
        values.set(0, 99.0);
        rows.put("Other", List.of(5.0));
        assertEquals(List.of(1.0, 2.0), t.row("Revenue").orElseThrow());
        assertFalse(t.has("Other"));
        assertThrows(UnsupportedOperationException.class, () -> t.row("Revenue").orElseThrow().set(0, 3.0));
    }

    @Test
    @DisplayName("head keeps the most recent periods")
    void headKeepsRecentPeriods() {
        StatementTable t = StatementTable.builder("2024", "2023", "2022")
            .row("Assets", 3.0, 2.0, 1.0)
            .build();
        StatementTable cut = t.head(2);
        assertEquals(List.of("2024", "2023"), cut.periods());
        assertEquals(List.of(3.0, 2.0), cut.row("Assets").orElseThrow());
        assertSame(t, t.head(5));
    }

    @Test
    @DisplayName("a table with no rows or no periods is empty")
    void emptiness() {
        assertTrue(StatementTable.empty().isEmpty());
        assertTrue(StatementTable.builder("2024").build().isEmpty());
        assertFalse(StatementTable.builder("2024").row("X", 1.0).build().isEmpty());
    }
}
