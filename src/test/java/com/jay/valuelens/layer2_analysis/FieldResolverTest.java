package com.jay.valuelens.layer2_analysis;

import com.jay.valuelens.model.StatementTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldResolverTest {

    private final StatementTable table = StatementTable.builder("2024", "2023")
        .row("A", 1.0, 2.0)
        .row("B", 3.0, 4.0)
        .build();

    @Test
    @DisplayName("first alias present wins")
    void firstAliasWins() {
        assertEquals(List.of(1.0, 2.0), FieldResolver.resolve(table, List.of("A", "B")));
        assertEquals(List.of(3.0, 4.0), FieldResolver.resolve(table, List.of("B", "A")));
    }

    @Test
    @DisplayName("falls back to a later alias when earlier ones are absent")
    void fallsBackToLaterAlias() {
        StatementTable onlyB = StatementTable.builder("2024").row("B", 7.0).build();
        assertEquals(List.of(7.0), FieldResolver.resolve(onlyB, List.of("A", "B")));
    }

    @Test
    @DisplayName("no alias present → single-period zero row, never null")
    void missingGivesZeroRow() {
        List<Double> row = FieldResolver.resolve(table, List.of("X", "Y"));
        assertNotNull(row);
        assertEquals(List.of(0.0), row);
        assertEquals(List.of(0.0), FieldResolver.resolve(StatementTable.empty(), List.of("A")));
        assertEquals(List.of(0.0), FieldResolver.resolve(null, List.of("A")));
    }

    @Test
    @DisplayName("find reports a miss as empty")
    void findReportsMiss() {
        assertTrue(FieldResolver.find(table, List.of("X")).isEmpty());
        assertTrue(FieldResolver.find(table, List.of("X", "B")).isPresent());
    }

    @Test
    @DisplayName("empty alias list is rejected")
    void emptyAliasesRejected() {
        assertThrows(IllegalArgumentException.class, () -> FieldResolver.resolve(table, List.of()));
    }
}
