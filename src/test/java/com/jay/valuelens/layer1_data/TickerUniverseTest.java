package com.jay.valuelens.layer1_data;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TickerUniverseTest {

    @Test
    void splitsOnCommasSemicolonsAndWhitespace() {
        assertEquals(List.of("HRL", "AAPL", "MSFT", "KO"), TickerUniverse.parse(" hrl, AAPL;msft\tko ", 50));
    }

    @Test
    void removesDuplicatesKeepingFirstOccurrence() {
        assertEquals(List.of("KO", "XOM"), TickerUniverse.parse("ko,XOM,KO,xom", 50));
    }

    @Test
    void truncatesToLimit() {
        assertEquals(List.of("A", "B", "C"), TickerUniverse.parse("a b c d e", 3));
        assertEquals(List.of("A", "B"), TickerUniverse.parse("a a b c", 2));
    }

    @Test
    void blankInputIsEmpty() {
        assertTrue(TickerUniverse.parse("", 10).isEmpty());
        assertTrue(TickerUniverse.parse((String) null, 10).isEmpty());
        assertTrue(TickerUniverse.parse(" ,, ; ", 10).isEmpty());
    }

    @Test
    void listInput() {
        assertEquals(List.of("BRK.B", "CHD"), TickerUniverse.parse(Arrays.asList("brk.b", "chd"), 10));
        assertTrue(TickerUniverse.parse((List<String>) null, 10).isEmpty());
    }

    @Test
    void limitOutsideRangeRejected() {
        assertThrows(IllegalArgumentException.class, () -> TickerUniverse.parse("KO", 0));
        assertThrows(IllegalArgumentException.class, () -> TickerUniverse.parse("KO", 101));
        assertEquals(1, TickerUniverse.parse("KO", 100).size());
    }
}
