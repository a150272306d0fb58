package com.jay.valuelens.layer2_analysis;

import com.jay.valuelens.model.InfoMap;
import com.jay.valuelens.model.Metric;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScalarExtractorTest {

    @Test
    @DisplayName("row → most recent non-missing value")
    void latestOfRow() {
        assertEquals(Metric.of(5.0), ScalarExtractor.latest(Arrays.asList(null, 5.0, 4.0)));
        assertEquals(Metric.of(3.0), ScalarExtractor.latest(Arrays.asList(Double.NaN, 3.0)));
        assertEquals(Metric.of(0.0), ScalarExtractor.latest(List.of(0.0)));
    }

    @Test
    @DisplayName("row with nothing usable → unavailable")
    void allMissing() {
        assertFalse(ScalarExtractor.latest(Arrays.asList(null, null)).isAvailable());
        assertFalse(ScalarExtractor.latest(List.<Double>of()).isAvailable());
        assertFalse(ScalarExtractor.latest((List<Double>) null).isAvailable());
    }

    @Test
    @DisplayName("scalars pass through, missing maps to unavailable")
    void scalarPassThrough() {
        assertEquals(Metric.of(1.5), ScalarExtractor.latest((Object) 1.5));
        assertEquals(Metric.of(12), ScalarExtractor.latest((Object) 12));
        assertEquals(Metric.of(0.3), ScalarExtractor.latest((Object) "0.3"));
        assertFalse(ScalarExtractor.latest((Object) null).isAvailable());
        assertFalse(ScalarExtractor.latest((Object) "Technology").isAvailable());
    }

    @Test
    @DisplayName("info-map lookups and scalar extraction read values the same way")
    void scalarAndInfoMapAgree() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("n", 4);
        values.put("s", "0.35");
        values.put("bad", "abc");
        values.put("blank", " ");
        InfoMap info = InfoMap.of(values);
        values.forEach((k, v) -> assertEquals(ScalarExtractor.latest(v), info.number(k), k));
    }
}
