package com.jay.valuelens.model;

import java.util.List;

/** All records of one sector, in portfolio view order. */
public record SectorGroup(String sector, int rank, List<CompanyMetrics> records) {

    public SectorGroup {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
