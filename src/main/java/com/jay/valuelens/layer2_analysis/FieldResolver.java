package com.jay.valuelens.layer2_analysis;

import com.jay.valuelens.model.StatementTable;

import java.util.List;
import java.util.Optional;

/**
 * Finds a line item in a statement table by trying vendor aliases in priority order.
 *
 * <p>When none of the aliases exists the resolver returns a synthetic single-period
 * row holding {@code 0.0}. A missing line item therefore reads as zero, not as
 * unavailable: zero debt or zero cash are meaningful inputs for the calculators.
 */
public final class FieldResolver {

    static final List<Double> ZERO_ROW = List.of(0.0);

    private FieldResolver() { /* utility class */ }

    /**
     * @param table   statement to search
     * @param aliases candidate line-item names, highest priority first; must not be empty
     * @return the first matching row, or {@link #ZERO_ROW}; never null
     */
    public static List<Double> resolve(StatementTable table, List<String> aliases) {
        return find(table, aliases).orElse(ZERO_ROW);
    }

    /** Like {@link #resolve} but reports a miss as empty instead of the zero row. */
    public static Optional<List<Double>> find(StatementTable table, List<String> aliases) {
        if (aliases == null || aliases.isEmpty()) {
            throw new IllegalArgumentException("At least one line-item alias is required");
        }
        if (table == null) return Optional.empty();
        for (String alias : aliases) {
            Optional<List<Double>> row = table.row(alias);
            if (row.isPresent()) return row;
        }
        return Optional.empty();
    }
}
