package com.jay.valuelens.layer1_data;

import com.fasterxml.jackson.databind.JsonNode;
import com.jay.valuelens.model.InfoMap;
import com.jay.valuelens.model.RawFinancials;
import com.jay.valuelens.model.StatementTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a Yahoo Finance quoteSummary result into statement tables and an info map.
 *
 * Statement entries arrive as one JSON object per period, e.g.
 *   { "endDate": {"raw": 1696032000, "fmt": "2023-09-30"},
 *     "totalRevenue": {"raw": 383285000000, "fmt": "383.29B"}, ... }
 * and are pivoted into rows keyed by the vendor's display label
 * ("totalRevenue" → "Total Revenue"). Info modules are flattened into one map;
 * when two modules carry the same key the first module listed wins.
 */
@Slf4j
public final class QuoteSummaryParser {

    /** Modules requested from quoteSummary, in info-map precedence order. */
    public static final List<String> INFO_MODULES = List.of(
        "price", "summaryProfile", "summaryDetail", "financialData", "defaultKeyStatistics");

    public static final List<String> STATEMENT_MODULES = List.of(
        "balanceSheetHistory", "incomeStatementHistory", "cashflowStatementHistory");

    private static final Set<String> SKIPPED_FIELDS = Set.of("maxAge", "endDate");

    // camelCase vendor key → line-item label used by the alias table
    private static final Map<String, String> LABELS = Map.ofEntries(
        // balance sheet
        Map.entry("totalAssets",              "Total Assets"),
        Map.entry("totalLiab",                "Total Liabilities"),
        Map.entry("totalStockholderEquity",   "Total Stockholder Equity"),
        Map.entry("cash",                     "Cash And Cash Equivalents"),
        Map.entry("shortTermInvestments",     "Short Term Investments"),
        Map.entry("longTermDebt",             "Long Term Debt"),
        Map.entry("shortLongTermDebt",        "Current Debt"),
        Map.entry("totalCurrentAssets",       "Current Assets"),
        Map.entry("totalCurrentLiabilities",  "Current Liabilities"),
        // income statement
        Map.entry("totalRevenue",             "Total Revenue"),
        Map.entry("netIncome",                "Net Income"),
        Map.entry("ebit",                     "EBIT"),
        Map.entry("operatingIncome",          "Operating Income"),
        Map.entry("incomeBeforeTax",          "Pretax Income"),
        Map.entry("incomeTaxExpense",         "Income Tax Expense"),
        Map.entry("interestExpense",          "Interest Expense"),
        // cash flow
        Map.entry("totalCashFromOperatingActivities", "Operating Cash Flow"),
        Map.entry("capitalExpenditures",      "Capital Expenditure"),
        Map.entry("dividendsPaid",            "Cash Dividends Paid")
    );

    private QuoteSummaryParser() { /* utility class */ }

    /**
     * @param ticker the requested symbol
     * @param root   full quoteSummary response body
     * @throws DataFetchException when the response carries an error or no result
     */
    public static RawFinancials parse(String ticker, JsonNode root) {
        JsonNode summary = root.path("quoteSummary");
        JsonNode error = summary.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new DataFetchException(ticker,
                "Yahoo Finance error: " + error.path("description").asText(error.toString()));
        }
        JsonNode result = summary.path("result");
        if (!result.isArray() || result.isEmpty()) {
            throw new DataFetchException(ticker, "Yahoo Finance returned no data for " + ticker);
        }
        JsonNode node = result.get(0);

        StatementTable balanceSheet = withDerivedDebt(
            statement(node.path("balanceSheetHistory").path("balanceSheetStatements")));
        StatementTable income = statement(node.path("incomeStatementHistory").path("incomeStatementHistory"));
        StatementTable cashFlow = withFreeCashFlow(
            statement(node.path("cashflowStatementHistory").path("cashflowStatements")));
        InfoMap info = info(node);

        log.debug("Parsed {}: {} balance-sheet, {} income, {} cash-flow periods, {} info keys",
            ticker, balanceSheet.periods().size(), income.periods().size(),
            cashFlow.periods().size(), info.size());

        return RawFinancials.builder()
            .ticker(ticker)
            .balanceSheet(balanceSheet)
            .incomeStatement(income)
            .cashFlow(cashFlow)
            .info(info)
            .build();
    }

    // ── Statements ────────────────────────────────────────────────────────────

    static StatementTable statement(JsonNode periods) {
        if (!periods.isArray() || periods.isEmpty()) return StatementTable.empty();
        List<String> labels = new ArrayList<>();
        Map<String, List<Double>> rows = new LinkedHashMap<>();
        int column = 0;
        for (JsonNode period : periods) {
            JsonNode end = period.path("endDate");
            labels.add(end.path("fmt").asText("P" + column));
            Iterator<Map.Entry<String, JsonNode>> fields = period.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                if (SKIPPED_FIELDS.contains(f.getKey())) continue;
                List<Double> row = rows.computeIfAbsent(label(f.getKey()), k -> new ArrayList<>());
                while (row.size() < column) row.add(null);
                row.add(number(f.getKey(), f.getValue()));
            }
            column++;
        }
        return StatementTable.of(labels, rows);
    }

    // Yahoo reports interest expense as a negative figure; the calculators expect a cost.
    private static Double number(String key, JsonNode value) {
        JsonNode raw = value.isObject() ? value.path("raw") : value;
        if (!raw.isNumber()) return null;
        double v = raw.asDouble();
        return "interestExpense".equals(key) ? Math.abs(v) : v;
    }

    /** "Total Debt" = current + long-term debt when either is reported. */
    static StatementTable withDerivedDebt(StatementTable bs) {
        if (bs.isEmpty() || bs.has("Total Debt")) return bs;
        List<Double> lt = bs.row("Long Term Debt").orElse(null);
        List<Double> st = bs.row("Current Debt").orElse(null);
        if (lt == null && st == null) return bs;
        return addRow(bs, "Total Debt", sum(lt, st, bs.periods().size(), false));
    }

    /** "Free Cash Flow" = operating cash flow + capital expenditure (capex is negative). */
    static StatementTable withFreeCashFlow(StatementTable cf) {
        if (cf.isEmpty() || cf.has("Free Cash Flow")) return cf;
        List<Double> ocf = cf.row("Operating Cash Flow").orElse(null);
        if (ocf == null) return cf;
        List<Double> capex = cf.row("Capital Expenditure").orElse(null);
        return addRow(cf, "Free Cash Flow", sum(ocf, capex, cf.periods().size(), true));
    }

    private static List<Double> sum(List<Double> a, List<Double> b, int n, boolean requireFirst) {
        List<Double> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Double x = a != null ? a.get(i) : null;
            Double y = b != null ? b.get(i) : null;
            if (x == null && (requireFirst || y == null)) out.add(null);
            else out.add((x != null ? x : 0.0) + (y != null ? y : 0.0));
        }
        return out;
    }

    private static StatementTable addRow(StatementTable table, String name, List<Double> values) {
        Map<String, List<Double>> rows = new LinkedHashMap<>();
        for (String item : table.lineItems()) rows.put(item, table.row(item).orElseThrow());
        rows.put(name, values);
        return StatementTable.of(table.periods(), rows);
    }

    static String label(String key) {
        String known = LABELS.get(key);
        if (known != null) return known;
        StringBuilder sb = new StringBuilder(key.length() + 8);
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            if (i == 0) sb.append(Character.toUpperCase(c));
            else {
                if (Character.isUpperCase(c)) sb.append(' ');
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // ── Info ──────────────────────────────────────────────────────────────────

    static InfoMap info(JsonNode result) {
        Map<String, Object> flat = new LinkedHashMap<>();
        for (String module : INFO_MODULES) {
            Iterator<Map.Entry<String, JsonNode>> fields = result.path(module).fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                if (flat.containsKey(f.getKey()) || SKIPPED_FIELDS.contains(f.getKey())) continue;
                Object v = scalar(f.getValue());
                if (v != null) flat.put(f.getKey(), v);
            }
        }
        // quoteSummary's price module calls the last trade "regularMarketPrice"
        if (!flat.containsKey("currentPrice") && flat.get("regularMarketPrice") != null) {
            flat.put("currentPrice", flat.get("regularMarketPrice"));
        }
        return InfoMap.of(flat);
    }

    private static Object scalar(JsonNode v) {
        if (v.isObject()) {
            JsonNode raw = v.path("raw");
            return raw.isNumber() ? raw.asDouble() : null;
        }
        if (v.isNumber()) return v.asDouble();
        if (v.isTextual() && !v.asText().isBlank()) return v.asText();
        return null;
    }
}
