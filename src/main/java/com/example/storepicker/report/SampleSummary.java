package com.example.storepicker.report;

import com.example.storepicker.model.UnitRecord;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Distribution of a selection over each stratification column: value, count, share of the total.
 */
public class SampleSummary {

    public static final String EMPTY_MESSAGE = "No rows selected; nothing to summarise.";

    private final int total;
    private final Map<String, Map<String, Integer>> countsByColumn;

    private SampleSummary(int total, Map<String, Map<String, Integer>> countsByColumn) {
        this.total = total;
        this.countsByColumn = countsByColumn;
    }

    /**
     * Columns not in {@code headers} are skipped. Missing values are counted as an empty string.
     */
    public static SampleSummary of(List<UnitRecord> selected, List<String> headers, List<String> stratColumns) {
        Map<String, Map<String, Integer>> counts = new LinkedHashMap<>();
        for (String column : stratColumns) {
            if (!headers.contains(column)) {
                continue;
            }
            Map<String, Integer> byValue = new TreeMap<>();
            for (UnitRecord r : selected) {
                String value = r.get(column);
                byValue.merge(value == null ? "" : value, 1, Integer::sum);
            }
            counts.put(column, byValue);
        }
        return new SampleSummary(selected.size(), counts);
    }

    public int total() {
        return total;
    }

    public Map<String, Integer> counts(String column) {
        return Collections.unmodifiableMap(countsByColumn.getOrDefault(column, Map.of()));
    }

    public double percentage(String column, String value) {
        if (total == 0) {
            return 0.0;
        }
        return counts(column).getOrDefault(value, 0) * 100.0 / total;
    }

    public List<String> lines() {
        List<String> lines = new ArrayList<>();
        if (total == 0) {
            lines.add(EMPTY_MESSAGE);
            return lines;
        }
        countsByColumn.forEach((column, byValue) -> {
            lines.add("");
            lines.add("By " + column + ":");
            byValue.forEach((value, count) -> lines.add(String.format(Locale.ROOT, "  %s: %d (%.1f%%)",
                    value, count, count * 100.0 / total)));
        });
        return lines;
    }

    public void print(PrintWriter out) {
        lines().forEach(out::println);
        out.flush();
    }
}
