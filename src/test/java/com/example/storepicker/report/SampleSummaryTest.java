package com.example.storepicker.report;

import com.example.storepicker.model.UnitRecord;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class SampleSummaryTest {

    private static final List<String> HEADERS = List.of("Store_ID", "Region", "Format");

    private static UnitRecord row(String id, String region, String format) {
        return new UnitRecord(HEADERS, new String[]{id, region, format});
    }

    private final List<UnitRecord> selection = List.of(
        row("1", "SOUTH", "MALL"),
        row("2", "NORTH", "MALL"),
        row("3", "SOUTH", "KIOSK"),
        row("4", "NORTH", "MALL"),
        row("5", "SOUTH", "MALL"));

    @Test
    void testCountsAndPercentages() {
        SampleSummary summary = SampleSummary.of(selection, HEADERS, List.of("Region", "Format"));

        assertThat(summary.total()).isEqualTo(5);
        assertThat(summary.counts("Region")).containsEntry("NORTH", 2).containsEntry("SOUTH", 3);
        assertThat(summary.percentage("Format", "KIOSK")).isCloseTo(20.0, within(1e-9));
    }

    @Test
    void testRendersSortedValuesPerColumn() {
        SampleSummary summary = SampleSummary.of(selection, HEADERS, List.of("Region", "Format"));

        assertThat(summary.lines()).containsExactly(
            "",
            "By Region:",
            "  NORTH: 2 (40.0%)",
            "  SOUTH: 3 (60.0%)",
            "",
            "By Format:",
            "  KIOSK: 1 (20.0%)",
            "  MALL: 4 (80.0%)");
    }

    @Test
    void testUnknownColumnsAreSkipped() {
        SampleSummary summary = SampleSummary.of(selection, HEADERS, List.of("Country", "Region"));

        assertThat(summary.lines()).doesNotContain("By Country:").contains("By Region:");
        assertThat(summary.counts("Country")).isEmpty();
    }

    @Test
    void testEmptySelection() {
        SampleSummary summary = SampleSummary.of(List.of(), HEADERS, List.of("Region"));
        StringWriter text = new StringWriter();

        summary.print(new PrintWriter(text));

        assertThat(summary.percentage("Region", "NORTH")).isZero();
        assertThat(text.toString().trim()).isEqualTo(SampleSummary.EMPTY_MESSAGE);
    }
}
