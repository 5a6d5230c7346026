package com.example.storepicker.io;

import com.example.storepicker.model.UnitRecord;
import com.example.storepicker.model.UnitTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class UnitTableIoTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadsHeaderAndRows() throws IOException {
        Path csv = tempDir.resolve("stores.csv");
        Files.writeString(csv, " Store_ID ,Country,Region\n"
            + "1,UK,North\n"
            + "2, FR ,\"Ile, de France\"\n", StandardCharsets.UTF_8);

        UnitTable table = new UnitTableReader().read(csv);

        assertThat(table.headers()).containsExactly("Store_ID", "Country", "Region");
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.rows().get(1).get("Country")).isEqualTo("FR");
        assertThat(table.rows().get(1).get("Region")).isEqualTo("Ile, de France");
    }

    @Test
    void testEmptyAndShortCellsAreMissing() throws IOException {
        UnitTable table = new UnitTableReader().read(new StringReader(
            "Store_ID,Country,Region\n"
                + ",UK,North\n"
                + "2,  ,South\n"
                + "3,DE\n"
                + "\n"));

        assertThat(table.size()).isEqualTo(3);
        assertThat(table.rows().get(0).isMissing("Store_ID")).isTrue();
        assertThat(table.rows().get(1).get("Country")).isNull();
        assertThat(table.rows().get(2).get("Region")).isNull();
    }

    @Test
    void testByteOrderMarkIsIgnored() throws IOException {
        Path csv = tempDir.resolve("excel.csv");
        Files.writeString(csv, "\uFEFFStore_ID,Region\n1,North\n2,South\n", StandardCharsets.UTF_8);

        UnitTable table = new UnitTableReader().read(csv);

        assertThat(table.headers()).containsExactly("Store_ID", "Region");
        assertThat(table.hasColumn("Store_ID")).isTrue();
        assertThat(table.rows().get(0).get("Store_ID")).isEqualTo("1");
    }

    @Test
    void testDuplicateHeaderIsRejected() {
        assertThatThrownBy(() -> new UnitTableReader().read(new StringReader(
            "Store_ID,Region, Region\n1,North,X\n")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Region");
    }

    @Test
    void testCallerKeepsOwnershipOfReader() throws IOException {
        StringReader in = new StringReader("Store_ID\n1\n");

        new UnitTableReader().read(in);

        assertThat(in.read()).isEqualTo(-1);
    }

    @Test
    void testEmptyInputGivesEmptyTable() throws IOException {
        UnitTable table = new UnitTableReader().read(new StringReader(""));

        assertThat(table.headers()).isEmpty();
        assertThat(table.isEmpty()).isTrue();
    }

    @Test
    void testMissingFileIsAnIoError() {
        assertThatThrownBy(() -> new UnitTableReader().read(tempDir.resolve("absent.csv")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void testWriteThenReadKeepsColumnsAndOrder() throws IOException {
        List<String> headers = List.of("Store_ID", "Country", "Note");
        List<UnitRecord> rows = List.of(
            new UnitRecord(headers, new String[]{"7", "UK", "has \"quotes\", and commas"}),
            new UnitRecord(headers, new String[]{"3", null, "x"}));
        Path csv = tempDir.resolve("out.csv");

        new UnitTableWriter().write(csv, headers, rows);
        UnitTable back = new UnitTableReader().read(csv);

        assertThat(back.headers()).containsExactlyElementsOf(headers);
        assertThat(back.rows()).containsExactlyElementsOf(rows);
    }

    @Test
    void testWriterUsesGivenHeaderOrder() throws IOException {
        UnitRecord row = new UnitRecord(List.of("A", "B"), new String[]{"1", "2"});
        Path csv = tempDir.resolve("reordered.csv");

        new UnitTableWriter().write(csv, List.of("B", "A"), List.of(row));

        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertThat(lines).containsExactly("\"B\",\"A\"", "\"2\",\"1\"");
    }
}
