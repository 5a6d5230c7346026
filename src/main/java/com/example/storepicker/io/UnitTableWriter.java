package com.example.storepicker.io;

import com.example.storepicker.model.UnitRecord;
import com.opencsv.CSVWriter;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes selected rows as CSV under the given header, missing values as empty cells.
 */
public class UnitTableWriter {

    public void write(Path path, List<String> headers, List<UnitRecord> rows) throws IOException {
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(out, headers, rows);
        }
    }

    public void write(Writer out, List<String> headers, List<UnitRecord> rows) throws IOException {
        CSVWriter writer = new CSVWriter(out);
        writer.writeNext(headers.toArray(new String[0]));
        for (UnitRecord r : rows) {
            writer.writeNext(r.toArray(headers));
        }
        writer.flush();
    }
}
