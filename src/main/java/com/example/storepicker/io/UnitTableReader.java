package com.example.storepicker.io;

import com.example.storepicker.model.UnitRecord;
import com.example.storepicker.model.UnitTable;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads a population from CSV. The first row is the header; empty cells are treated as missing.
 * A leading byte-order mark is ignored and repeated header names are rejected.
 */
public class UnitTableReader {

    private static final Logger logger = LogManager.getLogger(UnitTableReader.class);

    private static final char BOM = '\uFEFF';

    public UnitTable read(Path path) throws IOException {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    /**
     * Reads from {@code in} without closing it.
     */
    public UnitTable read(Reader in) throws IOException {
        CSVReader reader = new CSVReader(in);
        try {
            String[] header = reader.readNext();
            if (header == null) {
                logger.warn("Input has no header row");
                return UnitTable.empty();
            }
            if (header.length > 0 && header[0] != null && !header[0].isEmpty() && header[0].charAt(0) == BOM) {
                header[0] = header[0].substring(1);
            }
            List<String> headers = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (String h : header) {
                String name = h.trim();
                if (!seen.add(name)) {
                    throw new IOException("Duplicate column in header: " + name);
                }
                headers.add(name);
            }

            List<UnitRecord> rows = new ArrayList<>();
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (line.length == 1 && line[0].isBlank()) {
                    continue;
                }
                rows.add(new UnitRecord(headers, clean(line)));
            }
            logger.debug("Read {} rows with columns {}", rows.size(), headers);
            return new UnitTable(headers, rows);
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        }
    }

    private static String[] clean(String[] line) {
        String[] values = new String[line.length];
        for (int i = 0; i < line.length; i++) {
            String v = line[i] == null ? "" : line[i].trim();
            values[i] = v.isEmpty() ? null : v;
        }
        return values;
    }
}
