package com.example.storepicker.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A population loaded into memory: ordered column headers and the rows under them.
 */
public class UnitTable {

    private final List<String> headers;
    private final List<UnitRecord> rows;

    public UnitTable(List<String> headers, List<UnitRecord> rows) {
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public static UnitTable empty() {
        return new UnitTable(List.of(), List.of());
    }

    public List<String> headers() {
        return headers;
    }

    public List<UnitRecord> rows() {
        return rows;
    }

    public boolean hasColumn(String name) {
        return headers.contains(name);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
