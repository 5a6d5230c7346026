package com.example.storepicker.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One row of the population. Values are text, or {@code null} when the cell is missing.
 */
public class UnitRecord {

    private final Map<String, String> attributes;

    public UnitRecord(List<String> headers, String[] values) {
        attributes = new LinkedHashMap<>();
        for (int i = 0; i < headers.size(); i++) {
            attributes.put(headers.get(i), i < values.length ? values[i] : null);
        }
    }

    public UnitRecord(Map<String, String> attributes) {
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public String get(String key) {
        return attributes.get(key);
    }

    public void set(String key, String value) {
        attributes.put(key, value);
    }

    public boolean isMissing(String key) {
        return attributes.get(key) == null;
    }

    public UnitRecord copy() {
        return new UnitRecord(attributes);
    }

    public String[] toArray(List<String> headers) {
        List<String> row = new ArrayList<>();
        for (String h : headers) {
            String value = attributes.get(h);
            row.add(value == null ? "" : value);
        }
        return row.toArray(new String[0]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnitRecord)) return false;
        return attributes.equals(((UnitRecord) o).attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    @Override
    public String toString() {
        return "UnitRecord" + attributes;
    }
}
