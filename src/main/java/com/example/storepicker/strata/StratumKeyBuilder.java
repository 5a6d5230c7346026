package com.example.storepicker.strata;

import com.example.storepicker.model.UnitRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the {@link StratumKey} of a unit from a fixed, ordered list of stratification columns.
 */
public class StratumKeyBuilder {

    public static final String UNKNOWN = "UNKNOWN";

    private final List<String> columns;

    public StratumKeyBuilder(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    public StratumKey build(UnitRecord unit) {
        List<String> values = new ArrayList<>(columns.size());
        for (String column : columns) {
            values.add(normalize(unit.get(column)));
        }
        return new StratumKey(values);
    }

    /**
     * Missing becomes {@value #UNKNOWN}; anything else is stripped and upper-cased.
     */
    public static String normalize(Object raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        return String.valueOf(raw).strip().toUpperCase(Locale.ROOT);
    }
}
