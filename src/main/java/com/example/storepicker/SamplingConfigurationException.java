package com.example.storepicker;

import java.util.List;

/**
 * Raised before sampling starts when the identifier column or any stratification column is not
 * present in the input.
 */
public class SamplingConfigurationException extends RuntimeException {

    private final List<String> missingColumns;

    public SamplingConfigurationException(String message, List<String> missingColumns) {
        super(message);
        this.missingColumns = List.copyOf(missingColumns);
    }

    public static SamplingConfigurationException missingIdColumn(String idColumn) {
        return new SamplingConfigurationException("Missing required ID column: " + idColumn, List.of(idColumn));
    }

    public static SamplingConfigurationException missingStratificationColumns(List<String> columns) {
        return new SamplingConfigurationException("Missing stratification columns: " + columns, columns);
    }

    public List<String> getMissingColumns() {
        return missingColumns;
    }
}
