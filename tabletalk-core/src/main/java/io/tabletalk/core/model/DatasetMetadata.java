package io.tabletalk.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DatasetMetadata(
    int rowCount,
    int columnCount,
    List<ColumnProfile> columns,
    long fileSizeBytes,
    List<String> sheetNames,
    List<String> parseWarnings,
    String error
) {
    public DatasetMetadata {
        columns = columns == null ? List.of() : List.copyOf(columns);
        sheetNames = sheetNames == null ? List.of() : List.copyOf(sheetNames);
        parseWarnings = parseWarnings == null ? List.of() : List.copyOf(parseWarnings);
        error = error == null ? "" : error;
    }

    public static DatasetMetadata empty() {
        return new DatasetMetadata(0, 0, List.of(), 0L, List.of(), List.of(), "");
    }

    public static DatasetMetadata failed(String error, long fileSizeBytes) {
        String message = error == null || error.isBlank() ? "ingestion failed" : error;
        return new DatasetMetadata(0, 0, List.of(), fileSizeBytes, List.of(), List.of(message), message);
    }
}
