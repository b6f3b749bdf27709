package io.tabletalk.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Decoded, read-only table. Rows are copied on construction and exposed as unmodifiable views, so a
 * table can be shared between concurrent queries. Cells may be {@code null}.
 */
public record Table(List<TableColumn> columns, List<List<Object>> rows) {

    public Table {
        columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        Objects.requireNonNull(rows, "rows must not be null");
        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row == null || row.size() != columns.size()) {
                throw new IllegalArgumentException(
                    "row " + i + " has " + (row == null ? 0 : row.size()) + " cells, expected " + columns.size()
                );
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public int indexOf(String columnName) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(columnName)) {
                return i;
            }
        }
        return -1;
    }

    public List<Object> columnValues(int index) {
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(index));
        }
        return Collections.unmodifiableList(values);
    }

    public Table head(int limit) {
        int safe = Math.max(0, Math.min(limit, rows.size()));
        return new Table(columns, rows.subList(0, safe));
    }
}
