package io.tabletalk.core.dataset;

import io.tabletalk.core.model.ColumnProfile;
import io.tabletalk.core.model.DatasetMetadata;
import io.tabletalk.core.model.Table;
import io.tabletalk.core.model.TableColumn;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class TableProfiler {
    private static final int SAMPLE_VALUES = 5;

    public DatasetMetadata profile(Table table, long fileSizeBytes) {
        List<ColumnProfile> columns = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (int i = 0; i < table.columnCount(); i++) {
            TableColumn column = table.columns().get(i);
            int nulls = 0;
            Set<String> samples = new LinkedHashSet<>();
            for (Object value : table.columnValues(i)) {
                if (value == null) {
                    nulls++;
                } else if (samples.size() < SAMPLE_VALUES) {
                    samples.add(String.valueOf(value));
                }
            }
            if (nulls == table.rowCount()) {
                warnings.add("Column '" + column.name() + "' has no values");
            }
            columns.add(new ColumnProfile(column.name(), column.type(), nulls, List.copyOf(samples)));
        }
        return new DatasetMetadata(
            table.rowCount(),
            table.columnCount(),
            columns,
            fileSizeBytes,
            List.of(),
            warnings,
            ""
        );
    }
}
