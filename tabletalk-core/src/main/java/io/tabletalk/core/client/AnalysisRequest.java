package io.tabletalk.core.client;

import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.model.Table;
import java.util.List;
import java.util.Objects;

public record AnalysisRequest(
    Table table,
    List<Exchange> context,
    String prompt,
    boolean structuredVisualization
) {
    public AnalysisRequest {
        Objects.requireNonNull(table, "table must not be null");
        context = context == null ? List.of() : List.copyOf(context);
        prompt = prompt == null ? "" : prompt;
    }
}
