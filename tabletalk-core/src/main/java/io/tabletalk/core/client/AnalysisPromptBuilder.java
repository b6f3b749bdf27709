package io.tabletalk.core.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tabletalk.core.model.ChatMessage;
import io.tabletalk.core.model.Exchange;
import io.tabletalk.core.model.Table;
import io.tabletalk.core.model.TableColumn;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

public final class AnalysisPromptBuilder {
    private static final String INSTRUCTIONS = """
        You are a data analyst answering questions about one table.
        Work only from the table below and the earlier conversation. Compute answers exactly; \
        do not guess values that are not in the data.
        Reply with a single JSON object and nothing else:
        {"text": "<answer for the user>", "visualization": null}
        """;
    private static final String VISUALIZATION_DIRECTIVE = """
        When a chart helps, set "visualization" to a Vega-Lite v5 specification with the data \
        inlined under "data.values". Never return images, image links or plotting code.
        """;
    private static final String NO_VISUALIZATION_DIRECTIVE = """
        Always set "visualization" to null.
        """;

    private final int maxRows;
    private final ObjectMapper mapper;

    public AnalysisPromptBuilder(int maxRows) {
        this.maxRows = Math.max(1, maxRows);
        this.mapper = new ObjectMapper();
    }

    public List<ChatMessage> build(AnalysisRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        StringBuilder system = new StringBuilder(INSTRUCTIONS);
        system.append(request.structuredVisualization() ? VISUALIZATION_DIRECTIVE : NO_VISUALIZATION_DIRECTIVE);
        system.append("\n").append(describeTable(request.table()));
        messages.add(ChatMessage.system(system.toString()));

        for (Exchange exchange : request.context()) {
            messages.add(ChatMessage.user(exchange.prompt()));
            messages.add(ChatMessage.assistant(exchange.responseText()));
        }
        messages.add(ChatMessage.user(request.prompt()));
        return messages;
    }

    String describeTable(Table table) {
        StringBuilder out = new StringBuilder("## Table\n\nColumns:\n");
        for (TableColumn column : table.columns()) {
            out.append("- ").append(column.name()).append(" (").append(column.type()).append(")\n");
        }

        int shown = Math.min(maxRows, table.rowCount());
        out.append("\nRows (").append(shown).append(" of ").append(table.rowCount()).append("), one JSON array per row:\n");
        for (List<Object> row : table.head(shown).rows()) {
            out.append(json(row)).append("\n");
        }

        if (shown < table.rowCount()) {
            out.append("\nThe remaining rows are not shown. Numeric column summaries over all rows:\n");
            for (int i = 0; i < table.columnCount(); i++) {
                TableColumn column = table.columns().get(i);
                if (TableColumn.INTEGER.equals(column.type()) || TableColumn.NUMBER.equals(column.type())) {
                    out.append(summarize(column.name(), table.columnValues(i))).append("\n");
                }
            }
        }
        return out.toString();
    }

    private String summarize(String name, List<Object> values) {
        long count = 0;
        BigDecimal sum = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        for (Object value : values) {
            BigDecimal decimal = toDecimal(value);
            if (decimal == null) {
                continue;
            }
            count++;
            sum = sum.add(decimal);
            min = min == null || decimal.compareTo(min) < 0 ? decimal : min;
            max = max == null || decimal.compareTo(max) > 0 ? decimal : max;
        }
        return "- " + name + ": count=" + count
            + ", sum=" + sum.toPlainString()
            + ", min=" + (min == null ? "n/a" : min.toPlainString())
            + ", max=" + (max == null ? "n/a" : max.toPlainString());
    }

    // NaN and infinities have no decimal form
    private static BigDecimal toDecimal(Object value) {
        if (!(value instanceof Number number)) {
            return null;
        }
        if ((number instanceof Double || number instanceof Float) && !Double.isFinite(number.doubleValue())) {
            return null;
        }
        return new BigDecimal(number.toString());
    }

    private String json(List<Object> row) {
        try {
            return mapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            return String.valueOf(row);
        }
    }
}
