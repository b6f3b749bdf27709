package io.tabletalk.core.dataset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tabletalk.core.model.Table;
import io.tabletalk.core.model.TableColumn;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored representation of a decoded table:
 *
 * <pre>
 * {"columns": [{"name": "region", "type": "string"}, ...], "rows": [["East", 10], ...]}
 * </pre>
 *
 * Columns may also be given as plain names, in which case the type is inferred from the values.
 */
public final class JsonTableCodec {
    private final ObjectMapper mapper;

    public JsonTableCodec() {
        this(new ObjectMapper());
    }

    public JsonTableCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Table decode(byte[] bytes) throws IOException {
        if (bytes == null || bytes.length == 0) {
            throw new IOException("Table payload is empty");
        }
        JsonNode root = mapper.readTree(bytes);
        if (root == null || !root.isObject()) {
            throw new IOException("Table payload must be a JSON object");
        }
        JsonNode columnsNode = root.path("columns");
        JsonNode rowsNode = root.path("rows");
        if (!columnsNode.isArray()) {
            throw new IOException("Table payload has no columns array");
        }
        if (!rowsNode.isMissingNode() && !rowsNode.isArray()) {
            throw new IOException("Table rows must be an array");
        }

        List<List<Object>> rows = new ArrayList<>();
        int rowIndex = 0;
        for (JsonNode rowNode : rowsNode) {
            if (!rowNode.isArray()) {
                throw new IOException("Row " + rowIndex + " is not an array");
            }
            if (rowNode.size() != columnsNode.size()) {
                throw new IOException(
                    "Row " + rowIndex + " has " + rowNode.size() + " cells, expected " + columnsNode.size()
                );
            }
            List<Object> row = new ArrayList<>(rowNode.size());
            rowNode.forEach(cell -> row.add(toCell(cell)));
            rows.add(row);
            rowIndex++;
        }

        List<TableColumn> columns = new ArrayList<>();
        for (int i = 0; i < columnsNode.size(); i++) {
            JsonNode column = columnsNode.get(i);
            String name = column.isTextual() ? column.asText() : column.path("name").asText("");
            if (name.isBlank()) {
                throw new IOException("Column " + i + " has no name");
            }
            String type = column.path("type").asText("");
            columns.add(new TableColumn(name, type.isBlank() ? inferType(rows, i) : type));
        }
        return new Table(columns, rows);
    }

    public byte[] encode(Table table) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode columns = root.putArray("columns");
        for (TableColumn column : table.columns()) {
            columns.addObject().put("name", column.name()).put("type", column.type());
        }
        ArrayNode rows = root.putArray("rows");
        for (List<Object> row : table.rows()) {
            ArrayNode rowNode = rows.addArray();
            row.forEach(cell -> rowNode.add(mapper.valueToTree(cell)));
        }
        return mapper.writeValueAsBytes(root);
    }

    static String inferType(List<List<Object>> rows, int columnIndex) {
        String inferred = null;
        for (List<Object> row : rows) {
            Object value = row.get(columnIndex);
            if (value == null) {
                continue;
            }
            String type = typeOf(value);
            if (inferred == null) {
                inferred = type;
            } else if (!inferred.equals(type)) {
                if (!isNumeric(inferred) || !isNumeric(type)) {
                    return TableColumn.STRING;
                }
                inferred = TableColumn.NUMBER;
            }
        }
        return inferred == null ? TableColumn.STRING : inferred;
    }

    private static boolean isNumeric(String type) {
        return TableColumn.INTEGER.equals(type) || TableColumn.NUMBER.equals(type);
    }

    private static String typeOf(Object value) {
        if (value instanceof Long || value instanceof Integer) {
            return TableColumn.INTEGER;
        }
        if (value instanceof Number) {
            return TableColumn.NUMBER;
        }
        if (value instanceof Boolean) {
            return TableColumn.BOOLEAN;
        }
        return TableColumn.STRING;
    }

    private Object toCell(JsonNode cell) {
        if (cell == null || cell.isNull() || cell.isMissingNode()) {
            return null;
        }
        if (cell.isIntegralNumber()) {
            return cell.canConvertToLong() ? (Object) cell.asLong() : cell.decimalValue();
        }
        if (cell.isNumber()) {
            return cell.asDouble();
        }
        if (cell.isBoolean()) {
            return cell.asBoolean();
        }
        if (cell.isTextual()) {
            return cell.asText();
        }
        return cell.toString();
    }
}
