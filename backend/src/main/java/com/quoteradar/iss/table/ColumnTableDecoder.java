package com.quoteradar.iss.table;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes ISS column tables: {@code {"<block>": {"columns": [...], "data": [[...], ...]}}}.
 * Knows nothing about what the columns mean.
 */
@Component
@RequiredArgsConstructor
public class ColumnTableDecoder {

    static final String COLUMNS = "columns";
    static final String DATA = "data";

    private final ObjectMapper objectMapper;

    public JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            throw new TableDecodeException("Empty ISS response body");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TableDecodeException("ISS response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decodes the named block. Zero rows is allowed here.
     */
    public ColumnTable decode(JsonNode root, String blockName) {
        JsonNode block = root == null ? null : root.get(blockName);
        if (block == null || !block.isObject()) {
            throw new TableDecodeException("Missing table block '" + blockName + "'");
        }
        JsonNode columnsNode = block.get(COLUMNS);
        JsonNode dataNode = block.get(DATA);
        if (columnsNode == null || !columnsNode.isArray()) {
            throw new TableDecodeException("Block '" + blockName + "' has no columns array");
        }
        if (dataNode == null || !dataNode.isArray()) {
            throw new TableDecodeException("Block '" + blockName + "' has no data array");
        }

        List<String> columns = new ArrayList<>(columnsNode.size());
        for (JsonNode col : columnsNode) {
            if (!col.isTextual()) {
                throw new TableDecodeException("Block '" + blockName + "' has a non-string column name: " + col);
            }
            columns.add(col.asText());
        }

        List<TableRow> rows = new ArrayList<>(dataNode.size());
        int rowIndex = 0;
        for (JsonNode rowNode : dataNode) {
            if (!rowNode.isArray()) {
                throw new TableDecodeException("Block '" + blockName + "' row " + rowIndex + " is not an array");
            }
            if (rowNode.size() != columns.size()) {
                throw new TableDecodeException("Block '" + blockName + "' row " + rowIndex + " has "
                        + rowNode.size() + " cells, expected " + columns.size());
            }
            List<Object> cells = new ArrayList<>(columns.size());
            for (JsonNode cell : rowNode) {
                cells.add(toScalar(cell, blockName, rowIndex));
            }
            rows.add(new TableRow(cells));
            rowIndex++;
        }
        return new ColumnTable(blockName, columns, rows);
    }

    /**
     * Same as {@link #decode} but a table without rows is an {@link EmptyTableException}.
     */
    public ColumnTable decodeRequired(JsonNode root, String blockName) {
        ColumnTable table = decode(root, blockName);
        if (table.isEmpty()) {
            throw new EmptyTableException(blockName);
        }
        return table;
    }

    private static Object toScalar(JsonNode cell, String blockName, int rowIndex) {
        if (cell == null || cell.isNull()) {
            return null;
        }
        if (cell.isNumber()) {
            return cell.numberValue();
        }
        if (cell.isTextual()) {
            return cell.textValue();
        }
        if (cell.isBoolean()) {
            return cell.asText();
        }
        throw new TableDecodeException("Block '" + blockName + "' row " + rowIndex + " has a non-scalar cell");
    }
}
