package com.quoteradar.iss.table;

import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Decoded ISS block: column names given once, rows of positional cells aligned to them.
 * Immutable; every row is exactly {@code columns.size()} wide.
 */
@Getter
public final class ColumnTable {

    /** Block name in the ISS document, e.g. "marketdata". */
    private final String name;
    private final List<String> columns;
    private final List<TableRow> rows;

    ColumnTable(String name, List<String> columns, List<TableRow> rows) {
        this.name = name;
        this.columns = List.copyOf(columns);
        this.rows = List.copyOf(rows);
    }

    /**
     * Linear lookup; -1 when the column is not present.
     */
    public int columnIndex(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).equals(column)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * @throws IndexOutOfBoundsException when {@code i} is not a valid row index
     */
    public TableRow row(int i) {
        if (i < 0 || i >= rows.size()) {
            throw new IndexOutOfBoundsException("Row " + i + " out of range for table '" + name
                    + "' with " + rows.size() + " rows");
        }
        return rows.get(i);
    }

    /**
     * First row (top to bottom) whose {@code column} cell equals {@code value}.
     */
    public Optional<TableRow> findRowWhere(String column, String value) {
        int idx = columnIndex(column);
        if (idx < 0 || value == null) {
            return Optional.empty();
        }
        for (TableRow row : rows) {
            if (row.asString(idx).filter(value::equals).isPresent()) {
                return Optional.of(row);
            }
        }
        return Optional.empty();
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
