package com.quoteradar.iss.table;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * One positional row of a {@link ColumnTable}. Cells are String, Number or null.
 * Typed accessors never throw: a null cell, a bad index, NaN/Infinity or a value that
 * does not coerce all come back as an empty optional.
 */
public final class TableRow {

    private final List<Object> cells;

    TableRow(List<Object> cells) {
        this.cells = Collections.unmodifiableList(cells);
    }

    /**
     * Raw cell value, or null when the cell is null or the index is outside the row.
     */
    public Object cell(int index) {
        if (index < 0 || index >= cells.size()) {
            return null;
        }
        return cells.get(index);
    }

    public OptionalDouble asDouble(int index) {
        Object value = cell(index);
        double d;
        if (value instanceof Number n) {
            d = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                d = Double.parseDouble(s.strip());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(d);
    }

    public OptionalLong asLong(int index) {
        Object value = cell(index);
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return OptionalLong.of(((Number) value).longValue());
        }
        if (value instanceof String s) {
            try {
                return OptionalLong.of(new BigDecimal(s.strip()).longValue());
            } catch (NumberFormatException e) {
                return OptionalLong.empty();
            }
        }
        OptionalDouble d = asDouble(index);
        return d.isPresent() ? OptionalLong.of((long) d.getAsDouble()) : OptionalLong.empty();
    }

    public Optional<String> asString(int index) {
        Object value = cell(index);
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal bd) {
            return Optional.of(bd.toPlainString());
        }
        return Optional.of(value.toString());
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
