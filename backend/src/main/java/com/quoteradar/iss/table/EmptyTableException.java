package com.quoteradar.iss.table;

import lombok.Getter;

/**
 * A required table decoded fine but has no rows (e.g. unknown security id).
 */
@Getter
public class EmptyTableException extends TableDecodeException {

    public static final String CODE = "EMPTY_TABLE";

    private final String blockName;

    public EmptyTableException(String blockName) {
        super(CODE, "Table '" + blockName + "' has no rows");
        this.blockName = blockName;
    }
}
