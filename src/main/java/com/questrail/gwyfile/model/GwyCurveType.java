package com.questrail.gwyfile.model;

/**
 * How a graph curve is drawn (Gwyddion's {@code GwyGraphCurveType}).
 */
public enum GwyCurveType
{
    HIDDEN(0),
    POINTS(1),
    LINE(2),
    LINE_AND_POINTS(3);

    private final int code;

    GwyCurveType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
