package com.questrail.gwyfile.model;

/**
 * Dash pattern of a graph curve line (GDK's {@code GdkLineStyle}).
 */
public enum GwyLineStyle
{
    SOLID(0),
    ON_OFF_DASH(1),
    DOUBLE_DASH(2);

    private final int code;

    GwyLineStyle(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
