package com.questrail.gwyfile.model;

/**
 * Marker drawn at each point of a graph curve (Gwyddion's {@code GwyGraphPointType}).
 */
public enum GwyPointType
{
    SQUARE(0),
    CROSS(1),
    CIRCLE(2),
    STAR(3),
    TIMES(4),
    TRIANGLE_UP(5),
    TRIANGLE_DOWN(6),
    DIAMOND(7),
    FILLED_SQUARE(8),
    DISC(9),
    FILLED_TRIANGLE_UP(10),
    FILLED_TRIANGLE_DOWN(11),
    FILLED_DIAMOND(12),
    TRIANGLE_LEFT(13),
    FILLED_TRIANGLE_LEFT(14),
    TRIANGLE_RIGHT(15),
    FILLED_TRIANGLE_RIGHT(16),
    ASTERISK(17);

    private final int code;

    GwyPointType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
