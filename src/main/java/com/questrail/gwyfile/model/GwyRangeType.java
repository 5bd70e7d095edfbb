package com.questrail.gwyfile.model;

/**
 * False colour mapping of a channel as set by the colour range tool
 * (Gwyddion's {@code GwyLayerBasicRangeType}).
 */
public enum GwyRangeType
{
    /** Full data range. */
    FULL(0),
    /** User-set range, see the channel's range min/max. */
    FIXED(1),
    /** Automatic range with tails cut off. */
    AUTO(2),
    /** Adaptive, histogram-equalized mapping. */
    ADAPT(3);

    private final int code;

    GwyRangeType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
