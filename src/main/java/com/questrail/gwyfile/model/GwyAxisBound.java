package com.questrail.gwyfile.model;

/**
 * The four user-settable axis limits of a graph.
 *
 * <p>Each limit is stored as a value item paired with a boolean
 * {@code <name>_set} item; the value only has meaning when the flag is true.</p>
 */
public enum GwyAxisBound
{
    X_MIN("x_min"),
    X_MAX("x_max"),
    Y_MIN("y_min"),
    Y_MAX("y_max");

    private final String valueKey;

    GwyAxisBound(String valueKey) {
        this.valueKey = valueKey;
    }

    public String valueKey() {
        return valueKey;
    }

    public String setKey() {
        return valueKey + "_set";
    }
}
