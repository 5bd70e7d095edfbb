package com.questrail.gwyfile.model;

import java.util.Objects;

/**
 * Two points that together define one line, rectangle or ellipse selection.
 *
 * <p>For rectangles and ellipses the points are opposite corners of the
 * bounding box; for lines they are the end points.</p>
 */
public record GwyPointPair(GwyPoint first, GwyPoint second)
{
    public GwyPointPair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    public static GwyPointPair of(double x1, double y1, double x2, double y2) {
        return new GwyPointPair(new GwyPoint(x1, y1), new GwyPoint(x2, y2));
    }
}
