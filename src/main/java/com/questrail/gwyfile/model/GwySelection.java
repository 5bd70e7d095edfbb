package com.questrail.gwyfile.model;

import java.util.List;

/**
 * A non-empty set of selection instances of a single {@link GwySelectionKind}.
 *
 * <h2>Shape</h2>
 * <ul>
 *   <li>{@link GwyPointSelection}: one {@link GwyPoint} per instance
 *       (kinds {@code POINT}, {@code POINTER})</li>
 *   <li>{@link GwyPairSelection}: one {@link GwyPointPair} per instance
 *       (kinds {@code LINE}, {@code RECTANGLE}, {@code ELLIPSE})</li>
 * </ul>
 *
 * <p>A selection is never empty. A channel without selections of some kind
 * leaves that slot unset instead of holding an empty selection; constructing
 * one with zero instances fails with {@link IllegalArgumentException}.</p>
 */
public sealed interface GwySelection permits GwyPointSelection, GwyPairSelection
{
    GwySelectionKind kind();

    /**
     * @return number of selection instances (never zero)
     */
    int size();

    /**
     * Returns every point of every instance in order; pairs contribute their
     * first point followed by their second.
     */
    List<GwyPoint> points();

    static GwyPointSelection point(List<GwyPoint> points) {
        return new GwyPointSelection(GwySelectionKind.POINT, points);
    }

    static GwyPointSelection pointer(List<GwyPoint> points) {
        return new GwyPointSelection(GwySelectionKind.POINTER, points);
    }

    static GwyPairSelection line(List<GwyPointPair> pairs) {
        return new GwyPairSelection(GwySelectionKind.LINE, pairs);
    }

    static GwyPairSelection rectangle(List<GwyPointPair> pairs) {
        return new GwyPairSelection(GwySelectionKind.RECTANGLE, pairs);
    }

    static GwyPairSelection ellipse(List<GwyPointPair> pairs) {
        return new GwyPairSelection(GwySelectionKind.ELLIPSE, pairs);
    }
}
