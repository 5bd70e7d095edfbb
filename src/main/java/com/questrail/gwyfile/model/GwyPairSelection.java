package com.questrail.gwyfile.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Line, rectangle or ellipse selections: each instance is a point pair.
 */
public record GwyPairSelection(GwySelectionKind kind, List<GwyPointPair> instances)
        implements GwySelection
{
    public GwyPairSelection {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(instances, "instances");
        if (!kind.isPaired()) {
            throw new IllegalArgumentException(kind + " selections are made of single points");
        }
        if (instances.isEmpty()) {
            throw new IllegalArgumentException(kind + " selection must not be empty");
        }
        instances = List.copyOf(instances);
    }

    @Override
    public int size() {
        return instances.size();
    }

    @Override
    public List<GwyPoint> points() {
        List<GwyPoint> points = new ArrayList<>(instances.size() * 2);
        for (GwyPointPair pair : instances) {
            points.add(pair.first());
            points.add(pair.second());
        }
        return points;
    }
}
