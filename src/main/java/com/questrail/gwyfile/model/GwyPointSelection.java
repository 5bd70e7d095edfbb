package com.questrail.gwyfile.model;

import java.util.List;
import java.util.Objects;

/**
 * Point or pointer selections: each instance is a single point.
 */
public record GwyPointSelection(GwySelectionKind kind, List<GwyPoint> instances)
        implements GwySelection
{
    public GwyPointSelection {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(instances, "instances");
        if (kind.isPaired()) {
            throw new IllegalArgumentException(kind + " selections are made of point pairs");
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
        return instances;
    }
}
