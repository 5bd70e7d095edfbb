package com.questrail.gwyfile.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * GwyGraphModel
 * -----------------------------------------------------------------------------
 * A graph: an ordered list of {@link GwyGraphCurve}s and the axis, label and
 * grid settings they are drawn with.
 *
 * <h2>Field defaults</h2>
 * <ul>
 *   <li>Title, the four labels and both axis units: empty string</li>
 *   <li>Axis bounds: unset (see {@link GwyAxisBound})</li>
 *   <li>Logarithmic axes: false</li>
 *   <li>Label box: visible, framed, not reversed, frame thickness 1, position 0</li>
 *   <li>Grid type: 1</li>
 *   <li>Visibility: false</li>
 * </ul>
 *
 * <p>Every default is resolved when the graph is built, so encoders always
 * have a concrete value to write.</p>
 *
 * <p>Visibility is not part of the graph's own tree object; it is stored next
 * to it under {@code /0/graph/graph/N/visible}.</p>
 */
public final class GwyGraphModel
{
    public static final MetaKey<String> TITLE = MetaKey.ofString("title", "");
    public static final MetaKey<String> TOP_LABEL = MetaKey.ofString("top_label", "");
    public static final MetaKey<String> LEFT_LABEL = MetaKey.ofString("left_label", "");
    public static final MetaKey<String> RIGHT_LABEL = MetaKey.ofString("right_label", "");
    public static final MetaKey<String> BOTTOM_LABEL = MetaKey.ofString("bottom_label", "");
    public static final MetaKey<String> X_UNIT = MetaKey.ofString("x_unit", "");
    public static final MetaKey<String> Y_UNIT = MetaKey.ofString("y_unit", "");
    public static final MetaKey<Boolean> X_IS_LOGARITHMIC = MetaKey.ofBool("x_is_logarithmic", false);
    public static final MetaKey<Boolean> Y_IS_LOGARITHMIC = MetaKey.ofBool("y_is_logarithmic", false);
    public static final MetaKey<Boolean> LABEL_VISIBLE = MetaKey.ofBool("label.visible", true);
    public static final MetaKey<Boolean> LABEL_HAS_FRAME = MetaKey.ofBool("label.has_frame", true);
    public static final MetaKey<Boolean> LABEL_REVERSE = MetaKey.ofBool("label.reverse", false);
    public static final MetaKey<Integer> LABEL_FRAME_THICKNESS = MetaKey.ofInt("label.frame_thickness", 1);
    public static final MetaKey<Integer> LABEL_POSITION = MetaKey.ofInt("label.position", 0);
    public static final MetaKey<Integer> GRID_TYPE = MetaKey.ofInt("grid-type", 1);
    public static final MetaKey<Boolean> VISIBLE = MetaKey.ofBool("visible", false);

    private final List<GwyGraphCurve> curves;
    private final String title;
    private final String topLabel;
    private final String leftLabel;
    private final String rightLabel;
    private final String bottomLabel;
    private final String xUnit;
    private final String yUnit;
    private final Map<GwyAxisBound, Double> bounds;
    private final boolean xLogarithmic;
    private final boolean yLogarithmic;
    private final boolean labelVisible;
    private final boolean labelHasFrame;
    private final boolean labelReverse;
    private final int labelFrameThickness;
    private final int labelPosition;
    private final int gridType;
    private final boolean visible;

    private GwyGraphModel(Builder b) {
        this.curves = List.copyOf(b.curves);
        this.title = b.title;
        this.topLabel = b.topLabel;
        this.leftLabel = b.leftLabel;
        this.rightLabel = b.rightLabel;
        this.bottomLabel = b.bottomLabel;
        this.xUnit = b.xUnit;
        this.yUnit = b.yUnit;
        this.bounds = new EnumMap<>(GwyAxisBound.class);
        this.bounds.putAll(b.bounds);
        this.xLogarithmic = b.xLogarithmic;
        this.yLogarithmic = b.yLogarithmic;
        this.labelVisible = b.labelVisible;
        this.labelHasFrame = b.labelHasFrame;
        this.labelReverse = b.labelReverse;
        this.labelFrameThickness = b.labelFrameThickness;
        this.labelPosition = b.labelPosition;
        this.gridType = b.gridType;
        this.visible = b.visible;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(Collection<GwyGraphCurve> curves) {
        return new Builder().curves(curves);
    }

    public List<GwyGraphCurve> curves() {
        return curves;
    }

    public int ncurves() {
        return curves.size();
    }

    public String title() {
        return title;
    }

    public String topLabel() {
        return topLabel;
    }

    public String leftLabel() {
        return leftLabel;
    }

    public String rightLabel() {
        return rightLabel;
    }

    public String bottomLabel() {
        return bottomLabel;
    }

    public String xUnit() {
        return xUnit;
    }

    public String yUnit() {
        return yUnit;
    }

    /**
     * @return the bound's value, or empty if the bound is not set
     */
    public Optional<Double> bound(GwyAxisBound bound) {
        return Optional.ofNullable(bounds.get(Objects.requireNonNull(bound, "bound")));
    }

    public Optional<Double> xMin() {
        return bound(GwyAxisBound.X_MIN);
    }

    public Optional<Double> xMax() {
        return bound(GwyAxisBound.X_MAX);
    }

    public Optional<Double> yMin() {
        return bound(GwyAxisBound.Y_MIN);
    }

    public Optional<Double> yMax() {
        return bound(GwyAxisBound.Y_MAX);
    }

    public boolean xLogarithmic() {
        return xLogarithmic;
    }

    public boolean yLogarithmic() {
        return yLogarithmic;
    }

    public boolean labelVisible() {
        return labelVisible;
    }

    public boolean labelHasFrame() {
        return labelHasFrame;
    }

    public boolean labelReverse() {
        return labelReverse;
    }

    public int labelFrameThickness() {
        return labelFrameThickness;
    }

    public int labelPosition() {
        return labelPosition;
    }

    public int gridType() {
        return gridType;
    }

    public boolean visible() {
        return visible;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GwyGraphModel that)) return false;
        return xLogarithmic == that.xLogarithmic
                && yLogarithmic == that.yLogarithmic
                && labelVisible == that.labelVisible
                && labelHasFrame == that.labelHasFrame
                && labelReverse == that.labelReverse
                && labelFrameThickness == that.labelFrameThickness
                && labelPosition == that.labelPosition
                && gridType == that.gridType
                && visible == that.visible
                && curves.equals(that.curves)
                && title.equals(that.title)
                && topLabel.equals(that.topLabel)
                && leftLabel.equals(that.leftLabel)
                && rightLabel.equals(that.rightLabel)
                && bottomLabel.equals(that.bottomLabel)
                && xUnit.equals(that.xUnit)
                && yUnit.equals(that.yUnit)
                && bounds.equals(that.bounds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(curves, title, topLabel, leftLabel, rightLabel, bottomLabel,
                xUnit, yUnit, bounds, xLogarithmic, yLogarithmic, labelVisible,
                labelHasFrame, labelReverse, labelFrameThickness, labelPosition,
                gridType, visible);
    }

    @Override
    public String toString() {
        return "GwyGraphModel['" + title + "', curves=" + curves.size() + "]";
    }

    public static final class Builder
    {
        private final List<GwyGraphCurve> curves = new ArrayList<>();
        private Integer declaredNcurves;
        private String title = TITLE.defaultValue();
        private String topLabel = TOP_LABEL.defaultValue();
        private String leftLabel = LEFT_LABEL.defaultValue();
        private String rightLabel = RIGHT_LABEL.defaultValue();
        private String bottomLabel = BOTTOM_LABEL.defaultValue();
        private String xUnit = X_UNIT.defaultValue();
        private String yUnit = Y_UNIT.defaultValue();
        private final Map<GwyAxisBound, Double> bounds = new EnumMap<>(GwyAxisBound.class);
        private boolean xLogarithmic = X_IS_LOGARITHMIC.defaultValue();
        private boolean yLogarithmic = Y_IS_LOGARITHMIC.defaultValue();
        private boolean labelVisible = LABEL_VISIBLE.defaultValue();
        private boolean labelHasFrame = LABEL_HAS_FRAME.defaultValue();
        private boolean labelReverse = LABEL_REVERSE.defaultValue();
        private int labelFrameThickness = LABEL_FRAME_THICKNESS.defaultValue();
        private int labelPosition = LABEL_POSITION.defaultValue();
        private int gridType = GRID_TYPE.defaultValue();
        private boolean visible = VISIBLE.defaultValue();

        private Builder() {}

        public Builder curve(GwyGraphCurve curve) {
            curves.add(Objects.requireNonNull(curve, "curve"));
            return this;
        }

        public Builder curves(Collection<GwyGraphCurve> curves) {
            Objects.requireNonNull(curves, "curves").forEach(this::curve);
            return this;
        }

        /**
         * Declares the expected number of curves; checked in {@link #build()}.
         */
        public Builder ncurves(int ncurves) {
            this.declaredNcurves = ncurves;
            return this;
        }

        public Builder title(String title) {
            this.title = Objects.requireNonNull(title, "title");
            return this;
        }

        public Builder topLabel(String topLabel) {
            this.topLabel = Objects.requireNonNull(topLabel, "topLabel");
            return this;
        }

        public Builder leftLabel(String leftLabel) {
            this.leftLabel = Objects.requireNonNull(leftLabel, "leftLabel");
            return this;
        }

        public Builder rightLabel(String rightLabel) {
            this.rightLabel = Objects.requireNonNull(rightLabel, "rightLabel");
            return this;
        }

        public Builder bottomLabel(String bottomLabel) {
            this.bottomLabel = Objects.requireNonNull(bottomLabel, "bottomLabel");
            return this;
        }

        public Builder xUnit(String xUnit) {
            this.xUnit = Objects.requireNonNull(xUnit, "xUnit");
            return this;
        }

        public Builder yUnit(String yUnit) {
            this.yUnit = Objects.requireNonNull(yUnit, "yUnit");
            return this;
        }

        public Builder bound(GwyAxisBound bound, double value) {
            bounds.put(Objects.requireNonNull(bound, "bound"), value);
            return this;
        }

        public Builder clearBound(GwyAxisBound bound) {
            bounds.remove(Objects.requireNonNull(bound, "bound"));
            return this;
        }

        public Builder xMin(double value) {
            return bound(GwyAxisBound.X_MIN, value);
        }

        public Builder xMax(double value) {
            return bound(GwyAxisBound.X_MAX, value);
        }

        public Builder yMin(double value) {
            return bound(GwyAxisBound.Y_MIN, value);
        }

        public Builder yMax(double value) {
            return bound(GwyAxisBound.Y_MAX, value);
        }

        public Builder xLogarithmic(boolean xLogarithmic) {
            this.xLogarithmic = xLogarithmic;
            return this;
        }

        public Builder yLogarithmic(boolean yLogarithmic) {
            this.yLogarithmic = yLogarithmic;
            return this;
        }

        public Builder labelVisible(boolean labelVisible) {
            this.labelVisible = labelVisible;
            return this;
        }

        public Builder labelHasFrame(boolean labelHasFrame) {
            this.labelHasFrame = labelHasFrame;
            return this;
        }

        public Builder labelReverse(boolean labelReverse) {
            this.labelReverse = labelReverse;
            return this;
        }

        public Builder labelFrameThickness(int labelFrameThickness) {
            this.labelFrameThickness = labelFrameThickness;
            return this;
        }

        public Builder labelPosition(int labelPosition) {
            this.labelPosition = labelPosition;
            return this;
        }

        public Builder gridType(int gridType) {
            this.gridType = gridType;
            return this;
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a declared {@code ncurves}
         *         disagrees with the number of curves added
         */
        public GwyGraphModel build() {
            if (declaredNcurves != null && declaredNcurves != curves.size()) {
                throw new IllegalArgumentException(
                        "Declared ncurves " + declaredNcurves
                                + " does not match number of curves " + curves.size());
            }
            return new GwyGraphModel(this);
        }
    }
}
