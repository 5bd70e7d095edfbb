package com.questrail.gwyfile.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * GwyGraphCurve
 * -----------------------------------------------------------------------------
 * One data series of a graph: {@code ndata} abscissa/ordinate pairs plus the
 * styling used to draw them.
 *
 * <p>The series is exposed as a 2×N array where row 0 holds the abscissa and
 * row 1 the ordinate. {@code ndata} is inferred from the arrays; when it is
 * also given explicitly the two must agree.</p>
 *
 * <p>Styling fields are stored as the raw integer codes of the file format so
 * that values outside {@link GwyCurveType}, {@link GwyPointType} and
 * {@link GwyLineStyle} survive a round trip unchanged.</p>
 */
public final class GwyGraphCurve
{
    public static final MetaKey<String> DESCRIPTION = MetaKey.ofString("description", "");
    public static final MetaKey<Integer> TYPE = MetaKey.ofInt("type", GwyCurveType.POINTS.code());
    public static final MetaKey<Integer> POINT_TYPE = MetaKey.ofInt("point_type", GwyPointType.CIRCLE.code());
    public static final MetaKey<Integer> LINE_STYLE = MetaKey.ofInt("line_style", GwyLineStyle.SOLID.code());
    public static final MetaKey<Integer> POINT_SIZE = MetaKey.ofInt("point_size", 1);
    public static final MetaKey<Integer> LINE_SIZE = MetaKey.ofInt("line_size", 1);
    public static final MetaKey<Double> COLOR_RED = MetaKey.ofDouble("color.red", 0.0);
    public static final MetaKey<Double> COLOR_GREEN = MetaKey.ofDouble("color.green", 0.0);
    public static final MetaKey<Double> COLOR_BLUE = MetaKey.ofDouble("color.blue", 0.0);

    private final double[] xdata;
    private final double[] ydata;
    private final String description;
    private final int type;
    private final int pointType;
    private final int lineStyle;
    private final int pointSize;
    private final int lineSize;
    private final double colorRed;
    private final double colorGreen;
    private final double colorBlue;

    private GwyGraphCurve(Builder b) {
        this.xdata = b.xdata;
        this.ydata = b.ydata;
        this.description = b.description;
        this.type = b.type;
        this.pointType = b.pointType;
        this.lineStyle = b.lineStyle;
        this.pointSize = b.pointSize;
        this.lineSize = b.lineSize;
        this.colorRed = b.colorRed;
        this.colorGreen = b.colorGreen;
        this.colorBlue = b.colorBlue;
    }

    /**
     * Starts a builder from a 2×N array: {@code data[0]} abscissa, {@code data[1]} ordinate.
     *
     * @throws IllegalArgumentException if {@code data} does not have exactly two
     *         rows of equal length
     */
    public static Builder builder(double[][] data) {
        Objects.requireNonNull(data, "data");
        if (data.length != 2) {
            throw new IllegalArgumentException(
                    "Curve data must have shape (2, ndata), got " + data.length + " rows");
        }
        return builder(data[0], data[1]);
    }

    /**
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public static Builder builder(double[] xdata, double[] ydata) {
        Objects.requireNonNull(xdata, "xdata");
        Objects.requireNonNull(ydata, "ydata");
        if (xdata.length != ydata.length) {
            throw new IllegalArgumentException(
                    "Abscissa and ordinate differ in length: "
                            + xdata.length + " vs " + ydata.length);
        }
        return new Builder(xdata.clone(), ydata.clone());
    }

    public int ndata() {
        return xdata.length;
    }

    public double[] xdata() {
        return xdata.clone();
    }

    public double[] ydata() {
        return ydata.clone();
    }

    /**
     * @return a copy of the series as a 2×N array
     */
    public double[][] data() {
        return new double[][] { xdata.clone(), ydata.clone() };
    }

    public String description() {
        return description;
    }

    public int type() {
        return type;
    }

    public int pointType() {
        return pointType;
    }

    public int lineStyle() {
        return lineStyle;
    }

    public int pointSize() {
        return pointSize;
    }

    public int lineSize() {
        return lineSize;
    }

    public double colorRed() {
        return colorRed;
    }

    public double colorGreen() {
        return colorGreen;
    }

    public double colorBlue() {
        return colorBlue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GwyGraphCurve that)) return false;
        return type == that.type
                && pointType == that.pointType
                && lineStyle == that.lineStyle
                && pointSize == that.pointSize
                && lineSize == that.lineSize
                && Double.compare(colorRed, that.colorRed) == 0
                && Double.compare(colorGreen, that.colorGreen) == 0
                && Double.compare(colorBlue, that.colorBlue) == 0
                && description.equals(that.description)
                && Arrays.equals(xdata, that.xdata)
                && Arrays.equals(ydata, that.ydata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(description, type, pointType, lineStyle,
                pointSize, lineSize, colorRed, colorGreen, colorBlue);
        result = 31 * result + Arrays.hashCode(xdata);
        return 31 * result + Arrays.hashCode(ydata);
    }

    @Override
    public String toString() {
        return "GwyGraphCurve['" + description + "', ndata=" + xdata.length + "]";
    }

    public static final class Builder
    {
        private final double[] xdata;
        private final double[] ydata;
        private Integer declaredNdata;
        private String description = DESCRIPTION.defaultValue();
        private int type = TYPE.defaultValue();
        private int pointType = POINT_TYPE.defaultValue();
        private int lineStyle = LINE_STYLE.defaultValue();
        private int pointSize = POINT_SIZE.defaultValue();
        private int lineSize = LINE_SIZE.defaultValue();
        private double colorRed = COLOR_RED.defaultValue();
        private double colorGreen = COLOR_GREEN.defaultValue();
        private double colorBlue = COLOR_BLUE.defaultValue();

        private Builder(double[] xdata, double[] ydata) {
            this.xdata = xdata;
            this.ydata = ydata;
        }

        /**
         * Declares the expected number of points; checked in {@link #build()}.
         */
        public Builder ndata(int ndata) {
            this.declaredNdata = ndata;
            return this;
        }

        public Builder description(String description) {
            this.description = Objects.requireNonNull(description, "description");
            return this;
        }

        public Builder type(int type) {
            this.type = type;
            return this;
        }

        public Builder type(GwyCurveType type) {
            return type(type.code());
        }

        public Builder pointType(int pointType) {
            this.pointType = pointType;
            return this;
        }

        public Builder pointType(GwyPointType pointType) {
            return pointType(pointType.code());
        }

        public Builder lineStyle(int lineStyle) {
            this.lineStyle = lineStyle;
            return this;
        }

        public Builder lineStyle(GwyLineStyle lineStyle) {
            return lineStyle(lineStyle.code());
        }

        public Builder pointSize(int pointSize) {
            this.pointSize = pointSize;
            return this;
        }

        public Builder lineSize(int lineSize) {
            this.lineSize = lineSize;
            return this;
        }

        public Builder color(double red, double green, double blue) {
            this.colorRed = red;
            this.colorGreen = green;
            this.colorBlue = blue;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a declared {@code ndata} disagrees
         *         with the series length
         */
        public GwyGraphCurve build() {
            if (declaredNdata != null && declaredNdata != xdata.length) {
                throw new IllegalArgumentException(
                        "Declared ndata " + declaredNdata
                                + " does not match series length " + xdata.length);
            }
            return new GwyGraphCurve(this);
        }
    }
}
