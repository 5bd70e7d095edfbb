package com.questrail.gwyfile.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * GwyDataField
 * -----------------------------------------------------------------------------
 * A two-dimensional grid of samples with its physical calibration.
 *
 * <h2>Shape</h2>
 * <p>The grid has {@code xres} rows of {@code yres} samples each and is
 * addressed as {@code value(x, y)} with {@code 0 <= x < xres} and
 * {@code 0 <= y < yres}. The flat, row-major form used by the item tree puts
 * sample {@code (x, y)} at index {@code x * yres + y}.</p>
 *
 * <p>The grid shape always equals the declared resolution. A builder given an
 * explicit resolution that disagrees with the grid it was created from fails
 * with {@link IllegalArgumentException}; a mismatched field can therefore never
 * reach a tree.</p>
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>{@link #XREAL}, {@link #YREAL}: 1.0</li>
 *   <li>{@link #XOFF}, {@link #YOFF}: 0.0</li>
 *   <li>{@link #SI_UNIT_XY}, {@link #SI_UNIT_Z}: empty string</li>
 * </ul>
 *
 * <p>Instances are immutable. Sample arrays are copied on construction and on
 * every accessor that returns them.</p>
 */
public final class GwyDataField
{
    public static final MetaKey<Double> XREAL = MetaKey.ofDouble("xreal", 1.0);
    public static final MetaKey<Double> YREAL = MetaKey.ofDouble("yreal", 1.0);
    public static final MetaKey<Double> XOFF = MetaKey.ofDouble("xoff", 0.0);
    public static final MetaKey<Double> YOFF = MetaKey.ofDouble("yoff", 0.0);
    public static final MetaKey<String> SI_UNIT_XY = MetaKey.ofString("si_unit_xy", "");
    public static final MetaKey<String> SI_UNIT_Z = MetaKey.ofString("si_unit_z", "");

    private final int xres;
    private final int yres;
    private final double[] samples;
    private final double xreal;
    private final double yreal;
    private final double xoff;
    private final double yoff;
    private final String siUnitXy;
    private final String siUnitZ;

    private GwyDataField(Builder b) {
        this.xres = b.xres;
        this.yres = b.yres;
        this.samples = b.samples;
        this.xreal = b.xreal;
        this.yreal = b.yreal;
        this.xoff = b.xoff;
        this.yoff = b.yoff;
        this.siUnitXy = b.siUnitXy;
        this.siUnitZ = b.siUnitZ;
    }

    /**
     * Starts a builder from a rectangular grid {@code data[x][y]}.
     *
     * @throws IllegalArgumentException if the grid is empty or ragged
     */
    public static Builder builder(double[][] data) {
        Objects.requireNonNull(data, "data");
        if (data.length == 0 || data[0] == null || data[0].length == 0) {
            throw new IllegalArgumentException("Data field grid must not be empty");
        }
        int xres = data.length;
        int yres = data[0].length;
        double[] flat = new double[xres * yres];
        for (int x = 0; x < xres; x++) {
            double[] row = data[x];
            if (row == null || row.length != yres) {
                throw new IllegalArgumentException(
                        "Data field grid is not rectangular: row " + x + " has "
                                + (row == null ? "no" : String.valueOf(row.length))
                                + " samples, expected " + yres);
            }
            System.arraycopy(row, 0, flat, x * yres, yres);
        }
        return new Builder(xres, yres, flat);
    }

    /**
     * Starts a builder from a flat row-major buffer of {@code xres * yres} samples.
     *
     * @throws IllegalArgumentException if a resolution is not positive or the
     *         buffer length is not {@code xres * yres}
     */
    public static Builder builder(int xres, int yres, double[] samples) {
        Objects.requireNonNull(samples, "samples");
        requirePositive("xres", xres);
        requirePositive("yres", yres);
        if ((long) xres * yres != samples.length) {
            throw new IllegalArgumentException(
                    "Sample buffer holds " + samples.length + " values, expected "
                            + xres + " x " + yres);
        }
        return new Builder(xres, yres, samples.clone());
    }

    /**
     * Convenience for a grid of {@code xres * yres} zeros with default metadata.
     */
    public static GwyDataField zeros(int xres, int yres) {
        requirePositive("xres", xres);
        requirePositive("yres", yres);
        return new Builder(xres, yres, new double[xres * yres]).build();
    }

    public int xres() {
        return xres;
    }

    public int yres() {
        return yres;
    }

    public double xreal() {
        return xreal;
    }

    public double yreal() {
        return yreal;
    }

    public double xoff() {
        return xoff;
    }

    public double yoff() {
        return yoff;
    }

    public String siUnitXy() {
        return siUnitXy;
    }

    public String siUnitZ() {
        return siUnitZ;
    }

    /**
     * Physical size of one sample along x.
     */
    public double dx() {
        return xreal / xres;
    }

    /**
     * Physical size of one sample along y.
     */
    public double dy() {
        return yreal / yres;
    }

    /**
     * @throws IndexOutOfBoundsException if {@code (x, y)} lies outside the grid
     */
    public double value(int x, int y) {
        Objects.checkIndex(x, xres);
        Objects.checkIndex(y, yres);
        return samples[x * yres + y];
    }

    /**
     * @return a copy of the grid as {@code data[x][y]}
     */
    public double[][] data() {
        double[][] grid = new double[xres][];
        for (int x = 0; x < xres; x++) {
            grid[x] = Arrays.copyOfRange(samples, x * yres, (x + 1) * yres);
        }
        return grid;
    }

    /**
     * @return a copy of the samples in flat row-major order
     */
    public double[] samples() {
        return samples.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GwyDataField that)) return false;
        return xres == that.xres
                && yres == that.yres
                && Double.compare(xreal, that.xreal) == 0
                && Double.compare(yreal, that.yreal) == 0
                && Double.compare(xoff, that.xoff) == 0
                && Double.compare(yoff, that.yoff) == 0
                && siUnitXy.equals(that.siUnitXy)
                && siUnitZ.equals(that.siUnitZ)
                && Arrays.equals(samples, that.samples);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(xres, yres, xreal, yreal, xoff, yoff, siUnitXy, siUnitZ);
        return 31 * result + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "GwyDataField[" + xres + "x" + yres
                + ", real=" + xreal + "x" + yreal
                + ", off=" + xoff + "," + yoff
                + ", units='" + siUnitXy + "'/'" + siUnitZ + "']";
    }

    private static void requirePositive(String what, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(what + " must be positive (was " + value + ")");
        }
    }

    public static final class Builder
    {
        private final int xres;
        private final int yres;
        private final double[] samples;
        private Integer declaredXres;
        private Integer declaredYres;
        private double xreal = XREAL.defaultValue();
        private double yreal = YREAL.defaultValue();
        private double xoff = XOFF.defaultValue();
        private double yoff = YOFF.defaultValue();
        private String siUnitXy = SI_UNIT_XY.defaultValue();
        private String siUnitZ = SI_UNIT_Z.defaultValue();

        private Builder(int xres, int yres, double[] samples) {
            this.xres = xres;
            this.yres = yres;
            this.samples = samples;
        }

        /**
         * Declares the expected resolution. Checked against the grid shape in
         * {@link #build()}.
         */
        public Builder resolution(int xres, int yres) {
            this.declaredXres = xres;
            this.declaredYres = yres;
            return this;
        }

        public Builder xreal(double xreal) {
            this.xreal = xreal;
            return this;
        }

        public Builder yreal(double yreal) {
            this.yreal = yreal;
            return this;
        }

        public Builder xoff(double xoff) {
            this.xoff = xoff;
            return this;
        }

        public Builder yoff(double yoff) {
            this.yoff = yoff;
            return this;
        }

        public Builder siUnitXy(String siUnitXy) {
            this.siUnitXy = Objects.requireNonNull(siUnitXy, "siUnitXy");
            return this;
        }

        public Builder siUnitZ(String siUnitZ) {
            this.siUnitZ = Objects.requireNonNull(siUnitZ, "siUnitZ");
            return this;
        }

        /**
         * @throws IllegalArgumentException if a declared resolution disagrees
         *         with the grid shape
         */
        public GwyDataField build() {
            if (declaredXres != null && (declaredXres != xres || declaredYres != yres)) {
                throw new IllegalArgumentException(
                        "Declared resolution " + declaredXres + "x" + declaredYres
                                + " does not match grid shape " + xres + "x" + yres);
            }
            return new GwyDataField(this);
        }
    }
}
