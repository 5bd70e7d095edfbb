package com.questrail.gwyfile.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * GwyChannel
 * -----------------------------------------------------------------------------
 * One image of a container together with its auxiliary data.
 *
 * <h2>Required</h2>
 * <ul>
 *   <li>{@link #title()}</li>
 *   <li>{@link #data()}: the primary data field</li>
 * </ul>
 *
 * <h2>Optional</h2>
 * Every other field is independently optional and is represented as an empty
 * {@link Optional} when unset: mask and presentation data fields, the four
 * mask colour components, palette, colour range type and user range min/max,
 * and one selection per {@link GwySelectionKind}. The visibility flag is
 * optional as well; {@link #visible()} reads an unset flag as {@code false}.
 *
 * <p>Instances are immutable; use {@link #toBuilder()} to derive a modified copy.</p>
 */
public final class GwyChannel
{
    public static final MetaKey<Boolean> VISIBLE = MetaKey.ofBool("visible", false);

    private final String title;
    private final GwyDataField data;
    private final Boolean visible;
    private final String palette;
    private final Integer rangeType;
    private final Double rangeMin;
    private final Double rangeMax;
    private final GwyDataField mask;
    private final Double maskRed;
    private final Double maskGreen;
    private final Double maskBlue;
    private final Double maskAlpha;
    private final GwyDataField presentation;
    private final Map<GwySelectionKind, GwySelection> selections;

    private GwyChannel(Builder b) {
        this.title = b.title;
        this.data = b.data;
        this.visible = b.visible;
        this.palette = b.palette;
        this.rangeType = b.rangeType;
        this.rangeMin = b.rangeMin;
        this.rangeMax = b.rangeMax;
        this.mask = b.mask;
        this.maskRed = b.maskRed;
        this.maskGreen = b.maskGreen;
        this.maskBlue = b.maskBlue;
        this.maskAlpha = b.maskAlpha;
        this.presentation = b.presentation;
        EnumMap<GwySelectionKind, GwySelection> copy = new EnumMap<>(GwySelectionKind.class);
        copy.putAll(b.selections);
        this.selections = Collections.unmodifiableMap(copy);
    }

    public static Builder builder(String title, GwyDataField data) {
        return new Builder(title, data);
    }

    public Builder toBuilder() {
        Builder b = new Builder(title, data);
        b.visible = visible;
        b.palette = palette;
        b.rangeType = rangeType;
        b.rangeMin = rangeMin;
        b.rangeMax = rangeMax;
        b.mask = mask;
        b.maskRed = maskRed;
        b.maskGreen = maskGreen;
        b.maskBlue = maskBlue;
        b.maskAlpha = maskAlpha;
        b.presentation = presentation;
        b.selections.putAll(selections);
        return b;
    }

    public String title() {
        return title;
    }

    public GwyDataField data() {
        return data;
    }

    /**
     * @return the visibility flag, or {@link #VISIBLE}'s default when unset
     */
    public boolean visible() {
        return visible != null ? visible : VISIBLE.defaultValue();
    }

    /**
     * @return the visibility flag only if it was set explicitly
     */
    public Optional<Boolean> visibility() {
        return Optional.ofNullable(visible);
    }

    public Optional<String> palette() {
        return Optional.ofNullable(palette);
    }

    /**
     * @return the raw colour range type code; see {@link GwyRangeType}
     */
    public Optional<Integer> rangeType() {
        return Optional.ofNullable(rangeType);
    }

    public Optional<Double> rangeMin() {
        return Optional.ofNullable(rangeMin);
    }

    public Optional<Double> rangeMax() {
        return Optional.ofNullable(rangeMax);
    }

    public Optional<GwyDataField> mask() {
        return Optional.ofNullable(mask);
    }

    public Optional<Double> maskRed() {
        return Optional.ofNullable(maskRed);
    }

    public Optional<Double> maskGreen() {
        return Optional.ofNullable(maskGreen);
    }

    public Optional<Double> maskBlue() {
        return Optional.ofNullable(maskBlue);
    }

    public Optional<Double> maskAlpha() {
        return Optional.ofNullable(maskAlpha);
    }

    public Optional<GwyDataField> presentation() {
        return Optional.ofNullable(presentation);
    }

    public Optional<GwySelection> selection(GwySelectionKind kind) {
        return Optional.ofNullable(selections.get(Objects.requireNonNull(kind, "kind")));
    }

    /**
     * @return all present selections keyed by kind, in {@link GwySelectionKind} order
     */
    public Map<GwySelectionKind, GwySelection> selections() {
        return selections;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GwyChannel that)) return false;
        return Objects.equals(visible, that.visible)
                && title.equals(that.title)
                && data.equals(that.data)
                && Objects.equals(palette, that.palette)
                && Objects.equals(rangeType, that.rangeType)
                && Objects.equals(rangeMin, that.rangeMin)
                && Objects.equals(rangeMax, that.rangeMax)
                && Objects.equals(mask, that.mask)
                && Objects.equals(maskRed, that.maskRed)
                && Objects.equals(maskGreen, that.maskGreen)
                && Objects.equals(maskBlue, that.maskBlue)
                && Objects.equals(maskAlpha, that.maskAlpha)
                && Objects.equals(presentation, that.presentation)
                && selections.equals(that.selections);
    }

    @Override
    public int hashCode() {
        return Objects.hash(title, data, visible, palette, rangeType, rangeMin, rangeMax,
                mask, maskRed, maskGreen, maskBlue, maskAlpha, presentation, selections);
    }

    @Override
    public String toString() {
        return "GwyChannel['" + title + "', " + data.xres() + "x" + data.yres()
                + (mask != null ? ", mask" : "")
                + (presentation != null ? ", presentation" : "")
                + ", selections=" + selections.keySet() + "]";
    }

    public static final class Builder
    {
        private final String title;
        private final GwyDataField data;
        private Boolean visible;
        private String palette;
        private Integer rangeType;
        private Double rangeMin;
        private Double rangeMax;
        private GwyDataField mask;
        private Double maskRed;
        private Double maskGreen;
        private Double maskBlue;
        private Double maskAlpha;
        private GwyDataField presentation;
        private final Map<GwySelectionKind, GwySelection> selections =
                new EnumMap<>(GwySelectionKind.class);

        private Builder(String title, GwyDataField data) {
            this.title = Objects.requireNonNull(title, "title");
            this.data = Objects.requireNonNull(data, "data");
        }

        public Builder visible(boolean visible) {
            this.visible = visible;
            return this;
        }

        public Builder palette(String palette) {
            this.palette = Objects.requireNonNull(palette, "palette");
            return this;
        }

        public Builder rangeType(int rangeType) {
            this.rangeType = rangeType;
            return this;
        }

        public Builder rangeType(GwyRangeType rangeType) {
            return rangeType(rangeType.code());
        }

        public Builder rangeMin(double rangeMin) {
            this.rangeMin = rangeMin;
            return this;
        }

        public Builder rangeMax(double rangeMax) {
            this.rangeMax = rangeMax;
            return this;
        }

        public Builder mask(GwyDataField mask) {
            this.mask = Objects.requireNonNull(mask, "mask");
            return this;
        }

        public Builder maskRed(double maskRed) {
            this.maskRed = maskRed;
            return this;
        }

        public Builder maskGreen(double maskGreen) {
            this.maskGreen = maskGreen;
            return this;
        }

        public Builder maskBlue(double maskBlue) {
            this.maskBlue = maskBlue;
            return this;
        }

        public Builder maskAlpha(double maskAlpha) {
            this.maskAlpha = maskAlpha;
            return this;
        }

        public Builder maskColor(double red, double green, double blue, double alpha) {
            return maskRed(red).maskGreen(green).maskBlue(blue).maskAlpha(alpha);
        }

        public Builder presentation(GwyDataField presentation) {
            this.presentation = Objects.requireNonNull(presentation, "presentation");
            return this;
        }

        /**
         * Fills the slot of the selection's kind, replacing any previous
         * selection of that kind.
         */
        public Builder selection(GwySelection selection) {
            Objects.requireNonNull(selection, "selection");
            selections.put(selection.kind(), selection);
            return this;
        }

        public Builder selections(Collection<? extends GwySelection> selections) {
            Objects.requireNonNull(selections, "selections").forEach(this::selection);
            return this;
        }

        public GwyChannel build() {
            return new GwyChannel(this);
        }
    }
}
