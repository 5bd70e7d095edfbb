package com.questrail.gwyfile.model;

import java.util.Objects;

/**
 * A named metadata field together with its default value.
 *
 * <p>Each model type publishes one {@code MetaKey} constant per defaultable
 * field. Builders start from {@link #defaultValue()} and decoders fall back to
 * it when the field is absent from the tree, so a default is written down in
 * exactly one place.</p>
 *
 * @param name         item name of the field inside its tree object
 * @param type         Java type of the value ({@code Boolean}, {@code Integer},
 *                     {@code Double} or {@code String})
 * @param defaultValue value used when the field is not given
 */
public record MetaKey<T>(String name, Class<T> type, T defaultValue)
{
    public MetaKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(defaultValue, "defaultValue");
    }

    public static MetaKey<Boolean> ofBool(String name, boolean defaultValue) {
        return new MetaKey<>(name, Boolean.class, defaultValue);
    }

    public static MetaKey<Integer> ofInt(String name, int defaultValue) {
        return new MetaKey<>(name, Integer.class, defaultValue);
    }

    public static MetaKey<Double> ofDouble(String name, double defaultValue) {
        return new MetaKey<>(name, Double.class, defaultValue);
    }

    public static MetaKey<String> ofString(String name, String defaultValue) {
        return new MetaKey<>(name, String.class, defaultValue);
    }
}
