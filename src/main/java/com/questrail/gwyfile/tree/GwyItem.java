package com.questrail.gwyfile.tree;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * GwyItem
 * -----------------------------------------------------------------------------
 * A single named, typed value ready to be added to a {@link GwyObject}.
 *
 * <p>Items are created detached from any object through the {@code newXxx}
 * factories and attached with {@link GwyObject#add(GwyItem)}. The name is the
 * full path key for items of a {@code GwyContainer} (e.g. {@code /0/data/title})
 * and a plain component name for items of any other object (e.g. {@code xres}).</p>
 *
 * <p>Array values are copied on the way in and on the way out; an item never
 * shares a mutable buffer with its caller.</p>
 */
public final class GwyItem
{
    private final String name;
    private final GwyItemType type;
    private final Object value;

    private GwyItem(String name, GwyItemType type, Object value) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type;
        this.value = value;
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Item name must not be empty");
        }
    }

    public static GwyItem newBool(String name, boolean value) {
        return new GwyItem(name, GwyItemType.BOOL, value);
    }

    public static GwyItem newInt32(String name, int value) {
        return new GwyItem(name, GwyItemType.INT32, value);
    }

    public static GwyItem newDouble(String name, double value) {
        return new GwyItem(name, GwyItemType.DOUBLE, value);
    }

    public static GwyItem newString(String name, String value) {
        return new GwyItem(name, GwyItemType.STRING, Objects.requireNonNull(value, "value"));
    }

    public static GwyItem newObject(String name, GwyObject value) {
        return new GwyItem(name, GwyItemType.OBJECT, Objects.requireNonNull(value, "value"));
    }

    public static GwyItem newDoubleArray(String name, double[] value) {
        return new GwyItem(name, GwyItemType.DOUBLE_ARRAY,
                Objects.requireNonNull(value, "value").clone());
    }

    public static GwyItem newObjectArray(String name, List<GwyObject> value) {
        Objects.requireNonNull(value, "value");
        value.forEach(o -> Objects.requireNonNull(o, "value element"));
        return new GwyItem(name, GwyItemType.OBJECT_ARRAY, List.copyOf(value));
    }

    public String name() {
        return name;
    }

    public GwyItemType type() {
        return type;
    }

    // ---------------------------------------------------------------------
    // Typed accessors
    // ---------------------------------------------------------------------

    public boolean asBool() {
        return (Boolean) expect(GwyItemType.BOOL);
    }

    public int asInt32() {
        return (Integer) expect(GwyItemType.INT32);
    }

    public double asDouble() {
        return (Double) expect(GwyItemType.DOUBLE);
    }

    public String asString() {
        return (String) expect(GwyItemType.STRING);
    }

    public GwyObject asObject() {
        return (GwyObject) expect(GwyItemType.OBJECT);
    }

    public double[] asDoubleArray() {
        return ((double[]) expect(GwyItemType.DOUBLE_ARRAY)).clone();
    }

    @SuppressWarnings("unchecked")
    public List<GwyObject> asObjectArray() {
        return (List<GwyObject>) expect(GwyItemType.OBJECT_ARRAY);
    }

    private Object expect(GwyItemType expected) {
        if (type != expected) {
            throw new GwyTreeException(name,
                    "Expected " + expected + " item but found " + type);
        }
        return value;
    }

    @Override
    public String toString() {
        String rendered = switch (type) {
            case DOUBLE_ARRAY -> "double[" + ((double[]) value).length + "]";
            case OBJECT_ARRAY -> "object[" + ((List<?>) value).size() + "]";
            case OBJECT -> ((GwyObject) value).name();
            default -> String.valueOf(value);
        };
        return "GwyItem[" + name + " " + type.code() + " " + rendered + "]";
    }

    /**
     * Value equality used by tests and by {@link GwyObject} implementations
     * that compare items. Object-valued items compare by identity of the
     * referenced object.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GwyItem that)) return false;
        if (!name.equals(that.name) || type != that.type) return false;
        if (type == GwyItemType.DOUBLE_ARRAY) {
            return Arrays.equals((double[]) value, (double[]) that.value);
        }
        if (type == GwyItemType.OBJECT) {
            return value == that.value;
        }
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        int valueHash = switch (type) {
            case DOUBLE_ARRAY -> Arrays.hashCode((double[]) value);
            case OBJECT -> System.identityHashCode(value);
            default -> value.hashCode();
        };
        return Objects.hash(name, type, valueHash);
    }
}
