package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.MetaKey;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;
import com.questrail.gwyfile.tree.GwyTreeException;

import java.util.Optional;

/**
 * Typed field access shared by the codecs.
 *
 * <p>Optional fields are read through their {@link MetaKey} and fall back to
 * its default; required fields raise {@link GwyMissingFieldException}. Units
 * are stored as nested {@code GwySIUnit} objects carrying a {@code unitstr}.</p>
 */
final class GwyFields
{
    static final String SI_UNIT = "GwySIUnit";
    static final String UNIT_STRING = "unitstr";

    private GwyFields() {}

    static <T> T read(GwyObject object, MetaKey<T> key) {
        return lookup(object, key).orElse(key.defaultValue());
    }

    static <T> Optional<T> lookup(GwyObject object, MetaKey<T> key) {
        Class<T> type = key.type();
        Optional<?> value;
        if (type == Boolean.class) {
            value = object.getBool(key.name());
        } else if (type == Integer.class) {
            value = object.getInt32(key.name());
        } else if (type == Double.class) {
            value = object.getDouble(key.name());
        } else if (type == String.class) {
            value = object.getString(key.name());
        } else {
            throw new IllegalArgumentException("Unsupported field type " + type.getName());
        }
        return value.map(type::cast);
    }

    static <T> void write(GwyObject object, MetaKey<T> key, T value) {
        add(object, item(key.name(), value));
    }

    static GwyItem item(String name, Object value) {
        if (value instanceof Boolean b) {
            return GwyItem.newBool(name, b);
        }
        if (value instanceof Integer i) {
            return GwyItem.newInt32(name, i);
        }
        if (value instanceof Double d) {
            return GwyItem.newDouble(name, d);
        }
        if (value instanceof String s) {
            return GwyItem.newString(name, s);
        }
        throw new IllegalArgumentException(
                "Unsupported field value " + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Adds {@code item} to {@code object}, failing if the name is already taken.
     *
     * @throws GwyTreeException if an item of the same name exists
     */
    static void add(GwyObject object, GwyItem item) {
        if (!object.add(item)) {
            throw new GwyTreeException(item.name(), "Item already present in " + object.name());
        }
    }

    static int requireInt32(GwyObject object, String item) {
        return object.getInt32(item).orElseThrow(() -> missing(object, item));
    }

    static double[] requireDoubleArray(GwyObject object, String item) {
        return object.getDoubleArray(item).orElseThrow(() -> missing(object, item));
    }

    static GwyMissingFieldException missing(GwyObject object, String item) {
        return new GwyMissingFieldException(item, object.name() + " is missing required field '" + item + "'");
    }

    /**
     * Checks that {@code object} has the expected type name.
     *
     * @throws GwyDecodeException otherwise
     */
    static void expectObject(GwyObject object, String expectedName) {
        if (!expectedName.equals(object.name())) {
            throw new GwyDecodeException("Expected " + expectedName + " but found " + object.name());
        }
    }

    /**
     * Reads the unit string of a nested {@code GwySIUnit}; a missing unit object
     * or unit string reads as the key's default.
     */
    static String readUnit(GwyObject object, MetaKey<String> key) {
        Optional<GwyObject> unit = object.getObject(key.name());
        if (unit.isEmpty()) {
            return key.defaultValue();
        }
        expectObject(unit.get(), SI_UNIT);
        return unit.get().getString(UNIT_STRING).orElse(key.defaultValue());
    }

    static void writeUnit(GwyObject object, MetaKey<String> key, String unitString) {
        GwyObject unit = GwyObjects.newObject(SI_UNIT);
        add(unit, GwyItem.newString(UNIT_STRING, unitString));
        add(object, GwyItem.newObject(key.name(), unit));
    }
}
