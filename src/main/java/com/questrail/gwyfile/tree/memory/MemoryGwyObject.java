package com.questrail.gwyfile.tree.memory;

import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyItemType;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyTreeException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * MemoryGwyObject
 * -----------------------------------------------------------------------------
 * Heap-backed implementation of the {@link GwyObject} port.
 *
 * <p>Items are kept in insertion order, which is the order a GWY writer would
 * serialize them in. The object is add-only: an item, once present, is never
 * replaced.</p>
 *
 * <p>Instances are not thread-safe. A single tree is expected to be built or
 * read by one thread at a time.</p>
 */
public final class MemoryGwyObject implements GwyObject
{
    private final String name;
    private final Map<String, GwyItem> items = new LinkedHashMap<>();
    private final List<Runnable> closeHooks = new ArrayList<>();
    private boolean closed;

    public MemoryGwyObject(String name) {
        this.name = Objects.requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Object name must not be empty");
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<Boolean> getBool(String item) {
        return lookup(item, GwyItem::asBool);
    }

    @Override
    public Optional<Integer> getInt32(String item) {
        return lookup(item, GwyItem::asInt32);
    }

    @Override
    public Optional<Double> getDouble(String item) {
        return lookup(item, GwyItem::asDouble);
    }

    @Override
    public Optional<String> getString(String item) {
        return lookup(item, GwyItem::asString);
    }

    @Override
    public Optional<GwyObject> getObject(String item) {
        return lookup(item, GwyItem::asObject);
    }

    @Override
    public Optional<double[]> getDoubleArray(String item) {
        return lookup(item, GwyItem::asDoubleArray);
    }

    @Override
    public Optional<List<GwyObject>> getObjectArray(String item) {
        return lookup(item, GwyItem::asObjectArray);
    }

    @Override
    public List<String> itemNames() {
        ensureOpen(name);
        return List.copyOf(items.keySet());
    }

    @Override
    public Optional<GwyItemType> itemType(String item) {
        return lookup(item, GwyItem::type);
    }

    @Override
    public boolean add(GwyItem item) {
        Objects.requireNonNull(item, "item");
        ensureOpen(item.name());
        if (item.type() == GwyItemType.OBJECT && item.asObject() == this) {
            throw new GwyTreeException(item.name(), "Object cannot contain itself");
        }
        return items.putIfAbsent(item.name(), item) == null;
    }

    @Override
    public void onClose(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        if (closed) {
            hook.run();
        } else {
            closeHooks.add(hook);
        }
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<Runnable> hooks = new ArrayList<>(closeHooks);
        closeHooks.clear();
        hooks.forEach(Runnable::run);
    }

    private <T> Optional<T> lookup(String item, Function<GwyItem, T> accessor) {
        Objects.requireNonNull(item, "item");
        ensureOpen(item);
        GwyItem found = items.get(item);
        return found == null ? Optional.empty() : Optional.of(accessor.apply(found));
    }

    private void ensureOpen(String path) {
        if (closed) {
            throw new GwyTreeException(path, "Object " + name + " is closed");
        }
    }

    @Override
    public String toString() {
        return "MemoryGwyObject[" + name + ", items=" + items.size() + "]";
    }
}
