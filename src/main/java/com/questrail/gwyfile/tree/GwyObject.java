package com.questrail.gwyfile.tree;

import java.util.List;
import java.util.Optional;

/**
 * GwyObject
 * =============================================================================
 * Port onto the item-tree store: one named object holding typed items.
 *
 * <h2>Architectural Role</h2>
 * The top-level {@code GwyContainer} of a GWY file and every object nested in
 * it (data fields, selections, graph models, curves, SI units) are exposed to
 * the codecs through this interface only. The codecs never see how the store
 * lays items out in memory or on disk.
 *
 * <h2>Read semantics</h2>
 * Every getter returns {@link Optional#empty()} when no item of that name
 * exists. An item that exists with a different kind is a
 * {@link GwyTreeException}, never an empty result.
 *
 * <h2>Ownership</h2>
 * An object item holds a <em>non-owning</em> reference to the nested object as
 * far as the object model is concerned. Whoever creates nested objects for a
 * tree is responsible for keeping them reachable until the tree is closed;
 * {@link #onClose(Runnable)} is the hook for releasing them.
 *
 * <p>Implementations may be in-memory (see
 * {@code com.questrail.gwyfile.tree.memory}) or backed by a native store.</p>
 */
public interface GwyObject extends AutoCloseable
{
    /**
     * @return the object's type name, e.g. {@code GwyContainer} or {@code GwyDataField}
     */
    String name();

    Optional<Boolean> getBool(String item);

    Optional<Integer> getInt32(String item);

    Optional<Double> getDouble(String item);

    Optional<String> getString(String item);

    Optional<GwyObject> getObject(String item);

    Optional<double[]> getDoubleArray(String item);

    Optional<List<GwyObject>> getObjectArray(String item);

    /**
     * Returns the names of all items in insertion order.
     */
    List<String> itemNames();

    /**
     * Returns the kind of the named item, or empty if there is no such item.
     */
    Optional<GwyItemType> itemType(String item);

    /**
     * Adds a detached item to this object.
     *
     * @param item item to add
     * @return {@code true} if the item was added; {@code false} if an item of
     *         the same name already exists (the existing item is kept)
     * @throws GwyTreeException if the object has been closed
     */
    boolean add(GwyItem item);

    /**
     * Registers a hook that runs exactly once when this object is closed.
     * Hooks registered after close run immediately.
     */
    void onClose(Runnable hook);

    /**
     * @return whether {@link #close()} has been called
     */
    boolean isClosed();

    /**
     * Releases this object. Subsequent reads and writes fail with
     * {@link GwyTreeException}. Closing twice is a no-op.
     */
    @Override
    void close();
}
