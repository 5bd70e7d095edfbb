package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.tree.GwyObject;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GwyObjectRetention
 * -----------------------------------------------------------------------------
 * Keeps nested objects reachable for as long as the tree that refers to them.
 *
 * <h2>Why it exists</h2>
 * Object items hold non-owning references (see {@link GwyObject}). A native
 * store may free a nested object that nothing else keeps alive, leaving the
 * container pointing at released memory. The container codec therefore
 * registers every graph object it creates here under the tree it belongs to.
 *
 * <h2>Lifetime</h2>
 * The first registration for an owner installs an {@link GwyObject#onClose}
 * hook that calls {@link #release(GwyObject)}; entries therefore disappear
 * exactly when their tree is closed. Owners are compared by identity.
 *
 * <h2>Threading</h2>
 * The table may be shared between codecs working on different trees
 * concurrently. Registration for one owner is expected from one thread at a time.
 */
public final class GwyObjectRetention
{
    private final Map<GwyObject, List<GwyObject>> retained = new IdentityHashMap<>();

    /**
     * Retains {@code nested} until {@code owner} is closed.
     *
     * @throws IllegalStateException if {@code owner} is already closed
     */
    public void retain(GwyObject owner, GwyObject nested) {
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(nested, "nested");
        if (owner.isClosed()) {
            throw new IllegalStateException("Cannot retain objects for a closed " + owner.name());
        }

        boolean firstForOwner;
        synchronized (retained) {
            List<GwyObject> objects = retained.get(owner);
            firstForOwner = objects == null;
            if (firstForOwner) {
                objects = new ArrayList<>();
                retained.put(owner, objects);
            }
            objects.add(nested);
        }
        if (firstForOwner) {
            owner.onClose(() -> release(owner));
        }
    }

    /**
     * @return the objects currently retained for {@code owner}, in registration order
     */
    public List<GwyObject> retained(GwyObject owner) {
        synchronized (retained) {
            List<GwyObject> objects = retained.get(owner);
            return objects == null ? List.of() : List.copyOf(objects);
        }
    }

    /**
     * Drops every entry held for {@code owner}. Releasing an unknown owner is a no-op.
     */
    public void release(GwyObject owner) {
        synchronized (retained) {
            retained.remove(owner);
        }
    }

    /**
     * @return number of owners that currently have retained objects
     */
    public int ownerCount() {
        synchronized (retained) {
            return retained.size();
        }
    }
}
