package com.questrail.gwyfile.io;

import com.questrail.gwyfile.tree.GwyObject;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory GwyFileStore for tests.
 */
public final class FakeGwyFileStore implements GwyFileStore
{
    private final Map<Path, GwyObject> readable = new HashMap<>();
    private final List<Path> reads = new ArrayList<>();
    private final List<Write> writes = new ArrayList<>();
    private IOException failure;

    /**
     * One call to {@link #writeFile}; {@code closedDuringWrite} records whether the tree was already closed.
     */
    public record Write(Path file, String filename, boolean closedDuringWrite, GwyObject tree) {
    }

    @Override
    public GwyObject readFile(Path file) throws IOException {
        reads.add(file);
        if (failure != null) {
            throw failure;
        }
        GwyObject tree = readable.get(file.normalize());
        if (tree == null) {
            throw new IOException("Not a GWY file: " + file);
        }
        return tree;
    }

    @Override
    public void writeFile(GwyObject tree, Path file) throws IOException {
        if (failure != null) {
            throw failure;
        }
        writes.add(new Write(file, tree.getString("/filename").orElse(null), tree.isClosed(), tree));
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void willRead(Path file, GwyObject tree) {
        readable.put(file.normalize(), tree);
    }

    public void failWith(IOException failure) {
        this.failure = failure;
    }

    public List<Path> reads() {
        return List.copyOf(reads);
    }

    public List<Write> writes() {
        return List.copyOf(writes);
    }
}
