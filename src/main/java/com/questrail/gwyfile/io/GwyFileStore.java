package com.questrail.gwyfile.io;

import com.questrail.gwyfile.tree.GwyObject;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Port onto the binary GWY file format.
 *
 * <p>Implementations parse and serialize whole files; they know nothing about
 * channels or graphs. {@link GwyFiles} combines a store with the container
 * codec.</p>
 */
public interface GwyFileStore
{
    /**
     * Reads the top-level object of a GWY file. The caller owns and closes it.
     */
    GwyObject readFile(Path file) throws IOException;

    /**
     * Writes {@code tree} as a GWY file, replacing any existing file.
     */
    void writeFile(GwyObject tree, Path file) throws IOException;
}
