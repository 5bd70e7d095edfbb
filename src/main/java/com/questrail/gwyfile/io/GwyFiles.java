package com.questrail.gwyfile.io;

import com.questrail.gwyfile.codec.ContainerCodec;
import com.questrail.gwyfile.model.GwyContainer;
import com.questrail.gwyfile.tree.GwyObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * GwyFiles
 * -----------------------------------------------------------------------------
 * Reads and writes {@link GwyContainer}s as files.
 *
 * <p>Reading checks the file exists, hands it to the {@link GwyFileStore} and
 * decodes the resulting tree. Writing encodes the container with its
 * {@code /filename} set to the absolute target path, then asks the store to
 * write it. In both directions the intermediate tree is closed before
 * returning, which also releases everything the codec retained for it.</p>
 */
public final class GwyFiles
{
    private final GwyFileStore store;
    private final ContainerCodec codec;

    public GwyFiles(GwyFileStore store) {
        this(store, new ContainerCodec());
    }

    public GwyFiles(GwyFileStore store, ContainerCodec codec) {
        this.store = Objects.requireNonNull(store, "store");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * @throws NoSuchFileException if {@code file} does not exist
     * @throws IOException if the store cannot read it
     */
    public GwyContainer read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString());
        }
        try (GwyObject tree = store.readFile(file.toAbsolutePath())) {
            return codec.decode(tree);
        }
    }

    public void write(GwyContainer container, Path file) throws IOException {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(file, "file");
        try (GwyObject tree = codec.encode(container, file)) {
            store.writeFile(tree, file.toAbsolutePath());
        }
    }

    /**
     * Writes {@code container} to its own file name, resolved against the
     * working directory.
     *
     * @throws IllegalArgumentException if the container has no file name
     */
    public void write(GwyContainer container) throws IOException {
        Objects.requireNonNull(container, "container");
        String filename = container.filename()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Container has no file name; pass a target path"));
        write(container, Path.of(filename));
    }
}
