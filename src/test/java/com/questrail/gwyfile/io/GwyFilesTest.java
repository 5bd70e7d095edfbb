package com.questrail.gwyfile.io;

import com.questrail.gwyfile.codec.ContainerCodec;
import com.questrail.gwyfile.model.GwyChannel;
import com.questrail.gwyfile.model.GwyContainer;
import com.questrail.gwyfile.model.GwyDataField;
import com.questrail.gwyfile.model.GwyGraphModel;
import com.questrail.gwyfile.tree.GwyObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class GwyFilesTest
{
    @TempDir
    Path dir;

    private final FakeGwyFileStore store = new FakeGwyFileStore();
    private final ContainerCodec codec = new ContainerCodec();
    private final GwyFiles files = new GwyFiles(store, codec);

    private static GwyContainer sample(String filename)
    {
        return new GwyContainer(filename,
                List.of(GwyChannel.builder("Height", GwyDataField.zeros(3, 3)).build()),
                List.of(GwyGraphModel.builder().title("Profile").build()));
    }

    @Test
    void readMissingFileFails()
    {
        assertThrows(NoSuchFileException.class, () -> files.read(dir.resolve("absent.gwy")));
    }

    @Test
    void readDecodesStoredTreeAndClosesIt() throws IOException
    {
        Path file = Files.createFile(dir.resolve("scan.gwy"));
        GwyObject tree = codec.encode(sample(null), file);
        store.willRead(file, tree);

        GwyContainer container = files.read(file);

        assertEquals("scan.gwy", container.filename().orElseThrow());
        assertEquals("Height", container.channels().get(0).title());
        assertEquals("Profile", container.graphs().get(0).title());
        assertTrue(tree.isClosed());
        assertEquals(0, codec.retention().ownerCount());
    }

    @Test
    void readHandsStoreAnAbsolutePath() throws IOException
    {
        Path file = Files.createFile(dir.resolve("relative.gwy"));
        Path relative = Path.of("").toAbsolutePath().relativize(file);
        store.willRead(file, codec.encode(sample(null), file));

        GwyContainer container = files.read(relative);

        assertFalse(relative.isAbsolute());
        assertTrue(store.reads().get(0).isAbsolute());
        assertEquals("relative.gwy", container.filename().orElseThrow());
    }

    @Test
    void writeRecordsAbsoluteTargetAndClosesTree() throws IOException
    {
        Path target = dir.resolve("out.gwy");

        files.write(sample(null), target);

        FakeGwyFileStore.Write write = store.writes().get(0);
        assertEquals(target.toAbsolutePath(), write.file());
        assertEquals(target.toAbsolutePath().toString(), write.filename());
        assertFalse(write.closedDuringWrite());
        assertTrue(write.tree().isClosed());
        assertEquals(0, codec.retention().ownerCount());
    }

    @Test
    void writeWithoutTargetUsesContainerFilename() throws IOException
    {
        files.write(sample("named.gwy"));

        FakeGwyFileStore.Write write = store.writes().get(0);
        assertEquals(Path.of("named.gwy").toAbsolutePath(), write.file());
    }

    @Test
    void writeWithoutAnyFilenameFails()
    {
        assertThrows(IllegalArgumentException.class, () -> files.write(sample(null)));
        assertTrue(store.writes().isEmpty());
    }

    @Test
    void storeFailureStillClosesTree()
    {
        store.failWith(new IOException("disk full"));

        IOException e = assertThrows(IOException.class, () -> files.write(sample(null), dir.resolve("x.gwy")));
        assertEquals("disk full", e.getMessage());
        assertEquals(0, codec.retention().ownerCount());
    }
}
