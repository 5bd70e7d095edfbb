package com.questrail.gwyfile.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The root of the object model: everything stored in one GWY file.
 *
 * <p>Channel ids are list positions (0-based); graph ids are list positions
 * plus one, following the container's own numbering. Ids a tree was read
 * with are not preserved: encoding always renumbers contiguously.</p>
 *
 * <p>The file name is the base name of the file this container was read from,
 * if known. It is informational and used as the default target when writing.</p>
 */
public final class GwyContainer
{
    private final String filename;
    private final List<GwyChannel> channels;
    private final List<GwyGraphModel> graphs;

    public GwyContainer(String filename, List<GwyChannel> channels, List<GwyGraphModel> graphs) {
        this.filename = filename;
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
        this.graphs = List.copyOf(Objects.requireNonNull(graphs, "graphs"));
    }

    public GwyContainer(List<GwyChannel> channels, List<GwyGraphModel> graphs) {
        this(null, channels, graphs);
    }

    public static GwyContainer empty() {
        return new GwyContainer(List.of(), List.of());
    }

    public Optional<String> filename() {
        return Optional.ofNullable(filename);
    }

    public List<GwyChannel> channels() {
        return channels;
    }

    public List<GwyGraphModel> graphs() {
        return graphs;
    }

    public GwyContainer withFilename(String filename) {
        return new GwyContainer(filename, channels, graphs);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GwyContainer that)) return false;
        return Objects.equals(filename, that.filename)
                && channels.equals(that.channels)
                && graphs.equals(that.graphs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, channels, graphs);
    }

    @Override
    public String toString() {
        return "GwyContainer[" + (filename == null ? "<unnamed>" : filename)
                + ", channels=" + channels.size() + ", graphs=" + graphs.size() + "]";
    }
}
