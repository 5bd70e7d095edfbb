package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.config.GwyCodecConfig;
import com.questrail.gwyfile.config.GwyDecodeErrorPolicy;
import com.questrail.gwyfile.model.GwyChannel;
import com.questrail.gwyfile.model.GwyContainer;
import com.questrail.gwyfile.model.GwyGraphModel;
import com.questrail.gwyfile.observability.GwyCodecObservabilitySink;
import com.questrail.gwyfile.observability.GwyContainerEvent;
import com.questrail.gwyfile.observability.GwyEntitySkippedEvent;
import com.questrail.gwyfile.observability.GwyErrorEvent;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;
import com.questrail.gwyfile.tree.GwyTreeException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ContainerCodec
 * =============================================================================
 * Converts between a whole {@link GwyContainer} and a {@code GwyContainer}
 * item tree.
 *
 * <h2>Decoding</h2>
 * <ul>
 *   <li>The top-level object must be a {@code GwyContainer}; anything else
 *       aborts the decode.</li>
 *   <li>Channels and graphs are enumerated with {@link GwyObjects} and decoded
 *       in the order the tree reports them. Ids need not be contiguous; they
 *       are not kept in the model.</li>
 *   <li>{@code /filename}, when present, is reduced to its base name.</li>
 * </ul>
 *
 * <h2>Error policy</h2>
 * A channel or graph that fails to decode is handled according to
 * {@link GwyCodecConfig#decodeErrorPolicy()}: under
 * {@link GwyDecodeErrorPolicy#SKIP_ENTITY} it is left out and reported through
 * {@link GwyCodecObservabilitySink#onEntitySkipped}; under
 * {@link GwyDecodeErrorPolicy#FAIL_FAST} its exception ends the decode.
 *
 * <h2>Encoding</h2>
 * A fresh container is built. Channels get ids {@code 0..N-1} and graphs ids
 * {@code 1..M}, in list order. Every graph object placed in the tree is
 * registered with the {@link GwyObjectRetention} table for the lifetime of
 * the returned tree. A graph whose key cannot be added is skipped and
 * reported; it is not retained.
 *
 * <p>The returned tree is owned by the caller, who must close it.</p>
 */
public final class ContainerCodec
{
    private final ChannelCodec channelCodec;
    private final GraphModelCodec graphCodec;
    private final GwyObjectRetention retention;
    private final GwyDecodeErrorPolicy errorPolicy;
    private final GwyCodecObservabilitySink sink;

    public ContainerCodec() {
        this(GwyCodecConfig.defaults());
    }

    public ContainerCodec(GwyCodecConfig config) {
        this(new ChannelCodec(), new GraphModelCodec(), new GwyObjectRetention(), config);
    }

    public ContainerCodec(ChannelCodec channelCodec,
                          GraphModelCodec graphCodec,
                          GwyObjectRetention retention,
                          GwyCodecConfig config) {
        this.channelCodec = Objects.requireNonNull(channelCodec, "channelCodec");
        this.graphCodec = Objects.requireNonNull(graphCodec, "graphCodec");
        this.retention = Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(config, "config");
        this.errorPolicy = config.decodeErrorPolicy();
        this.sink = config.observabilitySink();
    }

    public GwyObjectRetention retention() {
        return retention;
    }

    /**
     * @throws GwyDecodeException if {@code tree} is not a container, or an
     *         entity fails to decode under {@link GwyDecodeErrorPolicy#FAIL_FAST}
     */
    public GwyContainer decode(GwyObject tree) {
        Objects.requireNonNull(tree, "tree");
        List<Integer> channelIds;
        List<Integer> graphIds;
        String filename;
        try {
            GwyFields.expectObject(tree, GwyObjects.CONTAINER);
            channelIds = GwyObjects.enumerateChannelIds(tree);
            graphIds = GwyObjects.enumerateGraphIds(tree);
            filename = tree.getString(GwyPathKeys.FILENAME).map(ContainerCodec::baseName).orElse(null);
        } catch (GwyDecodeException | GwyTreeException e) {
            sink.onError(new GwyErrorEvent(Instant.now(), "Failed to decode container", e));
            throw e instanceof GwyDecodeException decode
                    ? decode
                    : new GwyDecodeException("Failed to decode container", e);
        }

        int skipped = 0;
        List<GwyChannel> channels = new ArrayList<>(channelIds.size());
        for (int id : channelIds) {
            try {
                channels.add(channelCodec.decode(tree, id));
            } catch (GwyDecodeException | GwyTreeException e) {
                onEntityFailure(GwyEntitySkippedEvent.Entity.CHANNEL, id, e);
                skipped++;
            }
        }

        List<GwyGraphModel> graphs = new ArrayList<>(graphIds.size());
        for (int id : graphIds) {
            try {
                graphs.add(graphCodec.decode(tree, id));
            } catch (GwyDecodeException | GwyTreeException e) {
                onEntityFailure(GwyEntitySkippedEvent.Entity.GRAPH, id, e);
                skipped++;
            }
        }

        sink.onContainerDecoded(new GwyContainerEvent(
                Instant.now(), filename, channels.size(), graphs.size(), skipped));
        return new GwyContainer(filename, channels, graphs);
    }

    /**
     * Encodes {@code container} into a fresh tree. {@code /filename} is written
     * as the container's own file name, if it has one.
     */
    public GwyObject encode(GwyContainer container) {
        Objects.requireNonNull(container, "container");
        return encode(container, container.filename().orElse(null));
    }

    /**
     * Encodes {@code container} for saving at {@code target}; {@code /filename}
     * is written as the absolute path of the target.
     */
    public GwyObject encode(GwyContainer container, Path target) {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(target, "target");
        return encode(container, target.toAbsolutePath().toString());
    }

    private GwyObject encode(GwyContainer container, String filename) {
        GwyObject tree = GwyObjects.newContainer();
        try {
            if (filename != null) {
                GwyFields.add(tree, GwyItem.newString(GwyPathKeys.FILENAME, filename));
            }

            List<GwyChannel> channels = container.channels();
            for (int id = 0; id < channels.size(); id++) {
                channelCodec.encode(channels.get(id), tree, id);
            }

            int skipped = 0;
            List<GwyGraphModel> graphs = container.graphs();
            for (int i = 0; i < graphs.size(); i++) {
                int id = i + 1;
                if (!addGraph(tree, graphs.get(i), id)) {
                    skipped++;
                }
            }

            sink.onContainerEncoded(new GwyContainerEvent(Instant.now(), filename,
                    channels.size(), graphs.size() - skipped, skipped));
            return tree;
        } catch (RuntimeException e) {
            tree.close();
            sink.onError(new GwyErrorEvent(Instant.now(), "Failed to encode container", e));
            throw e;
        }
    }

    private boolean addGraph(GwyObject tree, GwyGraphModel graph, int id) {
        GwyObject graphObject = graphCodec.encode(graph);
        if (!tree.add(GwyItem.newObject(GwyPathKeys.graph(id), graphObject))) {
            sink.onEntitySkipped(new GwyEntitySkippedEvent(Instant.now(),
                    GwyEntitySkippedEvent.Entity.GRAPH, id,
                    "Key " + GwyPathKeys.graph(id) + " is already taken", null));
            return false;
        }
        retention.retain(tree, graphObject);
        GwyFields.add(tree, GwyItem.newBool(GwyPathKeys.graphVisible(id), graph.visible()));
        return true;
    }

    private void onEntityFailure(GwyEntitySkippedEvent.Entity entity, int id, RuntimeException e) {
        if (errorPolicy == GwyDecodeErrorPolicy.FAIL_FAST) {
            sink.onError(new GwyErrorEvent(Instant.now(),
                    "Failed to decode " + entity + " " + id, e));
            throw e instanceof GwyDecodeException decode
                    ? decode
                    : new GwyDecodeException("Failed to decode " + entity + " " + id, e);
        }
        sink.onEntitySkipped(new GwyEntitySkippedEvent(Instant.now(), entity, id, e.getMessage(), e));
    }

    static String baseName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return path.substring(slash + 1);
    }
}
