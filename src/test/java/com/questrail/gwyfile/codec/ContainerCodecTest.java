package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.config.GwyCodecConfig;
import com.questrail.gwyfile.config.GwyDecodeErrorPolicy;
import com.questrail.gwyfile.model.GwyChannel;
import com.questrail.gwyfile.model.GwyContainer;
import com.questrail.gwyfile.model.GwyDataField;
import com.questrail.gwyfile.model.GwyGraphCurve;
import com.questrail.gwyfile.model.GwyGraphModel;
import com.questrail.gwyfile.observability.GwyContainerEvent;
import com.questrail.gwyfile.observability.GwyEntitySkippedEvent;
import com.questrail.gwyfile.observability.GwyErrorEvent;
import com.questrail.gwyfile.observability.RecordingObservabilitySink;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ContainerCodec}.
 */
final class ContainerCodecTest
{
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private final ContainerCodec codec = new ContainerCodec(GwyCodecConfig.builder()
            .withObservabilitySink(sink)
            .build());

    private static GwyChannel channel(String title)
    {
        return GwyChannel.builder(title, GwyDataField.zeros(4, 4)).build();
    }

    private static GwyGraphModel graph(String title, boolean visible)
    {
        return GwyGraphModel.builder()
                .curve(GwyGraphCurve.builder(new double[] { 0, 1 }, new double[] { 1, 0 }).build())
                .title(title)
                .visible(visible)
                .build();
    }

    @Test
    void encodeNumbersChannelsFromZeroAndGraphsFromOne()
    {
        GwyContainer container = new GwyContainer(
                List.of(channel("Height"), channel("Phase"), channel("Amplitude")),
                List.of(graph("Profile A", true), graph("Profile B", false)));

        try (GwyObject tree = codec.encode(container)) {
            assertEquals("GwyContainer", tree.name());
            assertEquals(List.of(0, 1, 2), GwyObjects.enumerateChannelIds(tree));
            assertEquals(List.of(1, 2), GwyObjects.enumerateGraphIds(tree));
            assertEquals("Phase", tree.getString("/1/data/title").orElseThrow());
            assertTrue(tree.getBool("/0/graph/graph/1/visible").orElseThrow());
            assertFalse(tree.getBool("/0/graph/graph/2/visible").orElseThrow());
            assertTrue(tree.getString("/filename").isEmpty());
        }
    }

    @Test
    void encodedGraphsAreRetainedUntilTreeCloses()
    {
        GwyContainer container = new GwyContainer(List.of(), List.of(graph("A", true), graph("B", true)));

        GwyObject tree = codec.encode(container);
        List<GwyObject> retained = codec.retention().retained(tree);

        assertEquals(2, retained.size());
        assertSame(tree.getObject("/0/graph/graph/1").orElseThrow(), retained.get(0));
        assertSame(tree.getObject("/0/graph/graph/2").orElseThrow(), retained.get(1));

        tree.close();

        assertTrue(codec.retention().retained(tree).isEmpty());
        assertEquals(0, codec.retention().ownerCount());
    }

    @Test
    void encodeForTargetWritesAbsolutePath()
    {
        Path target = Path.of("scans", "sample.gwy");

        try (GwyObject tree = codec.encode(GwyContainer.empty(), target)) {
            assertEquals(target.toAbsolutePath().toString(), tree.getString("/filename").orElseThrow());
        }
    }

    @Test
    void decodeKeepsOnlyBaseName()
    {
        GwyObject tree = GwyObjects.newContainer();
        tree.add(GwyItem.newString("/filename", "/home/user/scans/sample.gwy"));

        GwyContainer container = codec.decode(tree);

        assertEquals("sample.gwy", container.filename().orElseThrow());
        assertTrue(container.channels().isEmpty());
        assertTrue(container.graphs().isEmpty());
    }

    @Test
    void decodeFollowsEnumerationOrderOfSparseIds()
    {
        ChannelCodec channels = new ChannelCodec();
        GraphModelCodec graphs = new GraphModelCodec();
        GwyObject tree = GwyObjects.newContainer();
        channels.encode(channel("Seven"), tree, 7);
        channels.encode(channel("Two"), tree, 2);
        tree.add(GwyItem.newObject(GwyPathKeys.graph(5), graphs.encode(graph("Five", false))));
        tree.add(GwyItem.newObject(GwyPathKeys.graph(3), graphs.encode(graph("Three", false))));

        GwyContainer container = codec.decode(tree);

        assertEquals(List.of("Seven", "Two"),
                container.channels().stream().map(GwyChannel::title).toList());
        assertEquals(List.of("Five", "Three"),
                container.graphs().stream().map(GwyGraphModel::title).toList());
    }

    @Test
    void brokenChannelIsSkippedAndReported()
    {
        GwyObject tree = GwyObjects.newContainer();
        new ChannelCodec().encode(channel("Height"), tree, 0);
        tree.add(GwyItem.newObject("/1/data", new DataFieldCodec().encode(GwyDataField.zeros(2, 2))));

        GwyContainer container = codec.decode(tree);

        assertEquals(1, container.channels().size());
        List<GwyEntitySkippedEvent> skipped = sink.getSkippedEntities();
        assertEquals(1, skipped.size());
        assertEquals(GwyEntitySkippedEvent.Entity.CHANNEL, skipped.get(0).entity());
        assertEquals(1, skipped.get(0).id());
        assertInstanceOf(GwyMissingFieldException.class, skipped.get(0).cause());

        GwyContainerEvent summary = (GwyContainerEvent) sink.getAllEvents().get(1);
        assertEquals(1, summary.channels());
        assertEquals(1, summary.skipped());
    }

    @Test
    void failFastAbortsOnFirstBrokenEntity()
    {
        ContainerCodec strict = new ContainerCodec(GwyCodecConfig.builder()
                .withDecodeErrorPolicy(GwyDecodeErrorPolicy.FAIL_FAST)
                .withObservabilitySink(sink)
                .build());
        GwyObject tree = GwyObjects.newContainer();
        GwyObject graph = GwyObjects.newObject(GwyObjects.GRAPH_MODEL);
        graph.add(GwyItem.newObjectArray("curves", List.of(GwyObjects.newObject("GwyGraphCurveModel"))));
        tree.add(GwyItem.newObject(GwyPathKeys.graph(1), graph));

        assertThrows(GwyDecodeException.class, () -> strict.decode(tree));
        assertTrue(sink.hasEventOfType(GwyErrorEvent.class));
        assertFalse(sink.hasEventOfType(GwyContainerEvent.class));
    }

    @Test
    void topLevelMustBeContainer()
    {
        GwyObject notAContainer = GwyObjects.newObject(GwyObjects.DATA_FIELD);

        assertThrows(GwyDecodeException.class, () -> codec.decode(notAContainer));
        assertTrue(sink.hasEventOfType(GwyErrorEvent.class));
    }

    @Test
    void decodedContainerReportsSummary()
    {
        GwyContainer original = new GwyContainer("scan.gwy",
                List.of(channel("Height")), List.of(graph("Profile", true)));

        try (GwyObject tree = codec.encode(original)) {
            assertEquals(original, codec.decode(tree));
        }

        List<Object> events = sink.getAllEvents();
        assertEquals(2, events.size());
        GwyContainerEvent decoded = (GwyContainerEvent) events.get(1);
        assertEquals("scan.gwy", decoded.filename());
        assertEquals(1, decoded.channels());
        assertEquals(1, decoded.graphs());
        assertEquals(0, decoded.skipped());
    }

    @Test
    void baseNameHandlesBothSeparators()
    {
        assertEquals("a.gwy", ContainerCodec.baseName("C:\\data\\a.gwy"));
        assertEquals("a.gwy", ContainerCodec.baseName("a.gwy"));
        assertEquals("", ContainerCodec.baseName("/data/"));
    }
}
