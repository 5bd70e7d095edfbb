package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.GwyAxisBound;
import com.questrail.gwyfile.model.GwyGraphCurve;
import com.questrail.gwyfile.model.GwyGraphModel;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;
import com.questrail.gwyfile.tree.GwyTreeException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * GraphModelCodec
 * -----------------------------------------------------------------------------
 * Converts between {@link GwyGraphModel} and a {@code GwyGraphModel} tree
 * object.
 *
 * <h2>Curves</h2>
 * Curves are stored in order in the {@code curves} object array and decoded
 * with {@link GraphCurveCodec}; an absent array means a graph without curves.
 *
 * <h2>Axis bounds</h2>
 * Each bound is a pair of items, the value ({@code x_min}) and its flag
 * ({@code x_min_set}). A bound is present only when its flag is true; the
 * stored value of an unset bound is ignored. Encoding writes both items for
 * every bound, using 0.0 as the value of unset ones.
 *
 * <h2>Visibility</h2>
 * Whether a graph window is shown lives in the container, next to the graph
 * object, at {@link GwyPathKeys#graphVisible(int)}. {@link #decode(GwyObject, int)}
 * reads it from there; {@link #encode(GwyGraphModel)} leaves writing it to the
 * caller that places the graph in its container.
 */
public final class GraphModelCodec
{
    static final String CURVES = "curves";

    private final GraphCurveCodec curveCodec;

    public GraphModelCodec() {
        this(new GraphCurveCodec());
    }

    public GraphModelCodec(GraphCurveCodec curveCodec) {
        this.curveCodec = Objects.requireNonNull(curveCodec, "curveCodec");
    }

    /**
     * Decodes graph {@code graphId} of {@code container}, including its
     * visibility flag.
     *
     * @throws GwyMissingFieldException if there is no graph object under that id
     * @throws GwyDecodeException if the graph or one of its curves is malformed
     */
    public GwyGraphModel decode(GwyObject container, int graphId) {
        Objects.requireNonNull(container, "container");
        String key = GwyPathKeys.graph(graphId);
        try {
            GwyObject graph = container.getObject(key)
                    .orElseThrow(() -> new GwyMissingFieldException(key, "No graph model at " + key));
            boolean visible = container.getBool(GwyPathKeys.graphVisible(graphId))
                    .orElse(GwyGraphModel.VISIBLE.defaultValue());
            return decodeObject(graph, visible);
        } catch (GwyTreeException e) {
            throw new GwyDecodeException("Failed to decode graph " + graphId, e);
        }
    }

    /**
     * Decodes a detached graph object; visibility is supplied by the caller.
     */
    public GwyGraphModel decodeObject(GwyObject graph, boolean visible) {
        Objects.requireNonNull(graph, "graph");
        GwyFields.expectObject(graph, GwyObjects.GRAPH_MODEL);

        GwyGraphModel.Builder builder = GwyGraphModel.builder()
                .curves(decodeCurves(graph))
                .title(GwyFields.read(graph, GwyGraphModel.TITLE))
                .topLabel(GwyFields.read(graph, GwyGraphModel.TOP_LABEL))
                .leftLabel(GwyFields.read(graph, GwyGraphModel.LEFT_LABEL))
                .rightLabel(GwyFields.read(graph, GwyGraphModel.RIGHT_LABEL))
                .bottomLabel(GwyFields.read(graph, GwyGraphModel.BOTTOM_LABEL))
                .xUnit(GwyFields.readUnit(graph, GwyGraphModel.X_UNIT))
                .yUnit(GwyFields.readUnit(graph, GwyGraphModel.Y_UNIT))
                .xLogarithmic(GwyFields.read(graph, GwyGraphModel.X_IS_LOGARITHMIC))
                .yLogarithmic(GwyFields.read(graph, GwyGraphModel.Y_IS_LOGARITHMIC))
                .labelVisible(GwyFields.read(graph, GwyGraphModel.LABEL_VISIBLE))
                .labelHasFrame(GwyFields.read(graph, GwyGraphModel.LABEL_HAS_FRAME))
                .labelReverse(GwyFields.read(graph, GwyGraphModel.LABEL_REVERSE))
                .labelFrameThickness(GwyFields.read(graph, GwyGraphModel.LABEL_FRAME_THICKNESS))
                .labelPosition(GwyFields.read(graph, GwyGraphModel.LABEL_POSITION))
                .gridType(GwyFields.read(graph, GwyGraphModel.GRID_TYPE))
                .visible(visible);

        for (GwyAxisBound bound : GwyAxisBound.values()) {
            readBound(graph, bound).ifPresent(value -> builder.bound(bound, value));
        }
        return builder.build();
    }

    /**
     * Encodes the graph object itself. The caller places it in a container and
     * writes its visibility flag.
     */
    public GwyObject encode(GwyGraphModel graph) {
        Objects.requireNonNull(graph, "graph");
        GwyObject object = GwyObjects.newObject(GwyObjects.GRAPH_MODEL);

        List<GwyObject> curves = new ArrayList<>(graph.ncurves());
        for (GwyGraphCurve curve : graph.curves()) {
            curves.add(curveCodec.encode(curve));
        }
        GwyFields.add(object, GwyItem.newObjectArray(CURVES, curves));

        GwyFields.write(object, GwyGraphModel.TITLE, graph.title());
        GwyFields.write(object, GwyGraphModel.TOP_LABEL, graph.topLabel());
        GwyFields.write(object, GwyGraphModel.LEFT_LABEL, graph.leftLabel());
        GwyFields.write(object, GwyGraphModel.RIGHT_LABEL, graph.rightLabel());
        GwyFields.write(object, GwyGraphModel.BOTTOM_LABEL, graph.bottomLabel());
        GwyFields.writeUnit(object, GwyGraphModel.X_UNIT, graph.xUnit());
        GwyFields.writeUnit(object, GwyGraphModel.Y_UNIT, graph.yUnit());

        for (GwyAxisBound bound : GwyAxisBound.values()) {
            Optional<Double> value = graph.bound(bound);
            GwyFields.add(object, GwyItem.newDouble(bound.valueKey(), value.orElse(0.0)));
            GwyFields.add(object, GwyItem.newBool(bound.setKey(), value.isPresent()));
        }

        GwyFields.write(object, GwyGraphModel.X_IS_LOGARITHMIC, graph.xLogarithmic());
        GwyFields.write(object, GwyGraphModel.Y_IS_LOGARITHMIC, graph.yLogarithmic());
        GwyFields.write(object, GwyGraphModel.LABEL_VISIBLE, graph.labelVisible());
        GwyFields.write(object, GwyGraphModel.LABEL_HAS_FRAME, graph.labelHasFrame());
        GwyFields.write(object, GwyGraphModel.LABEL_REVERSE, graph.labelReverse());
        GwyFields.write(object, GwyGraphModel.LABEL_FRAME_THICKNESS, graph.labelFrameThickness());
        GwyFields.write(object, GwyGraphModel.LABEL_POSITION, graph.labelPosition());
        GwyFields.write(object, GwyGraphModel.GRID_TYPE, graph.gridType());
        return object;
    }

    private List<GwyGraphCurve> decodeCurves(GwyObject graph) {
        List<GwyObject> objects = graph.getObjectArray(CURVES).orElse(List.of());
        List<GwyGraphCurve> curves = new ArrayList<>(objects.size());
        for (int i = 0; i < objects.size(); i++) {
            try {
                curves.add(curveCodec.decode(objects.get(i)));
            } catch (GwyDecodeException | GwyTreeException e) {
                throw new GwyDecodeException("Failed to decode curve " + i + ": " + e.getMessage(), e);
            }
        }
        return curves;
    }

    private static Optional<Double> readBound(GwyObject graph, GwyAxisBound bound) {
        boolean set = graph.getBool(bound.setKey()).orElse(false);
        if (!set) {
            return Optional.empty();
        }
        return Optional.of(graph.getDouble(bound.valueKey())
                .orElseThrow(() -> GwyFields.missing(graph, bound.valueKey())));
    }
}
