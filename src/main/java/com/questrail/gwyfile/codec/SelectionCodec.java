package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.GwyPairSelection;
import com.questrail.gwyfile.model.GwyPoint;
import com.questrail.gwyfile.model.GwyPointPair;
import com.questrail.gwyfile.model.GwyPointSelection;
import com.questrail.gwyfile.model.GwySelection;
import com.questrail.gwyfile.model.GwySelectionKind;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SelectionCodec
 * -----------------------------------------------------------------------------
 * Converts between {@link GwySelection} values and selection tree objects.
 *
 * <h2>Layout</h2>
 * A selection object stores its coordinates in a single flat {@code data}
 * array {@code [x0, y0, x1, y1, ...]}. Point and pointer selections hold one
 * point per instance; line, rectangle and ellipse selections hold two, so
 * instance {@code k} is the pair {@code (p[2k], p[2k+1])}.
 *
 * <p>The instance count is derived from the buffer length. A buffer that does
 * not split into whole instances is a decode error, never truncated.</p>
 *
 * <h2>Empty selections</h2>
 * A selection object with no instances (or no buffer) decodes to
 * {@link Optional#empty()}: the model never holds an empty selection, and the
 * encoder never writes one.
 */
public final class SelectionCodec
{
    static final String DATA = "data";

    /**
     * @return the decoded selection, or empty if the object has no instances
     * @throws GwyDecodeException if the object type does not match {@code kind}
     *         or the buffer does not hold whole instances
     */
    public Optional<GwySelection> decode(GwyObject object, GwySelectionKind kind) {
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(kind, "kind");
        GwyFields.expectObject(object, kind.objectName());

        double[] buffer = object.getDoubleArray(DATA).orElse(new double[0]);
        if (count(buffer, kind) == 0) {
            return Optional.empty();
        }

        List<GwyPoint> points = toPoints(buffer);
        if (kind.isPaired()) {
            return Optional.of(new GwyPairSelection(kind, toPairs(points)));
        }
        return Optional.of(new GwyPointSelection(kind, points));
    }

    /**
     * Number of selection instances stored in {@code object}; zero when the
     * buffer is absent.
     */
    public int count(GwyObject object, GwySelectionKind kind) {
        Objects.requireNonNull(object, "object");
        return count(object.getDoubleArray(DATA).orElse(new double[0]), kind);
    }

    public GwyObject encode(GwySelection selection) {
        Objects.requireNonNull(selection, "selection");
        GwyObject object = GwyObjects.newObject(selection.kind().objectName());
        GwyFields.add(object, GwyItem.newDoubleArray(DATA, flatten(selection.points())));
        return object;
    }

    static int count(double[] buffer, GwySelectionKind kind) {
        int coordinatesPerInstance = 2 * kind.pointsPerInstance();
        if (buffer.length % coordinatesPerInstance != 0) {
            throw new GwyDecodeException(kind.keySuffix() + " selection buffer holds "
                    + buffer.length + " coordinates, not a multiple of " + coordinatesPerInstance);
        }
        return buffer.length / coordinatesPerInstance;
    }

    static List<GwyPoint> toPoints(double[] buffer) {
        List<GwyPoint> points = new ArrayList<>(buffer.length / 2);
        for (int i = 0; i + 1 < buffer.length; i += 2) {
            points.add(new GwyPoint(buffer[i], buffer[i + 1]));
        }
        return points;
    }

    static List<GwyPointPair> toPairs(List<GwyPoint> points) {
        List<GwyPointPair> pairs = new ArrayList<>(points.size() / 2);
        for (int k = 0; 2 * k + 1 < points.size(); k++) {
            pairs.add(new GwyPointPair(points.get(2 * k), points.get(2 * k + 1)));
        }
        return pairs;
    }

    static double[] flatten(List<GwyPoint> points) {
        double[] buffer = new double[points.size() * 2];
        for (int i = 0; i < points.size(); i++) {
            buffer[2 * i] = points.get(i).x();
            buffer[2 * i + 1] = points.get(i).y();
        }
        return buffer;
    }
}
