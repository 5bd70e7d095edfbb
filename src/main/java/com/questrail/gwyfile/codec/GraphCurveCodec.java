package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.GwyGraphCurve;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;

import java.util.Objects;

/**
 * Converts between {@link GwyGraphCurve} and a {@code GwyGraphCurveModel} tree
 * object.
 *
 * <p>The abscissa and ordinate are stored as {@code xdata} and {@code ydata};
 * both are required and must have the same length, which is the curve's
 * {@code ndata}. Styling items fall back to the defaults published on
 * {@link GwyGraphCurve} when absent.</p>
 */
public final class GraphCurveCodec
{
    public static final String OBJECT_NAME = "GwyGraphCurveModel";

    static final String XDATA = "xdata";
    static final String YDATA = "ydata";

    public GwyGraphCurve decode(GwyObject object) {
        Objects.requireNonNull(object, "object");
        GwyFields.expectObject(object, OBJECT_NAME);

        double[] xdata = GwyFields.requireDoubleArray(object, XDATA);
        double[] ydata = GwyFields.requireDoubleArray(object, YDATA);
        if (xdata.length != ydata.length) {
            throw new GwyDecodeException("Curve abscissa and ordinate differ in length: "
                    + xdata.length + " vs " + ydata.length);
        }

        return GwyGraphCurve.builder(xdata, ydata)
                .description(GwyFields.read(object, GwyGraphCurve.DESCRIPTION))
                .type(GwyFields.read(object, GwyGraphCurve.TYPE))
                .pointType(GwyFields.read(object, GwyGraphCurve.POINT_TYPE))
                .lineStyle(GwyFields.read(object, GwyGraphCurve.LINE_STYLE))
                .pointSize(GwyFields.read(object, GwyGraphCurve.POINT_SIZE))
                .lineSize(GwyFields.read(object, GwyGraphCurve.LINE_SIZE))
                .color(GwyFields.read(object, GwyGraphCurve.COLOR_RED),
                        GwyFields.read(object, GwyGraphCurve.COLOR_GREEN),
                        GwyFields.read(object, GwyGraphCurve.COLOR_BLUE))
                .build();
    }

    public GwyObject encode(GwyGraphCurve curve) {
        Objects.requireNonNull(curve, "curve");
        GwyObject object = GwyObjects.newObject(OBJECT_NAME);
        GwyFields.add(object, GwyItem.newDoubleArray(XDATA, curve.xdata()));
        GwyFields.add(object, GwyItem.newDoubleArray(YDATA, curve.ydata()));
        GwyFields.write(object, GwyGraphCurve.DESCRIPTION, curve.description());
        GwyFields.write(object, GwyGraphCurve.TYPE, curve.type());
        GwyFields.write(object, GwyGraphCurve.POINT_TYPE, curve.pointType());
        GwyFields.write(object, GwyGraphCurve.LINE_STYLE, curve.lineStyle());
        GwyFields.write(object, GwyGraphCurve.POINT_SIZE, curve.pointSize());
        GwyFields.write(object, GwyGraphCurve.LINE_SIZE, curve.lineSize());
        GwyFields.write(object, GwyGraphCurve.COLOR_RED, curve.colorRed());
        GwyFields.write(object, GwyGraphCurve.COLOR_GREEN, curve.colorGreen());
        GwyFields.write(object, GwyGraphCurve.COLOR_BLUE, curve.colorBlue());
        return object;
    }
}
