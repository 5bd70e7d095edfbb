package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.GwyDataField;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyObjects;

import java.util.Objects;

/**
 * DataFieldCodec
 * -----------------------------------------------------------------------------
 * Converts between {@link GwyDataField} and a {@code GwyDataField} tree object.
 *
 * <h2>Items</h2>
 * <pre>
 *   xres, yres            int32, required
 *   xreal, yreal          double, default 1.0
 *   xoff, yoff            double, default 0.0
 *   si_unit_xy, si_unit_z GwySIUnit object, default ""
 *   data                  double[xres * yres], required, row-major
 * </pre>
 *
 * <p>Encoding always writes every item, so a decoded field never depends on a
 * default when it was produced by this codec.</p>
 */
public final class DataFieldCodec
{
    static final String XRES = "xres";
    static final String YRES = "yres";
    static final String DATA = "data";

    /**
     * @throws GwyMissingFieldException if {@code xres}, {@code yres} or {@code data} is absent
     * @throws GwyDecodeException if the object is not a data field or the sample
     *         count disagrees with the resolution
     */
    public GwyDataField decode(GwyObject object) {
        Objects.requireNonNull(object, "object");
        GwyFields.expectObject(object, GwyObjects.DATA_FIELD);

        int xres = GwyFields.requireInt32(object, XRES);
        int yres = GwyFields.requireInt32(object, YRES);
        double[] samples = GwyFields.requireDoubleArray(object, DATA);
        if (xres <= 0 || yres <= 0) {
            throw new GwyDecodeException("Data field has invalid resolution " + xres + "x" + yres);
        }
        if ((long) xres * yres != samples.length) {
            throw new GwyDecodeException("Data field holds " + samples.length
                    + " samples, expected " + xres + " x " + yres);
        }

        return GwyDataField.builder(xres, yres, samples)
                .xreal(GwyFields.read(object, GwyDataField.XREAL))
                .yreal(GwyFields.read(object, GwyDataField.YREAL))
                .xoff(GwyFields.read(object, GwyDataField.XOFF))
                .yoff(GwyFields.read(object, GwyDataField.YOFF))
                .siUnitXy(GwyFields.readUnit(object, GwyDataField.SI_UNIT_XY))
                .siUnitZ(GwyFields.readUnit(object, GwyDataField.SI_UNIT_Z))
                .build();
    }

    public GwyObject encode(GwyDataField field) {
        Objects.requireNonNull(field, "field");
        GwyObject object = GwyObjects.newObject(GwyObjects.DATA_FIELD);
        GwyFields.add(object, GwyItem.newInt32(XRES, field.xres()));
        GwyFields.add(object, GwyItem.newInt32(YRES, field.yres()));
        GwyFields.write(object, GwyDataField.XREAL, field.xreal());
        GwyFields.write(object, GwyDataField.YREAL, field.yreal());
        GwyFields.write(object, GwyDataField.XOFF, field.xoff());
        GwyFields.write(object, GwyDataField.YOFF, field.yoff());
        GwyFields.writeUnit(object, GwyDataField.SI_UNIT_XY, field.siUnitXy());
        GwyFields.writeUnit(object, GwyDataField.SI_UNIT_Z, field.siUnitZ());
        GwyFields.add(object, GwyItem.newDoubleArray(DATA, field.samples()));
        return object;
    }
}
