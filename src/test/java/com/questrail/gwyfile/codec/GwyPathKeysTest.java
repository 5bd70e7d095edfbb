package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.GwySelectionKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class GwyPathKeysTest
{
    @Test
    void channelKeys()
    {
        assertEquals("/3/data", GwyPathKeys.channelData(3));
        assertEquals("/3/data/title", GwyPathKeys.channelTitle(3));
        assertEquals("/3/data/visible", GwyPathKeys.channelVisible(3));
        assertEquals("/3/base/palette", GwyPathKeys.palette(3));
        assertEquals("/3/base/range-type", GwyPathKeys.rangeType(3));
        assertEquals("/3/base/min", GwyPathKeys.rangeMin(3));
        assertEquals("/3/base/max", GwyPathKeys.rangeMax(3));
        assertEquals("/3/show", GwyPathKeys.presentation(3));
    }

    @Test
    void maskKeys()
    {
        assertEquals("/0/mask", GwyPathKeys.mask(0));
        assertEquals("/0/mask/red", GwyPathKeys.maskRed(0));
        assertEquals("/0/mask/green", GwyPathKeys.maskGreen(0));
        assertEquals("/0/mask/blue", GwyPathKeys.maskBlue(0));
        assertEquals("/0/mask/alpha", GwyPathKeys.maskAlpha(0));
    }

    @Test
    void selectionKeys()
    {
        assertEquals("/1/select/point", GwyPathKeys.selection(1, GwySelectionKind.POINT));
        assertEquals("/1/select/pointer", GwyPathKeys.selection(1, GwySelectionKind.POINTER));
        assertEquals("/1/select/line", GwyPathKeys.selection(1, GwySelectionKind.LINE));
        assertEquals("/1/select/rectangle", GwyPathKeys.selection(1, GwySelectionKind.RECTANGLE));
        assertEquals("/1/select/ellipse", GwyPathKeys.selection(1, GwySelectionKind.ELLIPSE));
    }

    @Test
    void graphKeysLiveUnderChannelZero()
    {
        assertEquals("/0/graph/graph/1", GwyPathKeys.graph(1));
        assertEquals("/0/graph/graph/12/visible", GwyPathKeys.graphVisible(12));
        assertEquals("/filename", GwyPathKeys.FILENAME);
    }
}
