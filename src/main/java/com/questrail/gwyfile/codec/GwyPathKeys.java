package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.GwySelectionKind;

/**
 * GwyPathKeys
 * -----------------------------------------------------------------------------
 * Path keys of channel, graph and file items inside a {@code GwyContainer}.
 *
 * <p>These strings are the whole contract between the codecs and files written
 * by Gwyddion; they must be reproduced exactly. Channel ids are 0-based,
 * graph ids 1-based.</p>
 *
 * <pre>
 *   /{i}/data                     channel data field
 *   /{i}/data/title               channel title
 *   /{i}/data/visible             channel window shown on load
 *   /{i}/base/palette             false colour gradient name
 *   /{i}/base/range-type          colour range mapping type
 *   /{i}/base/min, /{i}/base/max  user-set colour range
 *   /{i}/mask                     mask data field
 *   /{i}/mask/{red,green,blue,alpha}
 *   /{i}/show                     presentation data field
 *   /{i}/select/{kind}            selections
 *   /0/graph/graph/{g}            graph model
 *   /0/graph/graph/{g}/visible    graph window shown on load
 *   /filename                     file the container was saved as
 * </pre>
 */
public final class GwyPathKeys
{
    public static final String FILENAME = "/filename";

    private GwyPathKeys() {}

    public static String channelData(int channelId) {
        return "/" + channelId + "/data";
    }

    public static String channelTitle(int channelId) {
        return channelData(channelId) + "/title";
    }

    public static String channelVisible(int channelId) {
        return channelData(channelId) + "/visible";
    }

    public static String palette(int channelId) {
        return "/" + channelId + "/base/palette";
    }

    public static String rangeType(int channelId) {
        return "/" + channelId + "/base/range-type";
    }

    public static String rangeMin(int channelId) {
        return "/" + channelId + "/base/min";
    }

    public static String rangeMax(int channelId) {
        return "/" + channelId + "/base/max";
    }

    public static String mask(int channelId) {
        return "/" + channelId + "/mask";
    }

    public static String maskRed(int channelId) {
        return mask(channelId) + "/red";
    }

    public static String maskGreen(int channelId) {
        return mask(channelId) + "/green";
    }

    public static String maskBlue(int channelId) {
        return mask(channelId) + "/blue";
    }

    public static String maskAlpha(int channelId) {
        return mask(channelId) + "/alpha";
    }

    public static String presentation(int channelId) {
        return "/" + channelId + "/show";
    }

    public static String selection(int channelId, GwySelectionKind kind) {
        return "/" + channelId + "/select/" + kind.keySuffix();
    }

    public static String graph(int graphId) {
        return "/0/graph/graph/" + graphId;
    }

    public static String graphVisible(int graphId) {
        return graph(graphId) + "/visible";
    }
}
