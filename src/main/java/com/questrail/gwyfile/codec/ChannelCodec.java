package com.questrail.gwyfile.codec;

import com.questrail.gwyfile.model.GwyChannel;
import com.questrail.gwyfile.model.GwyDataField;
import com.questrail.gwyfile.model.GwySelection;
import com.questrail.gwyfile.model.GwySelectionKind;
import com.questrail.gwyfile.tree.GwyItem;
import com.questrail.gwyfile.tree.GwyObject;
import com.questrail.gwyfile.tree.GwyTreeException;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * ChannelCodec
 * -----------------------------------------------------------------------------
 * Reads and writes one channel at its path keys inside a container.
 *
 * <p>Unlike the data-field and selection codecs, a channel is not a single
 * tree object: its parts are spread over the container under
 * {@code /{id}/...} (see {@link GwyPathKeys}). The data field and title are
 * required. Every other part, the visibility flag included, is read only if
 * present and written only if set on the model.</p>
 *
 * <p>All failures while decoding a part are reported as
 * {@link GwyDecodeException} naming the channel id and the part. A missing
 * required field inside a part stays a {@link GwyMissingFieldException}.</p>
 */
public final class ChannelCodec
{
    private final DataFieldCodec dataFieldCodec;
    private final SelectionCodec selectionCodec;

    public ChannelCodec() {
        this(new DataFieldCodec(), new SelectionCodec());
    }

    public ChannelCodec(DataFieldCodec dataFieldCodec, SelectionCodec selectionCodec) {
        this.dataFieldCodec = Objects.requireNonNull(dataFieldCodec, "dataFieldCodec");
        this.selectionCodec = Objects.requireNonNull(selectionCodec, "selectionCodec");
    }

    /**
     * @throws GwyMissingFieldException if the channel has no data field or no title
     * @throws GwyDecodeException if any present part is malformed
     */
    public GwyChannel decode(GwyObject container, int channelId) {
        Objects.requireNonNull(container, "container");

        String dataKey = GwyPathKeys.channelData(channelId);
        GwyObject dataObject = part(channelId, "data field", () -> container.getObject(dataKey))
                .orElseThrow(() -> new GwyMissingFieldException(dataKey,
                        "Channel " + channelId + " is missing its data field"));
        String titleKey = GwyPathKeys.channelTitle(channelId);
        String title = part(channelId, "title", () -> container.getString(titleKey))
                .orElseThrow(() -> new GwyMissingFieldException(titleKey,
                        "Channel " + channelId + " is missing its title"));

        GwyDataField data = part(channelId, "data field", () -> dataFieldCodec.decode(dataObject));
        GwyChannel.Builder builder = GwyChannel.builder(title, data);
        part(channelId, "visibility", () -> container.getBool(GwyPathKeys.channelVisible(channelId)))
                .ifPresent(builder::visible);

        part(channelId, "palette", () -> container.getString(GwyPathKeys.palette(channelId)))
                .ifPresent(builder::palette);
        part(channelId, "range type", () -> container.getInt32(GwyPathKeys.rangeType(channelId)))
                .ifPresent(builder::rangeType);
        part(channelId, "range min", () -> container.getDouble(GwyPathKeys.rangeMin(channelId)))
                .ifPresent(builder::rangeMin);
        part(channelId, "range max", () -> container.getDouble(GwyPathKeys.rangeMax(channelId)))
                .ifPresent(builder::rangeMax);

        part(channelId, "mask", () -> container.getObject(GwyPathKeys.mask(channelId))
                .map(dataFieldCodec::decode))
                .ifPresent(builder::mask);
        part(channelId, "mask red", () -> container.getDouble(GwyPathKeys.maskRed(channelId)))
                .ifPresent(builder::maskRed);
        part(channelId, "mask green", () -> container.getDouble(GwyPathKeys.maskGreen(channelId)))
                .ifPresent(builder::maskGreen);
        part(channelId, "mask blue", () -> container.getDouble(GwyPathKeys.maskBlue(channelId)))
                .ifPresent(builder::maskBlue);
        part(channelId, "mask alpha", () -> container.getDouble(GwyPathKeys.maskAlpha(channelId)))
                .ifPresent(builder::maskAlpha);

        part(channelId, "presentation", () -> container.getObject(GwyPathKeys.presentation(channelId))
                .map(dataFieldCodec::decode))
                .ifPresent(builder::presentation);

        for (GwySelectionKind kind : GwySelectionKind.values()) {
            part(channelId, kind.keySuffix() + " selection",
                    () -> container.getObject(GwyPathKeys.selection(channelId, kind))
                            .flatMap(object -> selectionCodec.decode(object, kind)))
                    .ifPresent(builder::selection);
        }
        return builder.build();
    }

    /**
     * Writes {@code channel} into {@code container} under {@code channelId}.
     *
     * @throws GwyTreeException if any of the channel's keys is already taken
     */
    public void encode(GwyChannel channel, GwyObject container, int channelId) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(container, "container");

        GwyFields.add(container, GwyItem.newObject(GwyPathKeys.channelData(channelId),
                dataFieldCodec.encode(channel.data())));
        GwyFields.add(container, GwyItem.newString(GwyPathKeys.channelTitle(channelId), channel.title()));
        channel.visibility().ifPresent(visible ->
                GwyFields.add(container, GwyItem.newBool(GwyPathKeys.channelVisible(channelId), visible)));

        channel.palette().ifPresent(palette ->
                GwyFields.add(container, GwyItem.newString(GwyPathKeys.palette(channelId), palette)));
        channel.rangeType().ifPresent(rangeType ->
                GwyFields.add(container, GwyItem.newInt32(GwyPathKeys.rangeType(channelId), rangeType)));
        channel.rangeMin().ifPresent(min ->
                GwyFields.add(container, GwyItem.newDouble(GwyPathKeys.rangeMin(channelId), min)));
        channel.rangeMax().ifPresent(max ->
                GwyFields.add(container, GwyItem.newDouble(GwyPathKeys.rangeMax(channelId), max)));

        channel.mask().ifPresent(mask ->
                GwyFields.add(container, GwyItem.newObject(GwyPathKeys.mask(channelId),
                        dataFieldCodec.encode(mask))));
        writeDouble(container, GwyPathKeys.maskRed(channelId), channel.maskRed());
        writeDouble(container, GwyPathKeys.maskGreen(channelId), channel.maskGreen());
        writeDouble(container, GwyPathKeys.maskBlue(channelId), channel.maskBlue());
        writeDouble(container, GwyPathKeys.maskAlpha(channelId), channel.maskAlpha());

        channel.presentation().ifPresent(presentation ->
                GwyFields.add(container, GwyItem.newObject(GwyPathKeys.presentation(channelId),
                        dataFieldCodec.encode(presentation))));

        for (GwySelection selection : channel.selections().values()) {
            GwyFields.add(container, GwyItem.newObject(
                    GwyPathKeys.selection(channelId, selection.kind()),
                    selectionCodec.encode(selection)));
        }
    }

    private static void writeDouble(GwyObject container, String key, Optional<Double> value) {
        value.ifPresent(v -> GwyFields.add(container, GwyItem.newDouble(key, v)));
    }

    private static <T> T part(int channelId, String what, Supplier<T> reader) {
        try {
            return reader.get();
        } catch (GwyMissingFieldException e) {
            throw new GwyMissingFieldException(e.field(),
                    "Channel " + channelId + ": failed to decode " + what + ": " + e.getMessage(), e);
        } catch (GwyDecodeException | GwyTreeException e) {
            throw new GwyDecodeException(
                    "Channel " + channelId + ": failed to decode " + what + ": " + e.getMessage(), e);
        }
    }
}
