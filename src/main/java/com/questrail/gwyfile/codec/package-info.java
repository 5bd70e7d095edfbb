/**
 * GWY Codecs
 * =============================================================================
 *
 * <p>This package translates between the typed object model in
 * {@code com.questrail.gwyfile.model} and the generic item tree exposed by
 * {@code com.questrail.gwyfile.tree}.</p>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codecs sit <strong>above</strong> the item-tree store and
 * <strong>below</strong> file I/O:</p>
 *
 * <pre>
 *   GwyObject (GwyContainer tree)
 *        → ContainerCodec
 *            → ChannelCodec     → DataFieldCodec, SelectionCodec
 *            → GraphModelCodec  → GraphCurveCodec
 *                → GwyContainer (object model)
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Path keys are produced by {@link com.questrail.gwyfile.codec.GwyPathKeys}
 *       and nowhere else.</li>
 *   <li>Defaults of optional fields come from the model's {@code MetaKey}
 *       constants; a missing optional field is never an error.</li>
 *   <li>Store failures ({@code GwyTreeException}) are wrapped in
 *       {@link com.questrail.gwyfile.codec.GwyDecodeException} with the
 *       entity they occurred in.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>Codec instances hold no per-call state and may be shared. A single tree
 * must not be mutated concurrently.</p>
 */
package com.questrail.gwyfile.codec;
