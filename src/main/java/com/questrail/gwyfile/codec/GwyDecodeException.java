package com.questrail.gwyfile.codec;

/**
 * Indicates that an item-tree object could not be translated into a valid
 * object-model value.
 *
 * This typically reflects:
 * <ul>
 *   <li>A nested object of the wrong type at a known path</li>
 *   <li>An array whose length contradicts the declared shape</li>
 *   <li>A store failure while reading a field, wrapped with the entity it belongs to</li>
 * </ul>
 *
 * A decode failure aborts the smallest enclosing entity (one channel, one
 * graph); see {@link ContainerCodec} for how the container reacts.
 */
public class GwyDecodeException extends RuntimeException
{
    public GwyDecodeException(String message) {
        super(message);
    }

    public GwyDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
