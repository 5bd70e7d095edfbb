package com.questrail.gwyfile.tree;

/**
 * Kinds of values a {@link GwyItem} can hold.
 *
 * <p>The type codes are the single-character tags used by the GWY file format.
 * Only the subset needed by the channel/graph object model is representable;
 * char, int64 and the remaining array kinds are not modelled.</p>
 */
public enum GwyItemType
{
    BOOL('b'),
    INT32('i'),
    DOUBLE('d'),
    STRING('s'),
    OBJECT('o'),
    DOUBLE_ARRAY('D'),
    OBJECT_ARRAY('O');

    private final char code;

    GwyItemType(char code) {
        this.code = code;
    }

    /**
     * @return the GWY format type tag for this item kind
     */
    public char code() {
        return code;
    }
}
