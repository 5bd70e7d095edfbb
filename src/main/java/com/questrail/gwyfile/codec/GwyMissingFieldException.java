package com.questrail.gwyfile.codec;

/**
 * A mandatory field is absent from the tree, e.g. a channel without its data
 * field or a data field without its resolution.
 */
public final class GwyMissingFieldException extends GwyDecodeException
{
    private final String field;

    public GwyMissingFieldException(String field, String message) {
        super(message);
        this.field = field;
    }

    public GwyMissingFieldException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * @return the item name or path of the missing field
     */
    public String field() {
        return field;
    }
}
