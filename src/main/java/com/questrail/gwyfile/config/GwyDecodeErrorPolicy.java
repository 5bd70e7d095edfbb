package com.questrail.gwyfile.config;

/**
 * How the container codec reacts when one channel or graph fails to decode.
 */
public enum GwyDecodeErrorPolicy
{
    /**
     * Leave the failing entity out, report it, and keep decoding the rest.
     */
    SKIP_ENTITY,

    /**
     * Abort the whole container decode with the entity's exception.
     */
    FAIL_FAST
}
