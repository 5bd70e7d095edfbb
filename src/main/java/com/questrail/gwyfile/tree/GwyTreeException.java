package com.questrail.gwyfile.tree;

/**
 * Raised by an item-tree store when a read or write at a given path fails.
 *
 * This covers:
 * <ul>
 *   <li>An item whose stored kind differs from the kind requested</li>
 *   <li>Access to an object that has already been closed</li>
 *   <li>Any other failure reported by the underlying store</li>
 * </ul>
 *
 * Codecs wrap this exception with the entity being decoded; they never
 * replace the value with a default.
 */
public final class GwyTreeException extends RuntimeException
{
    private final String path;

    public GwyTreeException(String path, String message) {
        super(message + " (at " + path + ")");
        this.path = path;
    }

    public GwyTreeException(String path, String message, Throwable cause) {
        super(message + " (at " + path + ")", cause);
        this.path = path;
    }

    /**
     * @return the item name or path the failing operation addressed
     */
    public String path() {
        return path;
    }
}
