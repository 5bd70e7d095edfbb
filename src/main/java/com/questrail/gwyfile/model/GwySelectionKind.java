package com.questrail.gwyfile.model;

/**
 * The five selection kinds a channel can carry.
 *
 * <p>Each kind knows the key suffix it is stored under
 * ({@code /N/select/<suffix>}), the type name of its tree object and how many
 * points make up one selection instance. Pointer selections are stored as
 * point selection objects.</p>
 */
public enum GwySelectionKind
{
    POINT("point", "GwySelectionPoint", 1),
    POINTER("pointer", "GwySelectionPoint", 1),
    LINE("line", "GwySelectionLine", 2),
    RECTANGLE("rectangle", "GwySelectionRectangle", 2),
    ELLIPSE("ellipse", "GwySelectionEllipse", 2);

    private final String keySuffix;
    private final String objectName;
    private final int pointsPerInstance;

    GwySelectionKind(String keySuffix, String objectName, int pointsPerInstance) {
        this.keySuffix = keySuffix;
        this.objectName = objectName;
        this.pointsPerInstance = pointsPerInstance;
    }

    public String keySuffix() {
        return keySuffix;
    }

    public String objectName() {
        return objectName;
    }

    /**
     * @return 1 for point-like kinds, 2 for kinds defined by a point pair
     */
    public int pointsPerInstance() {
        return pointsPerInstance;
    }

    public boolean isPaired() {
        return pointsPerInstance == 2;
    }
}
