package com.questrail.gwyfile.model;

/**
 * A 2D coordinate in the physical units of the selection's data field.
 */
public record GwyPoint(double x, double y)
{
}
