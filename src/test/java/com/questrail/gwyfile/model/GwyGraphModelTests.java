package com.questrail.gwyfile.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GwyGraphModelTests {

    private static GwyGraphCurve curve(double... ys) {
        double[] xs = new double[ys.length];
        for (int i = 0; i < xs.length; i++) {
            xs[i] = i;
        }
        return GwyGraphCurve.builder(xs, ys).build();
    }

    @Test
    void defaults() {
        GwyGraphModel graph = GwyGraphModel.builder().build();

        assertEquals(0, graph.ncurves());
        assertEquals("", graph.title());
        assertTrue(graph.labelVisible());
        assertTrue(graph.labelHasFrame());
        assertFalse(graph.labelReverse());
        assertEquals(1, graph.labelFrameThickness());
        assertEquals(0, graph.labelPosition());
        assertEquals(1, graph.gridType());
        assertFalse(graph.visible());
        assertTrue(graph.xMin().isEmpty());
        assertTrue(graph.yMax().isEmpty());
    }

    @Test
    void declaredCurveCountMustMatch() {
        GwyGraphModel.Builder builder = GwyGraphModel.builder(List.of(curve(1, 2), curve(3, 4)))
                .ncurves(3);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void boundsCanBeSetAndCleared() {
        GwyGraphModel graph = GwyGraphModel.builder()
                .xMin(-1.5)
                .yMax(10.0)
                .bound(GwyAxisBound.X_MAX, 4.0)
                .clearBound(GwyAxisBound.X_MAX)
                .build();

        assertEquals(-1.5, graph.xMin().orElseThrow());
        assertEquals(10.0, graph.bound(GwyAxisBound.Y_MAX).orElseThrow());
        assertTrue(graph.xMax().isEmpty());
    }

    @Test
    void curvesKeepTheirOrder() {
        GwyGraphCurve first = curve(1);
        GwyGraphCurve second = curve(2);

        GwyGraphModel graph = GwyGraphModel.builder().curve(first).curve(second).ncurves(2).build();

        assertEquals(List.of(first, second), graph.curves());
    }

    @Test
    void boundKeysFollowFileNaming() {
        assertEquals("y_min", GwyAxisBound.Y_MIN.valueKey());
        assertEquals("y_min_set", GwyAxisBound.Y_MIN.setKey());
    }
}
