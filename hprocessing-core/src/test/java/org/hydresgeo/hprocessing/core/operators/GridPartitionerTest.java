package org.hydresgeo.hprocessing.core.operators;

import org.hydresgeo.hprocessing.core.DegenerateGeometryException;
import org.hydresgeo.hprocessing.core.datamodel.GridCell;
import org.hydresgeo.hprocessing.core.datamodel.GridSpec;
import org.hydresgeo.hprocessing.core.util.RectangleUtils;
import org.junit.Test;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class GridPartitionerTest {

    // rows 10..15, columns 5..8: height 5, width 3
    private static final Rectangle ZONE = RectangleUtils.createRectangle(10, 15, 5, 8);

    @Test
    public void testGetEffectiveGridSize() {
        assertEquals(new GridSpec(1, 1), GridPartitioner.getEffectiveGridSize(ZONE, new GridSpec(1, 1)));
        assertEquals(new GridSpec(2, 3), GridPartitioner.getEffectiveGridSize(ZONE, new GridSpec(2, 3)));
        assertEquals(new GridSpec(5, 3), GridPartitioner.getEffectiveGridSize(ZONE, new GridSpec(0, 0)));
        assertEquals(new GridSpec(5, 3), GridPartitioner.getEffectiveGridSize(ZONE, null));
        assertEquals(new GridSpec(5, 2), GridPartitioner.getEffectiveGridSize(ZONE, new GridSpec(0, 2)));
        assertEquals(new GridSpec(4, 3), GridPartitioner.getEffectiveGridSize(ZONE, new GridSpec(4, 0)));
    }

    @Test
    public void testSingleCellIsTheRectangle() {
        final List<Rectangle> subRectangles = GridPartitioner.getSubRectangles(ZONE, new GridSpec(1, 1));
        assertEquals(1, subRectangles.size());
        assertEquals(ZONE, subRectangles.get(0));
    }

    @Test
    public void testRemainderRowIsTruncated() {
        final List<Rectangle> subRectangles = GridPartitioner.getSubRectangles(ZONE, new GridSpec(2, 2));

        final List<Rectangle> expected = Arrays.asList(RectangleUtils.createRectangle(10, 12, 5, 6),
                                                       RectangleUtils.createRectangle(10, 12, 6, 7),
                                                       RectangleUtils.createRectangle(10, 12, 7, 8),
                                                       RectangleUtils.createRectangle(12, 14, 5, 6),
                                                       RectangleUtils.createRectangle(12, 14, 6, 7),
                                                       RectangleUtils.createRectangle(12, 14, 7, 8));
        assertEquals(expected, subRectangles);
    }

    @Test
    public void testFullResolutionYieldsUnitCells() {
        final List<Rectangle> subRectangles = GridPartitioner.getSubRectangles(ZONE, new GridSpec(0, 0));
        assertEquals(15, subRectangles.size());
        for (Rectangle subRectangle : subRectangles) {
            assertEquals(1, subRectangle.width);
            assertEquals(1, subRectangle.height);
        }
        assertEquals(RectangleUtils.createRectangle(10, 11, 5, 6), subRectangles.get(0));
        assertEquals(RectangleUtils.createRectangle(10, 11, 7, 8), subRectangles.get(2));
        assertEquals(RectangleUtils.createRectangle(14, 15, 7, 8), subRectangles.get(14));

        assertEquals(subRectangles, GridPartitioner.getSubRectangles(ZONE, null));
    }

    @Test
    public void testGridOfTwoByThree() {
        final List<Rectangle> subRectangles = GridPartitioner.getSubRectangles(ZONE, new GridSpec(2, 3));
        assertEquals(6, subRectangles.size());
        assertEquals(RectangleUtils.createRectangle(12, 14, 7, 8), subRectangles.get(5));
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testMoreGridRowsThanPixels() {
        GridPartitioner.getSubRectangles(ZONE, new GridSpec(6, 1));
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testMoreGridColumnsThanPixels() {
        GridPartitioner.getSubRectangles(ZONE, new GridSpec(1, 4));
    }

    @Test
    public void testGetGridCells() {
        assertEquals(Arrays.asList(new GridCell(0, 0)), GridPartitioner.getGridCells(new GridSpec(1, 1)));
        assertEquals(Arrays.asList(new GridCell(0, 0), new GridCell(1, 0)),
                     GridPartitioner.getGridCells(new GridSpec(2, 1)));
        assertEquals(Arrays.asList(new GridCell(0, 0), new GridCell(0, 1), new GridCell(0, 2),
                                   new GridCell(1, 0), new GridCell(1, 1), new GridCell(1, 2)),
                     GridPartitioner.getGridCells(new GridSpec(2, 3)));
    }

    @Test
    public void testGridCellsCollapseForFullResolution() {
        // labels of an unresolved full resolution grid collapse to one cell,
        // while the sub-rectangles expand to one cell per pixel
        assertEquals(Arrays.asList(new GridCell(0, 0)), GridPartitioner.getGridCells(new GridSpec(0, 0)));
        assertEquals(Arrays.asList(new GridCell(0, 0)), GridPartitioner.getGridCells(null));
        assertEquals(15, GridPartitioner.getSubRectangles(ZONE, new GridSpec(0, 0)).size());
    }

    @Test
    public void testGridCellsOfEffectiveGridMatchSubRectangles() {
        final GridSpec effectiveGrid = GridPartitioner.getEffectiveGridSize(ZONE, null);
        assertEquals(15, GridPartitioner.getGridCells(effectiveGrid).size());
        assertEquals(new GridCell(4, 2), GridPartitioner.getGridCells(effectiveGrid).get(14));
    }
}
