/*
 * Copyright (c) 2023.  Brockmann Consult GmbH (info@brockmann-consult.de)
 *
 * This program is free software; you can redistribute it and/or modify it
 * under the terms of the GNU General Public License as published by the Free
 * Software Foundation; either version 3 of the License, or (at your option)
 * any later version.
 * This program is distributed in the hope that it will be useful, but WITHOUT
 * ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or
 * FITNESS FOR A PARTICULAR PURPOSE. See the GNU General Public License for
 * more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, see http://www.gnu.org/licenses/
 *
 */

package org.hydresgeo.hprocessing.core.operators;

import org.hydresgeo.hprocessing.core.DegenerateGeometryException;
import org.hydresgeo.hprocessing.core.datamodel.GridCell;
import org.hydresgeo.hprocessing.core.datamodel.GridSpec;
import org.hydresgeo.hprocessing.core.util.RectangleUtils;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

/**
 * Grid partition of zone rectangles.
 * <p>
 * Cell sizes are truncated, not rounded: remainder pixels at the high end of a rectangle belong to no cell,
 * and an uneven extent may yield more cells than the nominal grid size along an axis.
 */
public class GridPartitioner {

    private GridPartitioner() {
    }

    /**
     * Resolves the number of grid rows and columns for a rectangle. A missing grid or an axis set to 0
     * yields one cell per pixel along that axis.
     */
    public static GridSpec getEffectiveGridSize(Rectangle rectangle, GridSpec grid) {
        if (grid == null || grid.isFullResolution()) {
            return new GridSpec(rectangle.height, rectangle.width);
        }
        final int rows = grid.getRows() == 0 ? rectangle.height : grid.getRows();
        final int columns = grid.getColumns() == 0 ? rectangle.width : grid.getColumns();
        return new GridSpec(rows, columns);
    }

    /**
     * Tiles the rectangle with the cells of the effective grid, in row-major order.
     *
     * @throws DegenerateGeometryException if a cell would be smaller than one pixel
     */
    public static List<Rectangle> getSubRectangles(Rectangle rectangle, GridSpec grid) {
        final GridSpec effectiveGrid = getEffectiveGridSize(rectangle, grid);
        final int cellHeight = cellSize(rectangle.height, effectiveGrid.getRows(), "row");
        final int cellWidth = cellSize(rectangle.width, effectiveGrid.getColumns(), "column");

        final int rowStart = rectangle.y;
        final int colStart = rectangle.x;
        final int cellRows = rectangle.height / cellHeight;
        final int cellColumns = rectangle.width / cellWidth;

        List<Rectangle> subRectangles = new ArrayList<>(cellRows * cellColumns);
        for (int i = 0; i < cellRows; i++) {
            final int cellRowStart = rowStart + i * cellHeight;
            for (int j = 0; j < cellColumns; j++) {
                final int cellColStart = colStart + j * cellWidth;
                subRectangles.add(RectangleUtils.createRectangle(cellRowStart, cellRowStart + cellHeight,
                                                                 cellColStart, cellColStart + cellWidth));
            }
        }
        return subRectangles;
    }

    /**
     * Lists the grid cell labels {@code (i, j)} in row-major order.
     * A missing grid or a grid of (0, 0) collapses to the single label (0, 0); callers pass the effective
     * grid size to obtain one label per cell.
     */
    public static List<GridCell> getGridCells(GridSpec grid) {
        List<GridCell> cells = new ArrayList<>();
        if (grid == null || grid.isFullResolution()) {
            cells.add(new GridCell(0, 0));
            return cells;
        }
        for (int i = 0; i < grid.getRows(); i++) {
            for (int j = 0; j < grid.getColumns(); j++) {
                cells.add(new GridCell(i, j));
            }
        }
        return cells;
    }

    private static int cellSize(int extent, int count, String axis) {
        final int size = extent / count;
        if (size < 1) {
            throw new DegenerateGeometryException("Cannot split " + extent + " pixels into " + count +
                                                  " grid " + axis + "s");
        }
        return size;
    }
}
