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

package org.hydresgeo.hprocessing.hydresgeo.config;

import org.hydresgeo.hprocessing.core.datamodel.ArrayPixelMask;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the pixel mask of a measurement from the masks table.
 * <p>
 * Excluded are all pixels outside the field border {@code [start_row, end_row) x [start_col, end_col)} and
 * all pixels covered by one of the four wooden bars crossing the field. A bar is given by two points on its
 * upper edge ({@code bar<i>_p1_x}, {@code bar<i>_p1_y}, {@code bar<i>_p2_x}, {@code bar<i>_p2_y}) and its
 * extent {@code bar<i>_height} along x. The x coordinate of a bar pixel is the image row, y the column.
 */
public class MaskFactory {

    public static final int BAR_COUNT = 4;

    private MaskFactory() {
    }

    /**
     * Finds the mask row of a measurement and checks that it matches the positions row.
     *
     * @throws IOException if the measurement is missing or the masks and positions tables list the
     *                     measurements in a different order
     */
    public static int getMaskIndex(WhitespaceTable masks, String measurement, int positionsIndex) throws IOException {
        final int maskIndex = masks.findMeasurementRow(measurement);
        if (maskIndex < 0) {
            throw new IOException("Masks table has no row for measurement '" + measurement + "'");
        }
        if (maskIndex != positionsIndex) {
            throw new IOException("Positions and masks tables don't have the same sequence of measurements: '" +
                                  measurement + "' is in row " + positionsIndex + " and " + maskIndex);
        }
        return maskIndex;
    }

    public static ArrayPixelMask createMask(WhitespaceTable masks, int rowIndex, int rowCount, int columnCount) {
        ArrayPixelMask mask = new ArrayPixelMask(rowCount, columnCount);

        final int startRow = masks.getInt(rowIndex, "start_row");
        final int endRow = masks.getInt(rowIndex, "end_row");
        final int startCol = masks.getInt(rowIndex, "start_col");
        final int endCol = masks.getInt(rowIndex, "end_col");
        for (int row = 0; row < rowCount; row++) {
            for (int col = 0; col < columnCount; col++) {
                if (row < startRow || row >= endRow || col < startCol || col >= endCol) {
                    mask.exclude(row, col);
                }
            }
        }

        for (int i = 1; i <= BAR_COUNT; i++) {
            final String prefix = "bar" + i;
            final double[] point1 = {masks.getDouble(rowIndex, prefix + "_p1_x"),
                    masks.getDouble(rowIndex, prefix + "_p1_y")};
            final double[] point2 = {masks.getDouble(rowIndex, prefix + "_p2_x"),
                    masks.getDouble(rowIndex, prefix + "_p2_y")};
            final double height = masks.getDouble(rowIndex, prefix + "_height");
            for (int[] pixel : getWoodenBarPixels(point1, point2, height, rowCount, columnCount)) {
                mask.exclude(pixel[0], pixel[1]);
            }
        }
        return mask;
    }

    /**
     * @return all pixels {@code (x, y)} strictly between the lower and the upper bar edge, in x-major order
     */
    public static List<int[]> getWoodenBarPixels(double[] point1, double[] point2, double height,
                                                 int rowCount, int columnCount) {
        final double[] upper = getLineFromPoints(point1, point2);
        final double[] lower = getLineFromPoints(new double[]{point1[0] + height, point1[1]},
                                                 new double[]{point2[0] + height, point2[1]});
        List<int[]> pixels = new ArrayList<>();
        for (int x = 0; x < rowCount; x++) {
            for (int y = 0; y < columnCount; y++) {
                if (lower[0] * x + lower[1] < y && y < upper[0] * x + upper[1]) {
                    pixels.add(new int[]{x, y});
                }
            }
        }
        return pixels;
    }

    /**
     * @return {@code {m, c}} of the line {@code y = m * x + c} through both points
     */
    public static double[] getLineFromPoints(double[] point1, double[] point2) {
        final double m = (point2[1] - point1[1]) / (point2[0] - point1[0]);
        final double c = point2[1] - m * point2[0];
        return new double[]{m, c};
    }
}
