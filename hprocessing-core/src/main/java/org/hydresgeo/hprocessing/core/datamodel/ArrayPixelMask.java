package org.hydresgeo.hprocessing.core.datamodel;

import org.hydresgeo.hprocessing.core.HProcessingConstants;

/**
 * Pixel mask backed by an integer raster. A value of
 * {@link HProcessingConstants#MASK_EXCLUDED_VALUE} (1) excludes the pixel, every other value includes it.
 */
public class ArrayPixelMask implements PixelMask {

    private final int[][] values;
    private final int columnCount;

    public ArrayPixelMask(int rowCount, int columnCount) {
        this.values = new int[rowCount][columnCount];
        this.columnCount = columnCount;
    }

    /**
     * Creates a mask from a copy of the given raster; later changes to either side are not shared.
     */
    public ArrayPixelMask(int[][] values) {
        this.columnCount = values.length > 0 ? values[0].length : 0;
        this.values = new int[values.length][];
        for (int row = 0; row < values.length; row++) {
            if (values[row].length != columnCount) {
                throw new IllegalArgumentException("Mask rows must have equal length");
            }
            this.values[row] = values[row].clone();
        }
    }

    @Override
    public int getRowCount() {
        return values.length;
    }

    @Override
    public int getColumnCount() {
        return columnCount;
    }

    @Override
    public boolean isExcluded(int row, int col) {
        return values[row][col] == HProcessingConstants.MASK_EXCLUDED_VALUE;
    }

    public int getValue(int row, int col) {
        return values[row][col];
    }

    public void setValue(int row, int col, int value) {
        values[row][col] = value;
    }

    public void exclude(int row, int col) {
        values[row][col] = HProcessingConstants.MASK_EXCLUDED_VALUE;
    }

    public int getExcludedPixelCount() {
        int count = 0;
        for (int row = 0; row < values.length; row++) {
            for (int col = 0; col < columnCount; col++) {
                if (isExcluded(row, col)) {
                    count++;
                }
            }
        }
        return count;
    }
}
