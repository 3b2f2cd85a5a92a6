package org.hydresgeo.hprocessing.core.datamodel;

/**
 * Per-pixel exclusion mask covering the row/column extent of an image.
 */
public interface PixelMask {

    int getRowCount();

    int getColumnCount();

    /**
     * @return true if the pixel must not contribute to any aggregate
     */
    boolean isExcluded(int row, int col);
}
