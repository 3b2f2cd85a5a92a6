package org.hydresgeo.hprocessing.core.datamodel;

/**
 * Read-only access to a hyperspectral cube addressed as {@code image[row, col, band]}.
 */
public interface SpectralImage {

    int getRowCount();

    int getColumnCount();

    int getBandCount();

    /**
     * @throws IndexOutOfBoundsException if the position lies outside the cube
     */
    double get(int row, int col, int band);
}
