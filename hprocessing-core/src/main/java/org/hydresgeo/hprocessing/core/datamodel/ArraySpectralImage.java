package org.hydresgeo.hprocessing.core.datamodel;

/**
 * In-memory spectral image, stored band interleaved by pixel.
 */
public class ArraySpectralImage implements SpectralImage {

    private final int rowCount;
    private final int columnCount;
    private final int bandCount;
    private final double[] data;

    public ArraySpectralImage(int rowCount, int columnCount, int bandCount) {
        this(rowCount, columnCount, bandCount, new double[checkedSize(rowCount, columnCount, bandCount)]);
    }

    public ArraySpectralImage(int rowCount, int columnCount, int bandCount, double[] data) {
        if (data.length != checkedSize(rowCount, columnCount, bandCount)) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match image size " +
                                               rowCount + "x" + columnCount + "x" + bandCount);
        }
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.bandCount = bandCount;
        this.data = data;
    }

    @Override
    public int getRowCount() {
        return rowCount;
    }

    @Override
    public int getColumnCount() {
        return columnCount;
    }

    @Override
    public int getBandCount() {
        return bandCount;
    }

    @Override
    public double get(int row, int col, int band) {
        return data[index(row, col, band)];
    }

    public void set(int row, int col, int band, double value) {
        data[index(row, col, band)] = value;
    }

    private int index(int row, int col, int band) {
        if (row < 0 || row >= rowCount || col < 0 || col >= columnCount || band < 0 || band >= bandCount) {
            throw new IndexOutOfBoundsException("Pixel (" + row + ", " + col + ", " + band +
                                                ") outside of image " + rowCount + "x" + columnCount + "x" + bandCount);
        }
        return (row * columnCount + col) * bandCount + band;
    }

    private static int checkedSize(int rowCount, int columnCount, int bandCount) {
        if (rowCount < 0 || columnCount < 0 || bandCount < 0) {
            throw new IllegalArgumentException("Image dimensions must not be negative");
        }
        return Math.multiplyExact(Math.multiplyExact(rowCount, columnCount), bandCount);
    }
}
