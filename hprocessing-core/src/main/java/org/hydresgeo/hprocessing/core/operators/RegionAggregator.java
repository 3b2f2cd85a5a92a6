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

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.rank.Max;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.hydresgeo.hprocessing.core.AggregationMode;
import org.hydresgeo.hprocessing.core.DegenerateGeometryException;
import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.InsufficientPixelsException;
import org.hydresgeo.hprocessing.core.LengthMismatchException;
import org.hydresgeo.hprocessing.core.datamodel.GridCell;
import org.hydresgeo.hprocessing.core.datamodel.GridCellSpectrum;
import org.hydresgeo.hprocessing.core.datamodel.GridSpec;
import org.hydresgeo.hprocessing.core.datamodel.PixelMask;
import org.hydresgeo.hprocessing.core.datamodel.SpectralImage;
import org.hydresgeo.hprocessing.core.datamodel.Spectrum;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reduces the pixels of a region of interest to one spectrum.
 * <p>
 * For every band the values of all pixels inside the rectangle which are not excluded by the mask are
 * collected and reduced with the selected {@link AggregationMode}. Bad bands are removed afterwards.
 * Regions without any included pixel yield NaN for median, mean and max.
 */
public class RegionAggregator {

    private final SpectralImage image;
    private final BandFilter bandFilter;

    public RegionAggregator(SpectralImage image, BandFilter bandFilter) {
        if (image.getBandCount() < bandFilter.getBandCount()) {
            throw new LengthMismatchException("Image has " + image.getBandCount() + " bands, but " +
                                              bandFilter.getBandCount() + " wavelengths are given.");
        }
        this.image = image;
        this.bandFilter = bandFilter;
    }

    /**
     * Computes the spectrum of a single rectangle.
     *
     * @param rectangle the region, {@code x}/{@code width} along columns, {@code y}/{@code height} along rows
     * @param mode      the statistic; {@link AggregationMode#MAX10} requires at least 10 included pixels
     * @param mask      the pixel mask, may be {@code null}
     * @return the spectrum over the usable bands
     * @throws InsufficientPixelsException if fewer than 10 pixels are available in max10 mode
     */
    public Spectrum computeRegionSpectrum(Rectangle rectangle, AggregationMode mode, PixelMask mask) {
        checkMask(mask);
        final int[][] pixels = collectIncludedPixels(rectangle, mask);
        final int bandCount = bandFilter.getBandCount();
        final double[] rawSpectrum = new double[bandCount];
        final double[] values = new double[pixels.length];
        for (int band = 0; band < bandCount; band++) {
            for (int i = 0; i < pixels.length; i++) {
                values[i] = image.get(pixels[i][0], pixels[i][1], band);
            }
            rawSpectrum[band] = aggregate(values, mode);
        }
        return bandFilter.filter(rawSpectrum);
    }

    /**
     * Computes one spectrum per grid cell of the rectangle, in row-major order, each tagged with its
     * grid cell label.
     *
     * @throws DegenerateGeometryException if the cells are smaller than a pixel or if truncation yields a
     *                                     number of cells different from the number of grid labels
     */
    public List<GridCellSpectrum> computeGridSpectra(Rectangle rectangle, GridSpec grid, AggregationMode mode,
                                                     PixelMask mask) {
        final GridSpec effectiveGrid = GridPartitioner.getEffectiveGridSize(rectangle, grid);
        final List<GridCell> gridCells = GridPartitioner.getGridCells(effectiveGrid);
        final List<Rectangle> subRectangles = GridPartitioner.getSubRectangles(rectangle, effectiveGrid);
        if (gridCells.size() != subRectangles.size()) {
            throw new DegenerateGeometryException("Grid " + effectiveGrid + " splits a rectangle of " +
                                                  rectangle.height + "x" + rectangle.width + " pixels into " +
                                                  subRectangles.size() + " cells, but provides " +
                                                  gridCells.size() + " grid labels");
        }

        List<GridCellSpectrum> spectra = new ArrayList<>(subRectangles.size());
        for (int i = 0; i < subRectangles.size(); i++) {
            spectra.add(new GridCellSpectrum(gridCells.get(i), computeRegionSpectrum(subRectangles.get(i), mode, mask)));
        }
        return spectra;
    }

    public BandFilter getBandFilter() {
        return bandFilter;
    }

    /**
     * Reduces the pixel values of one band. A NaN pixel makes the result NaN, as does a NaN among the
     * largest values for {@link AggregationMode#MAX10}.
     */
    static double aggregate(double[] values, AggregationMode mode) {
        if (mode != AggregationMode.MAX10 && containsNaN(values)) {
            return Double.NaN;
        }
        switch (mode) {
            case MEDIAN:
                return new Median().evaluate(values);
            case MEAN:
                return new Mean().evaluate(values);
            case MAX:
                return new Max().evaluate(values);
            case MAX10:
                return computeTopMean(values, HProcessingConstants.MAX10_PIXEL_COUNT);
            default:
                throw new IllegalArgumentException("Unsupported aggregation mode " + mode);
        }
    }

    private static boolean containsNaN(double[] values) {
        for (double value : values) {
            if (Double.isNaN(value)) {
                return true;
            }
        }
        return false;
    }

    static double computeTopMean(double[] values, int count) {
        if (values.length < count) {
            throw new InsufficientPixelsException(count, values.length);
        }
        final double[] sorted = values.clone();
        Arrays.sort(sorted);
        return new Mean().evaluate(sorted, sorted.length - count, count);
    }

    private int[][] collectIncludedPixels(Rectangle rectangle, PixelMask mask) {
        List<int[]> pixels = new ArrayList<>(rectangle.width * rectangle.height);
        for (int row = rectangle.y; row < rectangle.y + rectangle.height; row++) {
            for (int col = rectangle.x; col < rectangle.x + rectangle.width; col++) {
                if (mask != null && mask.isExcluded(row, col)) {
                    continue;
                }
                pixels.add(new int[]{row, col});
            }
        }
        return pixels.toArray(new int[0][]);
    }

    private void checkMask(PixelMask mask) {
        if (mask != null &&
                (mask.getRowCount() != image.getRowCount() || mask.getColumnCount() != image.getColumnCount())) {
            throw new IllegalArgumentException("Mask of " + mask.getRowCount() + "x" + mask.getColumnCount() +
                                               " pixels does not match image of " + image.getRowCount() + "x" +
                                               image.getColumnCount() + " pixels");
        }
    }
}
