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

import org.hydresgeo.hprocessing.core.AggregationMode;
import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.datamodel.GridCellSpectrum;
import org.hydresgeo.hprocessing.core.datamodel.GridSpec;
import org.hydresgeo.hprocessing.core.datamodel.PixelMask;
import org.hydresgeo.hprocessing.core.datamodel.SpectralImage;
import org.hydresgeo.hprocessing.core.datamodel.Spectrum;
import org.hydresgeo.hprocessing.core.datamodel.ZoneResolver;
import org.hydresgeo.hprocessing.core.datamodel.ZoneSpectraTable;
import org.hydresgeo.hprocessing.core.util.RectangleUtils;

import java.awt.Rectangle;
import java.util.List;
import java.util.logging.Logger;

/**
 * Collects the calibrated spectra of all measurement zones of one capture.
 * <p>
 * The reference rectangle is aggregated with the mean of its ten brightest pixels, every zone grid cell with
 * the median of its pixels. Every zone row is then calibrated against the reference spectrum.
 * Unresolvable zones are not skipped; the {@link org.hydresgeo.hprocessing.core.UnresolvableZoneException}
 * reaches the caller.
 */
public class ZoneSpectraCollector {

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);

    private final RegionAggregator regionAggregator;
    private final ZoneResolver zoneResolver;
    private final String referenceZoneName;
    private final double reflectanceFactor;

    public ZoneSpectraCollector(SpectralImage image, BandFilter bandFilter, ZoneResolver zoneResolver) {
        this(image, bandFilter, zoneResolver, HProcessingConstants.REFERENCE_ZONE_NAME,
             HProcessingConstants.DEFAULT_REFLECTANCE_FACTOR);
    }

    public ZoneSpectraCollector(SpectralImage image, BandFilter bandFilter, ZoneResolver zoneResolver,
                                String referenceZoneName, double reflectanceFactor) {
        this.regionAggregator = new RegionAggregator(image, bandFilter);
        this.zoneResolver = zoneResolver;
        this.referenceZoneName = referenceZoneName;
        this.reflectanceFactor = reflectanceFactor;
    }

    /**
     * Computes the calibrated spectra table of the given zones.
     *
     * @param zones the zone names, in output order; the reference zone must not be listed
     * @param grid  the grid each zone is split into, {@code null} for one cell per pixel
     * @param mask  the pixel mask, may be {@code null}
     * @return one row per zone and grid cell
     */
    public ZoneSpectraTable computeZoneSpectraTable(List<String> zones, GridSpec grid, PixelMask mask) {
        final Spectrum reference = computeReferenceSpectrum(mask);

        ZoneSpectraTable.Builder builder =
                ZoneSpectraTable.builder(regionAggregator.getBandFilter().getUsableWavelengths());
        for (String zone : zones) {
            final Rectangle zoneRectangle = zoneResolver.resolve(zone);
            final List<GridCellSpectrum> gridSpectra =
                    regionAggregator.computeGridSpectra(zoneRectangle, grid,
                                                        HProcessingConstants.ZONE_AGGREGATION_MODE, mask);
            LOGGER.fine("Zone " + zone + " " + RectangleUtils.toEdgeString(zoneRectangle) + ": " +
                        gridSpectra.size() + " grid cells");
            ZoneSpectraTable.Builder zoneBuilder = ZoneSpectraTable.builder(builder.getWavelengths());
            for (GridCellSpectrum gridSpectrum : gridSpectra) {
                zoneBuilder.addRow(zone, gridSpectrum.getGridCell(), gridSpectrum.getSpectrum());
            }
            builder.addRows(SpectrumCalibrator.calibrate(zoneBuilder.build(), reference, reflectanceFactor));
        }
        return builder.build();
    }

    public Spectrum computeRegionSpectrum(Rectangle rectangle, AggregationMode mode, PixelMask mask) {
        return regionAggregator.computeRegionSpectrum(rectangle, mode, mask);
    }

    /**
     * Computes the raw spectrum of the white reference.
     */
    public Spectrum computeReferenceSpectrum(PixelMask mask) {
        final Rectangle referenceRectangle = zoneResolver.resolve(referenceZoneName);
        return computeRegionSpectrum(referenceRectangle, HProcessingConstants.REFERENCE_AGGREGATION_MODE, mask);
    }

    public String getReferenceZoneName() {
        return referenceZoneName;
    }

    public double getReflectanceFactor() {
        return reflectanceFactor;
    }
}
