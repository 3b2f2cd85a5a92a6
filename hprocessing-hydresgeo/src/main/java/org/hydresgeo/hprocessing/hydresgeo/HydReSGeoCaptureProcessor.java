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

package org.hydresgeo.hprocessing.hydresgeo;

import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.datamodel.ArrayPixelMask;
import org.hydresgeo.hprocessing.core.datamodel.SpectralImage;
import org.hydresgeo.hprocessing.core.datamodel.ZoneSpectraTable;
import org.hydresgeo.hprocessing.core.operators.BandFilter;
import org.hydresgeo.hprocessing.core.operators.ZoneSpectraCollector;
import org.hydresgeo.hprocessing.hydresgeo.config.MaskFactory;
import org.hydresgeo.hprocessing.hydresgeo.config.PositionsTable;
import org.hydresgeo.hprocessing.hydresgeo.config.ProcessingConfig;
import org.hydresgeo.hprocessing.hydresgeo.config.WhitespaceTable;
import org.hydresgeo.hprocessing.hydresgeo.dataio.envi.EnviAcquisitionTime;
import org.hydresgeo.hprocessing.hydresgeo.dataio.envi.EnviHeader;
import org.hydresgeo.hprocessing.hydresgeo.dataio.envi.EnviHeaderReader;
import org.hydresgeo.hprocessing.hydresgeo.dataio.envi.EnviImageReader;
import org.hydresgeo.hprocessing.hydresgeo.lwir.LwirZoneStatistics;
import org.hydresgeo.hprocessing.hydresgeo.soilmoisture.SoilMoistureData;
import org.hydresgeo.hprocessing.hydresgeo.soilmoisture.SoilMoistureRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Processes one hyperspectral capture of a measurement into output rows.
 * <p>
 * The image cube is read via the capture header {@code AutoNNN.hdr}; wavelengths, bad band list and
 * acquisition time come from the companion header {@code AutoNNN_highres.hdr}. Zone spectra are joined
 * with the capture time and, by zone name, with the soil moisture record and the LWIR statistics.
 */
public class HydReSGeoCaptureProcessor {

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);

    private final ProcessingConfig config;
    private final SoilMoistureData soilMoistureData;
    private final Path headerPath;
    private final String measurement;
    private final List<String> zones;

    public HydReSGeoCaptureProcessor(ProcessingConfig config, SoilMoistureData soilMoistureData, Path headerPath,
                                     String measurement, List<String> zones) {
        this.config = config;
        this.soilMoistureData = soilMoistureData;
        this.headerPath = headerPath;
        this.measurement = measurement;
        this.zones = new ArrayList<>(zones);
    }

    public static Path getHighresHeaderPath(Path headerPath) {
        final String fileName = headerPath.getFileName().toString();
        final String baseName = fileName.substring(0, fileName.length() - EnviImageReader.HEADER_EXTENSION.length());
        return headerPath.resolveSibling(baseName + HydReSGeoConstants.HIGHRES_HEADER_SUFFIX);
    }

    /**
     * @return the rows of this capture, empty if the image holds no data
     * @throws IOException if a file of the capture cannot be read or the masks table does not match the
     *                     positions table
     */
    public List<DatasetRow> process() throws IOException {
        final EnviHeader highresHeader = EnviHeaderReader.readHeader(getHighresHeaderPath(headerPath));
        final SpectralImage image = EnviImageReader.readImage(headerPath);

        final PositionsTable positions = config.getHypPositions();
        final int positionsIndex = positions.getMeasurementIndex(measurement);
        final ArrayPixelMask mask = createMask(image, positionsIndex);

        if (isEmpty(image)) {
            LOGGER.warning("The hyperspectral image " + headerPath + " is empty");
            return Collections.emptyList();
        }

        final BandFilter bandFilter = BandFilter.create(highresHeader.getWavelengths(),
                                                        highresHeader.getBadBandList());
        final ZoneSpectraCollector collector =
                new ZoneSpectraCollector(image, bandFilter, positions.createZoneResolver(measurement));
        final ZoneSpectraTable spectraTable = collector.computeZoneSpectraTable(zones, config.getGrid(), mask);

        final EnviAcquisitionTime acquisitionTime = EnviAcquisitionTime.fromHeader(highresHeader);
        final OffsetDateTime dateTime = acquisitionTime.toOffsetDateTime(config.getTimezoneOffset());
        LOGGER.fine("Capture " + headerPath.getFileName() + " acquired " + dateTime);

        final Map<String, SoilMoistureRecord> soilMoisture =
                soilMoistureData.getNearestRecords(zones, dateTime.toInstant(), config.getTimeWindowWidth());
        final Map<String, LwirZoneStatistics> lwirStatistics =
                LwirZoneStatistics.computeForZones(config.getLwirDataDirectory(), config.getLwirPositions(), zones,
                                                   dateTime.toInstant(), acquisitionTime.getDate(),
                                                   config.getTimeWindowWidth(), config.getTimezoneOffset());

        List<DatasetRow> rows = new ArrayList<>(spectraTable.getRowCount());
        for (ZoneSpectraTable.Row spectraRow : spectraTable.getRows()) {
            final String zone = spectraRow.getZone();
            final LwirZoneStatistics zoneLwir = lwirStatistics.get(zone);
            rows.add(new DatasetRow(spectraRow, dateTime, soilMoisture.get(zone),
                                    zoneLwir != null ? zoneLwir : LwirZoneStatistics.UNAVAILABLE));
        }
        return rows;
    }

    private ArrayPixelMask createMask(SpectralImage image, int positionsIndex) throws IOException {
        final WhitespaceTable masks = config.getMasks();
        if (masks == null) {
            return null;
        }
        if (image.getRowCount() != config.getImageRows() || image.getColumnCount() != config.getImageColumns()) {
            throw new IOException("Image " + headerPath + " has " + image.getRowCount() + "x" +
                                  image.getColumnCount() + " pixels, but masks are configured for " +
                                  config.getImageRows() + "x" + config.getImageColumns() + " pixels");
        }
        final int maskIndex = MaskFactory.getMaskIndex(masks, measurement, positionsIndex);
        return MaskFactory.createMask(masks, maskIndex, config.getImageRows(), config.getImageColumns());
    }

    static boolean isEmpty(SpectralImage image) {
        if (image.getBandCount() <= HydReSGeoConstants.EMPTY_CHECK_BAND) {
            return false;
        }
        double sum = 0.0;
        for (int row = 0; row < image.getRowCount(); row++) {
            for (int col = 0; col < image.getColumnCount(); col++) {
                sum += image.get(row, col, HydReSGeoConstants.EMPTY_CHECK_BAND);
            }
        }
        return sum == 0.0;
    }
}
