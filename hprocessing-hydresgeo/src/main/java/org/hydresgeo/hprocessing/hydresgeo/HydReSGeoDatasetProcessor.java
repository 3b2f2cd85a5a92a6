package org.hydresgeo.hprocessing.hydresgeo;

import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.HProcessingException;
import org.hydresgeo.hprocessing.hydresgeo.config.IgnoreRules;
import org.hydresgeo.hprocessing.hydresgeo.config.ProcessingConfig;
import org.hydresgeo.hprocessing.hydresgeo.soilmoisture.SoilMoistureData;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Processes all captures of the dataset and writes the output CSV table.
 * <p>
 * Captures are the files {@code <data_hyp>/<measurement>_hyp/AutoNNN.hdr}. Ignored measurements and
 * datapoints are skipped, ignored fields are removed from the zone list of the capture. A capture that fails
 * is logged and skipped.
 */
public class HydReSGeoDatasetProcessor {

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);
    private static final Pattern CAPTURE_HEADER_PATTERN = Pattern.compile(".*[0-9]\\.hdr");

    private final ProcessingConfig config;

    public HydReSGeoDatasetProcessor(ProcessingConfig config) {
        this.config = config;
    }

    /**
     * @return the rows written, empty if the output file exists and may not be overwritten
     */
    public List<DatasetRow> process() throws IOException {
        final Path outputFile = config.getOutputFile();
        if (!config.isOverwriteCsvFile() && Files.exists(outputFile)) {
            LOGGER.info("Processing not executed, " + outputFile + " already exists. " +
                        "To overwrite the existing file, change the config.");
            return Collections.emptyList();
        }

        final SoilMoistureData soilMoistureData = SoilMoistureData.read(config.getSoilMoistureFile());
        final IgnoreRules ignoreRules = config.getIgnoreRules();

        List<DatasetRow> rows = new ArrayList<>();
        final List<Path> headers = findCaptureHeaders(config.getHypDataDirectory());
        LOGGER.info("Found " + headers.size() + " hyperspectral captures in " + config.getHypDataDirectory());
        for (Path header : headers) {
            final String measurement = getMeasurementName(header);
            final int fileNumber;
            try {
                fileNumber = getFileNumber(header);
            } catch (NumberFormatException e) {
                LOGGER.warning("Skipping " + header + ", no file number in its name");
                continue;
            }
            LOGGER.fine("Processing " + measurement + " - file " + fileNumber);

            if (ignoreRules.isMeasurementIgnored(measurement)) {
                LOGGER.fine("Ignoring measurement " + measurement);
                continue;
            }
            if (ignoreRules.isDatapointIgnored(measurement, fileNumber)) {
                LOGGER.fine("Ignoring file " + fileNumber + " of " + measurement);
                continue;
            }
            final List<String> defaultZones = HydReSGeoConstants.getDefaultZones();
            final List<String> zones = ignoreRules.removeIgnoredFields(measurement, fileNumber, defaultZones);
            if (zones.size() < defaultZones.size()) {
                LOGGER.fine("Removed " + (defaultZones.size() - zones.size()) + " zone(s)");
            }

            try {
                rows.addAll(new HydReSGeoCaptureProcessor(config, soilMoistureData, header, measurement, zones)
                                    .process());
            } catch (IOException | HProcessingException | IllegalArgumentException e) {
                LOGGER.log(Level.SEVERE, "Failed to process " + header + ": " + e.getMessage(), e);
            }
        }

        DatasetCsvWriter.write(outputFile, rows);
        LOGGER.info("Wrote " + rows.size() + " rows to " + outputFile);
        return rows;
    }

    static List<Path> findCaptureHeaders(Path hypDataDirectory) throws IOException {
        List<Path> headers = new ArrayList<>();
        try (DirectoryStream<Path> measurements = Files.newDirectoryStream(hypDataDirectory, Files::isDirectory)) {
            for (Path measurementDirectory : measurements) {
                try (DirectoryStream<Path> files = Files.newDirectoryStream(measurementDirectory)) {
                    for (Path file : files) {
                        if (Files.isRegularFile(file) &&
                                CAPTURE_HEADER_PATTERN.matcher(file.getFileName().toString()).matches()) {
                            headers.add(file);
                        }
                    }
                }
            }
        }
        Collections.sort(headers);
        return headers;
    }

    /**
     * @return the measurement directory name without {@code _hyp}
     */
    static String getMeasurementName(Path header) {
        return header.getParent().getFileName().toString()
                .replace(HydReSGeoConstants.MEASUREMENT_DIRECTORY_SUFFIX, "");
    }

    /**
     * @return the number of a capture file, 17 for {@code Auto017.hdr}
     * @throws NumberFormatException if the file name carries no number at the expected position
     */
    static int getFileNumber(Path header) {
        final String fileName = header.getFileName().toString();
        if (fileName.length() < HydReSGeoConstants.FILE_NUMBER_END) {
            throw new NumberFormatException("File name too short: " + fileName);
        }
        return Integer.parseInt(fileName.substring(HydReSGeoConstants.FILE_NUMBER_START,
                                                   HydReSGeoConstants.FILE_NUMBER_END));
    }
}
