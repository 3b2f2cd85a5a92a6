package org.hydresgeo.hprocessing.hydresgeo;

import com.google.common.base.Joiner;
import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.datamodel.ZoneSpectraTable;
import org.hydresgeo.hprocessing.core.util.WavelengthUtils;
import org.hydresgeo.hprocessing.hydresgeo.lwir.LwirZoneStatistics;
import org.hydresgeo.hprocessing.hydresgeo.soilmoisture.SoilMoistureRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes dataset rows as one CSV table. The first column holds the row index, followed by one column per
 * wavelength (nm labels), the zone and grid labels, the capture time in UTC, soil moisture and LWIR values.
 * Captures with different band sets share the union of their wavelength columns; missing and NaN values are
 * written as empty cells.
 */
public class DatasetCsvWriter {

    private static final Joiner JOINER = Joiner.on(',');
    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ssxxx");

    private DatasetCsvWriter() {
    }

    public static void write(Path outputFile, List<DatasetRow> rows) throws IOException {
        final Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            write(writer, rows);
        }
    }

    public static void write(Writer writer, List<DatasetRow> rows) throws IOException {
        final List<String> wavelengthLabels = getWavelengthLabels(rows);
        final BufferedWriter bufferedWriter = new BufferedWriter(writer);

        List<String> header = new ArrayList<>();
        header.add(HydReSGeoConstants.INDEX_COLUMN_NAME);
        header.addAll(wavelengthLabels);
        header.add(HProcessingConstants.ZONE_COLUMN_NAME);
        header.add(HProcessingConstants.GRID_ROW_COLUMN_NAME);
        header.add(HProcessingConstants.GRID_COLUMN_COLUMN_NAME);
        header.add(HydReSGeoConstants.DATETIME_COLUMN_NAME);
        header.add(HydReSGeoConstants.SOIL_MOISTURE_COLUMN_NAME);
        header.add(HydReSGeoConstants.SOIL_TEMPERATURE_COLUMN_NAME);
        header.add(HydReSGeoConstants.LWIR_MEAN_COLUMN_NAME);
        header.add(HydReSGeoConstants.LWIR_MEDIAN_COLUMN_NAME);
        header.add(HydReSGeoConstants.LWIR_STD_COLUMN_NAME);
        bufferedWriter.write(JOINER.join(header));
        bufferedWriter.newLine();

        for (int i = 0; i < rows.size(); i++) {
            bufferedWriter.write(JOINER.join(toCells(i, rows.get(i), wavelengthLabels)));
            bufferedWriter.newLine();
        }
        bufferedWriter.flush();
    }

    static List<String> getWavelengthLabels(List<DatasetRow> rows) {
        Set<String> labels = new LinkedHashSet<>();
        for (DatasetRow row : rows) {
            for (double wavelength : row.getSpectraRow().getSpectrum().getWavelengths()) {
                labels.add(WavelengthUtils.convertWavelength(wavelength));
            }
        }
        return new ArrayList<>(labels);
    }

    private static List<String> toCells(int index, DatasetRow row, List<String> wavelengthLabels) {
        final ZoneSpectraTable.Row spectraRow = row.getSpectraRow();
        final double[] wavelengths = spectraRow.getSpectrum().getWavelengths();
        final double[] values = spectraRow.getValues();
        Map<String, String> valuesByLabel = new HashMap<>();
        for (int i = 0; i < wavelengths.length; i++) {
            valuesByLabel.put(WavelengthUtils.convertWavelength(wavelengths[i]), format(values[i]));
        }

        List<String> cells = new ArrayList<>();
        cells.add(String.valueOf(index));
        for (String label : wavelengthLabels) {
            final String value = valuesByLabel.get(label);
            cells.add(value != null ? value : "");
        }
        cells.add(spectraRow.getZone());
        cells.add(String.valueOf(spectraRow.getGridRow()));
        cells.add(String.valueOf(spectraRow.getGridColumn()));
        cells.add(row.getDateTime().withOffsetSameInstant(ZoneOffset.UTC).format(DATE_TIME_FORMATTER));

        final SoilMoistureRecord soilMoisture = row.getSoilMoisture();
        cells.add(soilMoisture != null ? format(soilMoisture.getVolumetricSoilMoisture()) : "");
        cells.add(soilMoisture != null ? format(soilMoisture.getTemperature()) : "");

        final LwirZoneStatistics lwir = row.getLwirStatistics();
        cells.add(format(lwir.getMean()));
        cells.add(format(lwir.getMedian()));
        cells.add(format(lwir.getStandardDeviation()));
        return cells;
    }

    static String format(double value) {
        return Double.isNaN(value) ? "" : String.valueOf(value);
    }
}
