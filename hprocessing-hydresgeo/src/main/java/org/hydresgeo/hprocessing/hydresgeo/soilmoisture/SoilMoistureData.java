package org.hydresgeo.hprocessing.hydresgeo.soilmoisture;

import com.google.common.base.Splitter;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.primitives.Doubles;
import org.hydresgeo.hprocessing.core.HProcessingConstants;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Soil moisture time series of all sensors, read from a comma separated file with the columns
 * {@code timestamp}, {@code sensorID}, {@code volSM_vol%} and {@code T_C}. Further columns are ignored.
 * Timestamps without offset are taken as UTC.
 */
public class SoilMoistureData {

    public static final String TIMESTAMP_COLUMN = "timestamp";
    public static final String SENSOR_ID_COLUMN = "sensorID";
    public static final String SOIL_MOISTURE_COLUMN = "volSM_vol%";
    public static final String TEMPERATURE_COLUMN = "T_C";

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);
    private static final Splitter CSV_SPLITTER = Splitter.on(',').trimResults();

    private final ListMultimap<String, SoilMoistureRecord> recordsBySensor;

    SoilMoistureData(ListMultimap<String, SoilMoistureRecord> recordsBySensor) {
        this.recordsBySensor = recordsBySensor;
    }

    public static SoilMoistureData read(Path csvFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new IOException("Failed to read soil moisture data " + csvFile + ": " + e.getMessage(), e);
        }
    }

    public static SoilMoistureData read(Reader reader) throws IOException {
        final BufferedReader bufferedReader = new BufferedReader(reader);
        final String headerLine = bufferedReader.readLine();
        if (headerLine == null) {
            throw new IOException("Soil moisture data is empty");
        }
        final List<String> header = CSV_SPLITTER.splitToList(headerLine);
        final int timestampIndex = getColumnIndex(header, TIMESTAMP_COLUMN);
        final int sensorIndex = getColumnIndex(header, SENSOR_ID_COLUMN);
        final int soilMoistureIndex = getColumnIndex(header, SOIL_MOISTURE_COLUMN);
        final int temperatureIndex = getColumnIndex(header, TEMPERATURE_COLUMN);

        ListMultimap<String, SoilMoistureRecord> records = ArrayListMultimap.create();
        String line;
        int lineNumber = 1;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            if (line.trim().isEmpty()) {
                continue;
            }
            final List<String> values = CSV_SPLITTER.splitToList(line);
            if (values.size() < header.size()) {
                throw new IOException("Line " + lineNumber + " has " + values.size() + " values, but the header has " +
                                      header.size() + " columns");
            }
            final String sensorId = values.get(sensorIndex);
            records.put(sensorId, new SoilMoistureRecord(sensorId,
                                                         parseTimestamp(values.get(timestampIndex)),
                                                         parseValue(values.get(soilMoistureIndex)),
                                                         parseValue(values.get(temperatureIndex))));
        }
        return new SoilMoistureData(records);
    }

    /**
     * Parses ISO-8601 like timestamps, with {@code T} or a blank between date and time, with or without
     * offset.
     *
     * @throws IOException if the text is not a timestamp
     */
    public static Instant parseTimestamp(String text) throws IOException {
        String isoText = text.trim();
        if (isoText.length() > 10 && isoText.charAt(10) == ' ') {
            isoText = isoText.substring(0, 10) + 'T' + isoText.substring(11);
        }
        try {
            return OffsetDateTime.parse(isoText).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(isoText).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                throw new IOException("Invalid timestamp '" + text + "'", e2);
            }
        }
    }

    public List<SoilMoistureRecord> getRecords(String sensorId) {
        return recordsBySensor.get(sensorId);
    }

    /**
     * Finds the nearest record of a sensor.
     *
     * @return the nearest record, or {@code null} if the sensor has no record within half the time window
     */
    public SoilMoistureRecord findNearestRecord(String sensorId, Instant captureTime, int timeWindowWidth) {
        final List<SoilMoistureRecord> records = getRecords(sensorId);
        if (records.isEmpty()) {
            return null;
        }
        List<Instant> timestamps = new ArrayList<>(records.size());
        for (SoilMoistureRecord record : records) {
            timestamps.add(record.getTimestamp());
        }
        final NearestDate nearestDate = NearestDate.find(timestamps, captureTime);
        if (!nearestDate.isWithinWindow(timeWindowWidth)) {
            return null;
        }
        return records.get(timestamps.indexOf(nearestDate.getDate()));
    }

    /**
     * Matches the uppermost sensor of every listed zone to the capture time. Zones whose sensor has no record
     * within half the time window are left out, with a warning.
     *
     * @return the records keyed by zone name
     */
    public Map<String, SoilMoistureRecord> getNearestRecords(List<String> zones, Instant captureTime,
                                                             int timeWindowWidth) {
        Map<String, SoilMoistureRecord> nearestRecords = new LinkedHashMap<>();
        for (Map.Entry<String, SoilMoistureSensor> entry :
                SoilMoistureSensors.getUppermostSensorsByZone(zones).entrySet()) {
            final SoilMoistureSensor sensor = entry.getValue();
            final SoilMoistureRecord record = findNearestRecord(sensor.getSensorId(), captureTime, timeWindowWidth);
            if (record == null) {
                LOGGER.warning("Could not find a soil moisture measurement for sensor " + sensor.getNumber() +
                               " within " + timeWindowWidth + " minutes of " + captureTime);
                continue;
            }
            nearestRecords.put(entry.getKey(), record);
        }
        return nearestRecords;
    }

    private static double parseValue(String text) {
        final Double value = Doubles.tryParse(text);
        return value != null ? value : Double.NaN;
    }

    private static int getColumnIndex(List<String> header, String columnName) throws IOException {
        final int index = header.indexOf(columnName);
        if (index < 0) {
            throw new IOException("Soil moisture data has no column '" + columnName + "'");
        }
        return index;
    }
}
