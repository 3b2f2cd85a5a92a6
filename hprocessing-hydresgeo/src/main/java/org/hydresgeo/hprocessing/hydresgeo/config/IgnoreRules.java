package org.hydresgeo.hprocessing.hydresgeo.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Exclusion lists of the dataset: whole measurements, single captures (datapoints) and single fields
 * (zones) of a capture. Each of the three tables may be {@code null}.
 */
public class IgnoreRules {

    public static final String FILE_NUMBER_COLUMN = "filenumber";
    public static final String ZONE_COLUMN = "zone";
    public static final String ZONE_PREFIX = "zone";

    private final WhitespaceTable ignoredMeasurements;
    private final WhitespaceTable ignoredDatapoints;
    private final WhitespaceTable ignoredFields;

    public IgnoreRules(WhitespaceTable ignoredMeasurements, WhitespaceTable ignoredDatapoints,
                       WhitespaceTable ignoredFields) {
        this.ignoredMeasurements = ignoredMeasurements;
        this.ignoredDatapoints = ignoredDatapoints;
        this.ignoredFields = ignoredFields;
    }

    public boolean isMeasurementIgnored(String measurement) {
        return ignoredMeasurements != null && ignoredMeasurements.containsValue(measurement);
    }

    public boolean isDatapointIgnored(String measurement, int fileNumber) {
        if (ignoredDatapoints == null) {
            return false;
        }
        for (int i = 0; i < ignoredDatapoints.getRowCount(); i++) {
            if (matches(ignoredDatapoints, i, measurement, fileNumber)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return the numbers of the fields to drop from the capture, {@code 3} standing for {@code zone3}
     */
    public List<Integer> getIgnoredFields(String measurement, int fileNumber) {
        List<Integer> fields = new ArrayList<>();
        if (ignoredFields == null) {
            return fields;
        }
        for (int i = 0; i < ignoredFields.getRowCount(); i++) {
            if (matches(ignoredFields, i, measurement, fileNumber)) {
                fields.add(ignoredFields.getInt(i, ZONE_COLUMN));
            }
        }
        return fields;
    }

    /**
     * @return a copy of the zone list without the ignored fields of the capture
     */
    public List<String> removeIgnoredFields(String measurement, int fileNumber, List<String> zones) {
        List<String> remaining = new ArrayList<>(zones);
        for (Integer field : getIgnoredFields(measurement, fileNumber)) {
            remaining.remove(ZONE_PREFIX + field);
        }
        return remaining;
    }

    private static boolean matches(WhitespaceTable table, int rowIndex, String measurement, int fileNumber) {
        return measurement.equals(table.getString(rowIndex, WhitespaceTable.MEASUREMENT_COLUMN)) &&
               table.getInt(rowIndex, FILE_NUMBER_COLUMN) == fileNumber;
    }
}
