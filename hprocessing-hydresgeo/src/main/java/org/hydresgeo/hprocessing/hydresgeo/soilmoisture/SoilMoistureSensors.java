package org.hydresgeo.hprocessing.hydresgeo.soilmoisture;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The soil moisture sensors of the HydReSGeo experiment and the mapping of their fields to image zones.
 */
public class SoilMoistureSensors {

    private static final int[] NUMBERS = {
            36554, 36555, 36556, 36547, 36557, 36558,
            36559, 36553, 36549, 36550, 36551, 36552,
            36560, 36562, 36563, 36564, 36565, 36561
    };
    private static final String[] FIELDS = {
            "A1", "A1", "A1", "A2", "B1", "B1", "B1", "B2", "C1",
            "C1", "C1", "C1", "C2", "D1", "D1", "D1", "D1", "D2"
    };
    private static final double[] DEPTHS = {
            2.5, 5.0, 10.0, 5.0, 2.5, 5.0, 10.0, 5.0, 2.5,
            5.0, 10.0, 20.0, 5.0, 2.5, 5.0, 10.0, 20.0, 5.0
    };

    private static final Map<String, String> FIELD_TO_ZONE = ImmutableMap.<String, String>builder()
            .put("A1", "zone1")
            .put("A2", "zone2")
            .put("B1", "zone3")
            .put("B2", "zone4")
            .put("C1", "zone5")
            .put("C2", "zone6")
            .put("D1", "zone7")
            .put("D2", "zone8")
            .build();

    private static final List<SoilMoistureSensor> ALL_SENSORS = createAllSensors();

    private SoilMoistureSensors() {
    }

    public static List<SoilMoistureSensor> getAllSensors() {
        return ALL_SENSORS;
    }

    /**
     * @return the shallowest sensor of every field, ordered by field label
     */
    public static List<SoilMoistureSensor> getUppermostSensors() {
        Map<String, SoilMoistureSensor> uppermost = new TreeMap<>();
        for (SoilMoistureSensor sensor : ALL_SENSORS) {
            final SoilMoistureSensor current = uppermost.get(sensor.getField());
            if (current == null || sensor.getDepth() < current.getDepth()) {
                uppermost.put(sensor.getField(), sensor);
            }
        }
        return ImmutableList.copyOf(uppermost.values());
    }

    /**
     * @return the image zone of a field, {@code B1} gives {@code zone3}; {@code null} for unknown fields
     */
    public static String getZoneName(String field) {
        return FIELD_TO_ZONE.get(field);
    }

    public static Map<String, String> getFieldToZoneMap() {
        return FIELD_TO_ZONE;
    }

    /**
     * @return the uppermost sensors keyed by their zone, restricted to the given zones
     */
    public static Map<String, SoilMoistureSensor> getUppermostSensorsByZone(List<String> zones) {
        Map<String, SoilMoistureSensor> sensors = new LinkedHashMap<>();
        for (SoilMoistureSensor sensor : getUppermostSensors()) {
            final String zone = getZoneName(sensor.getField());
            if (zones.contains(zone)) {
                sensors.put(zone, sensor);
            }
        }
        return sensors;
    }

    private static List<SoilMoistureSensor> createAllSensors() {
        List<SoilMoistureSensor> sensors = new ArrayList<>(NUMBERS.length);
        for (int i = 0; i < NUMBERS.length; i++) {
            sensors.add(new SoilMoistureSensor(NUMBERS[i], FIELDS[i], DEPTHS[i]));
        }
        return ImmutableList.copyOf(sensors);
    }
}
