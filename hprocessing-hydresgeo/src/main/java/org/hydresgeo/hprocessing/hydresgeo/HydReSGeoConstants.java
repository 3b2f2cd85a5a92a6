package org.hydresgeo.hprocessing.hydresgeo;

import java.util.ArrayList;
import java.util.List;

/**
 * Constants of the HydReSGeo dataset layout and output table.
 */
public class HydReSGeoConstants {

    public static final String ZONE_PREFIX = "zone";
    public static final int ZONE_COUNT = 8;

    public static final String MEASUREMENT_DIRECTORY_SUFFIX = "_hyp";
    public static final String HIGHRES_HEADER_SUFFIX = "_highres.hdr";

    // capture files are named AutoNNN.hdr
    public static final int FILE_NUMBER_START = 4;
    public static final int FILE_NUMBER_END = 7;

    // band summed up to detect empty captures
    public static final int EMPTY_CHECK_BAND = 5;

    public static final String INDEX_COLUMN_NAME = "";
    public static final String DATETIME_COLUMN_NAME = "datetime";
    public static final String SOIL_MOISTURE_COLUMN_NAME = "volSM_vol%";
    public static final String SOIL_TEMPERATURE_COLUMN_NAME = "T_C";
    public static final String LWIR_MEAN_COLUMN_NAME = "lwir_mean";
    public static final String LWIR_MEDIAN_COLUMN_NAME = "lwir_med";
    public static final String LWIR_STD_COLUMN_NAME = "lwir_std";

    private HydReSGeoConstants() {
    }

    /**
     * @return {@code zone1} to {@code zone8}
     */
    public static List<String> getDefaultZones() {
        List<String> zones = new ArrayList<>(ZONE_COUNT);
        for (int i = 1; i <= ZONE_COUNT; i++) {
            zones.add(ZONE_PREFIX + i);
        }
        return zones;
    }
}
