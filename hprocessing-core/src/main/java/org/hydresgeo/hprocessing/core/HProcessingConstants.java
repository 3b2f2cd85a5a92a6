package org.hydresgeo.hprocessing.core;

/**
 * HProcessing constants
 */
public class HProcessingConstants {

    public static final String LOGGER_NAME = "hprocessing";

    /**
     * Name of the rectangle holding the white reference (spectralon).
     */
    public static final String REFERENCE_ZONE_NAME = "spec";

    public static final double DEFAULT_REFLECTANCE_FACTOR = 0.95;

    public static final AggregationMode REFERENCE_AGGREGATION_MODE = AggregationMode.MAX10;
    public static final AggregationMode ZONE_AGGREGATION_MODE = AggregationMode.MEDIAN;

    public static final int MAX10_PIXEL_COUNT = 10;

    public static final int GOOD_BAND_FLAG = 1;
    public static final int MASK_EXCLUDED_VALUE = 1;
    public static final int MASK_INCLUDED_VALUE = 0;

    // headers with this many wavelengths start with a sentinel zero wavelength
    public static final int SENTINEL_BAND_COUNT = 139;

    public static final String ZONE_COLUMN_NAME = "zone";
    public static final String GRID_ROW_COLUMN_NAME = "grid_row";
    public static final String GRID_COLUMN_COLUMN_NAME = "grid_col";

    public static final String[] LABEL_COLUMN_NAMES = {
            ZONE_COLUMN_NAME,
            GRID_ROW_COLUMN_NAME,
            GRID_COLUMN_COLUMN_NAME
    };

    private HProcessingConstants() {
    }
}
