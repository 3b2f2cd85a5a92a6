package org.hydresgeo.hprocessing.core;

import java.util.Locale;

/**
 * Enumeration of the statistics used to reduce the pixels of a region to one value per band
 */
public enum AggregationMode {
    MEDIAN,
    MEAN,
    MAX,
    /**
     * Mean of the ten largest values.
     */
    MAX10;

    public static AggregationMode fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Aggregation mode must not be null");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation mode '" + name +
                                               "', expected one of median, mean, max, max10", e);
        }
    }
}
