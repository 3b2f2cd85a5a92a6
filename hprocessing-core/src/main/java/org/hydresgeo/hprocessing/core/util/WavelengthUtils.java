package org.hydresgeo.hprocessing.core.util;

import com.google.common.primitives.Doubles;

/**
 * Wavelength label helpers.
 */
public class WavelengthUtils {

    private static final double MICROMETER_LIMIT = 5.0;
    private static final int NANOMETER_LIMIT = 200;

    private WavelengthUtils() {
    }

    /**
     * Converts a wavelength given in nanometers or micrometers into an integer nanometer label.
     * Values below 5 are taken as micrometers, values above 200 as nanometers.
     *
     * @param wavelength the wavelength as text
     * @return the wavelength in nanometers, e.g. "2500" for "2.5"
     * @throws IllegalArgumentException if the value is not numeric or lies between 5 and 200
     */
    public static String convertWavelength(String wavelength) {
        final Double value = wavelength == null ? null : Doubles.tryParse(wavelength.trim());
        if (value == null) {
            throw new IllegalArgumentException("Could not convert wavelength '" + wavelength + "'");
        }
        return convertWavelength(value);
    }

    public static String convertWavelength(double wavelength) {
        if (wavelength < MICROMETER_LIMIT) {
            return String.valueOf((int) (wavelength * 1000));
        }
        if ((int) wavelength > NANOMETER_LIMIT) {
            return String.valueOf((int) wavelength);
        }
        throw new IllegalArgumentException("Could not convert wavelength " + wavelength);
    }
}
