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

package org.hydresgeo.hprocessing.core.operators;

import com.google.common.primitives.Doubles;
import org.apache.commons.lang3.ArrayUtils;
import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.LengthMismatchException;
import org.hydresgeo.hprocessing.core.datamodel.Spectrum;

import java.util.List;
import java.util.logging.Logger;

/**
 * Aligns band wavelengths with the bad band list (bbl) and removes the bands not flagged as good.
 * <p>
 * The same flags are applied to the wavelengths once at construction and to every raw spectrum passed to
 * {@link #filter(double[])}, so wavelength and value positions always stay synchronised.
 */
public class BandFilter {

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);

    private final double[] wavelengths;
    private final int[] flags;
    private final double[] usableWavelengths;

    public BandFilter(double[] wavelengths, int[] flags) {
        if (wavelengths.length != flags.length) {
            throw new LengthMismatchException("Length of wavelengths (" + wavelengths.length + ") and bbl (" +
                                              flags.length + ") is not equal.");
        }
        if (wavelengths.length == HProcessingConstants.SENTINEL_BAND_COUNT) {
            // first entry is a sentinel zero wavelength without image band
            this.wavelengths = ArrayUtils.remove(wavelengths, 0);
            this.flags = ArrayUtils.remove(flags, 0);
        } else {
            this.wavelengths = wavelengths.clone();
            this.flags = flags.clone();
        }
        this.usableWavelengths = removeBadBands(this.wavelengths, this.flags);
        LOGGER.fine("Using " + usableWavelengths.length + " of " + this.wavelengths.length + " bands");
    }

    public static BandFilter create(List<String> wavelengths, List<String> flags) {
        return new BandFilter(parseWavelengths(wavelengths), parseFlags(flags));
    }

    /**
     * Keeps the values whose flag equals {@link HProcessingConstants#GOOD_BAND_FLAG}, preserving their order.
     */
    public static double[] removeBadBands(double[] values, int[] flags) {
        if (values.length != flags.length) {
            throw new LengthMismatchException("Length of values (" + values.length + ") and bbl (" +
                                              flags.length + ") is not equal.");
        }
        int usableCount = 0;
        for (int flag : flags) {
            if (flag == HProcessingConstants.GOOD_BAND_FLAG) {
                usableCount++;
            }
        }
        final double[] usable = new double[usableCount];
        int index = 0;
        for (int i = 0; i < values.length; i++) {
            if (flags[i] == HProcessingConstants.GOOD_BAND_FLAG) {
                usable[index++] = values[i];
            }
        }
        return usable;
    }

    public static double[] parseWavelengths(List<String> wavelengths) {
        final double[] values = new double[wavelengths.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = parseNumber(wavelengths.get(i), "wavelength");
        }
        return values;
    }

    /**
     * Coerces bbl entries such as "1", "0" or "1.0" to integer flags.
     *
     * @throws IllegalArgumentException if an entry is not numeric or not integral, e.g. "0.9"
     */
    public static int[] parseFlags(List<String> flags) {
        final int[] values = new int[flags.size()];
        for (int i = 0; i < values.length; i++) {
            final double value = parseNumber(flags.get(i), "bbl");
            if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Invalid bbl entry '" + flags.get(i) + "', not an integer");
            }
            values[i] = (int) value;
        }
        return values;
    }

    /**
     * Removes the bad bands from a raw spectrum holding one value per validated band.
     */
    public Spectrum filter(double[] rawSpectrum) {
        if (rawSpectrum.length != wavelengths.length) {
            throw new LengthMismatchException("Length of spectrum (" + rawSpectrum.length + ") and wavelengths (" +
                                              wavelengths.length + ") is not equal.");
        }
        return new Spectrum(usableWavelengths, removeBadBands(rawSpectrum, flags));
    }

    /**
     * @return number of bands after the sentinel correction, before bad band removal
     */
    public int getBandCount() {
        return wavelengths.length;
    }

    public int getUsableBandCount() {
        return usableWavelengths.length;
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    public int[] getFlags() {
        return flags.clone();
    }

    public double[] getUsableWavelengths() {
        return usableWavelengths.clone();
    }

    private static double parseNumber(String text, String name) {
        final Double value = text == null ? null : Doubles.tryParse(text.trim());
        if (value == null) {
            throw new IllegalArgumentException("Invalid " + name + " entry '" + text + "'");
        }
        return value;
    }
}
