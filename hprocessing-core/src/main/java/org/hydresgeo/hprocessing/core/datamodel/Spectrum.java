package org.hydresgeo.hprocessing.core.datamodel;

import org.hydresgeo.hprocessing.core.LengthMismatchException;

import java.util.Arrays;

/**
 * One value per usable band, labelled with the band wavelengths.
 */
public final class Spectrum {

    private final double[] wavelengths;
    private final double[] values;

    public Spectrum(double[] wavelengths, double[] values) {
        if (wavelengths.length != values.length) {
            throw new LengthMismatchException("Length of wavelengths (" + wavelengths.length +
                                              ") and values (" + values.length + ") is not equal.");
        }
        this.wavelengths = wavelengths.clone();
        this.values = values.clone();
    }

    public int getBandCount() {
        return values.length;
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public double getWavelength(int index) {
        return wavelengths[index];
    }

    public double getValue(int index) {
        return values[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Spectrum)) {
            return false;
        }
        Spectrum spectrum = (Spectrum) o;
        return Arrays.equals(wavelengths, spectrum.wavelengths) && Arrays.equals(values, spectrum.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(wavelengths) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Spectrum" + Arrays.toString(values);
    }
}
