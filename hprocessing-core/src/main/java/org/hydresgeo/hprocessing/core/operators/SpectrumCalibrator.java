package org.hydresgeo.hprocessing.core.operators;

import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.LengthMismatchException;
import org.hydresgeo.hprocessing.core.datamodel.Spectrum;
import org.hydresgeo.hprocessing.core.datamodel.ZoneSpectraTable;

/**
 * Converts raw spectra into reflectance using the spectrum of the white reference (spectralon).
 * <p>
 * Each band is divided by the reference band and scaled with the reflectance factor of the reference
 * material. A zero reference band yields an infinite or NaN reflectance.
 */
public class SpectrumCalibrator {

    private SpectrumCalibrator() {
    }

    public static Spectrum calibrate(Spectrum soil, Spectrum reference) {
        return calibrate(soil, reference, HProcessingConstants.DEFAULT_REFLECTANCE_FACTOR);
    }

    /**
     * @param soil              the raw spectrum to calibrate
     * @param reference         the raw spectrum of the reference, same bands in the same order
     * @param reflectanceFactor fraction of the incident radiation reflected by the reference
     */
    public static Spectrum calibrate(Spectrum soil, Spectrum reference, double reflectanceFactor) {
        if (soil.getBandCount() != reference.getBandCount()) {
            throw new LengthMismatchException("Spectrum (" + soil.getBandCount() + " bands) and reference (" +
                                              reference.getBandCount() + " bands) do not match.");
        }
        final double[] values = new double[soil.getBandCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = (soil.getValue(i) / reference.getValue(i)) * reflectanceFactor;
        }
        return new Spectrum(soil.getWavelengths(), values);
    }

    /**
     * Calibrates every row of the table against the same reference.
     */
    public static ZoneSpectraTable calibrate(ZoneSpectraTable table, Spectrum reference, double reflectanceFactor) {
        ZoneSpectraTable.Builder builder = ZoneSpectraTable.builder(table.getWavelengths());
        for (ZoneSpectraTable.Row row : table.getRows()) {
            builder.addRow(row.getZone(), row.getGridCell(),
                           calibrate(row.getSpectrum(), reference, reflectanceFactor));
        }
        return builder.build();
    }
}
