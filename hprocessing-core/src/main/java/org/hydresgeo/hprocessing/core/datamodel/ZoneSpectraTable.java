package org.hydresgeo.hprocessing.core.datamodel;

import com.google.common.collect.ImmutableList;
import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.LengthMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Spectra of all grid cells of all zones of one capture.
 * Columns are the usable-band wavelengths followed by {@code zone}, {@code grid_row} and {@code grid_col}.
 */
public final class ZoneSpectraTable {

    private final double[] wavelengths;
    private final List<Row> rows;

    private ZoneSpectraTable(double[] wavelengths, List<Row> rows) {
        this.wavelengths = wavelengths;
        this.rows = rows;
    }

    public static Builder builder(double[] wavelengths) {
        return new Builder(wavelengths);
    }

    public double[] getWavelengths() {
        return wavelengths.clone();
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return wavelengths.length + HProcessingConstants.LABEL_COLUMN_NAMES.length;
    }

    public List<String> getColumnNames() {
        final List<String> names = new ArrayList<>(getColumnCount());
        for (double wavelength : wavelengths) {
            names.add(String.valueOf(wavelength));
        }
        names.addAll(Arrays.asList(HProcessingConstants.LABEL_COLUMN_NAMES));
        return names;
    }

    public List<Row> getRows() {
        return rows;
    }

    public Row getRow(int index) {
        return rows.get(index);
    }

    /**
     * One (zone, grid cell) row.
     */
    public static final class Row {

        private final String zone;
        private final GridCell gridCell;
        private final Spectrum spectrum;

        public Row(String zone, GridCell gridCell, Spectrum spectrum) {
            this.zone = zone;
            this.gridCell = gridCell;
            this.spectrum = spectrum;
        }

        public String getZone() {
            return zone;
        }

        public GridCell getGridCell() {
            return gridCell;
        }

        public int getGridRow() {
            return gridCell.getRow();
        }

        public int getGridColumn() {
            return gridCell.getColumn();
        }

        public Spectrum getSpectrum() {
            return spectrum;
        }

        public double[] getValues() {
            return spectrum.getValues();
        }
    }

    public static final class Builder {

        private final double[] wavelengths;
        private final ImmutableList.Builder<Row> rows = ImmutableList.builder();

        private Builder(double[] wavelengths) {
            this.wavelengths = wavelengths.clone();
        }

        public Builder addRow(String zone, GridCell gridCell, Spectrum spectrum) {
            if (!Arrays.equals(wavelengths, spectrum.getWavelengths())) {
                throw new LengthMismatchException("Spectrum of zone '" + zone + "' has " + spectrum.getBandCount() +
                                                  " bands which do not match the " + wavelengths.length +
                                                  " table wavelengths");
            }
            rows.add(new Row(zone, gridCell, spectrum));
            return this;
        }

        public Builder addRows(ZoneSpectraTable table) {
            for (Row row : table.getRows()) {
                addRow(row.getZone(), row.getGridCell(), row.getSpectrum());
            }
            return this;
        }

        public double[] getWavelengths() {
            return wavelengths.clone();
        }

        public ZoneSpectraTable build() {
            return new ZoneSpectraTable(wavelengths, rows.build());
        }
    }
}
