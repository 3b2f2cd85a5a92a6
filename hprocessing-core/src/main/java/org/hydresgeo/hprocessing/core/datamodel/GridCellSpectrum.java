package org.hydresgeo.hprocessing.core.datamodel;

/**
 * A spectrum tagged with the label of the grid cell it was aggregated from.
 */
public final class GridCellSpectrum {

    private final GridCell gridCell;
    private final Spectrum spectrum;

    public GridCellSpectrum(GridCell gridCell, Spectrum spectrum) {
        this.gridCell = gridCell;
        this.spectrum = spectrum;
    }

    public GridCell getGridCell() {
        return gridCell;
    }

    public Spectrum getSpectrum() {
        return spectrum;
    }
}
