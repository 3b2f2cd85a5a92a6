package org.hydresgeo.hprocessing.core.datamodel;

import java.util.Objects;

/**
 * Number of grid rows and columns a zone is partitioned into.
 * A value of 0 means one cell per pixel along that axis.
 */
public final class GridSpec {

    public static final GridSpec SINGLE_CELL = new GridSpec(1, 1);
    public static final GridSpec FULL_RESOLUTION = new GridSpec(0, 0);

    private final int rows;
    private final int columns;

    public GridSpec(int rows, int columns) {
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("Grid size must not be negative: (" + rows + ", " + columns + ")");
        }
        this.rows = rows;
        this.columns = columns;
    }

    public int getRows() {
        return rows;
    }

    public int getColumns() {
        return columns;
    }

    public boolean isFullResolution() {
        return rows == 0 && columns == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridSpec)) {
            return false;
        }
        GridSpec gridSpec = (GridSpec) o;
        return rows == gridSpec.rows && columns == gridSpec.columns;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, columns);
    }

    @Override
    public String toString() {
        return "(" + rows + ", " + columns + ")";
    }
}
