package org.hydresgeo.hprocessing.core.datamodel;

import java.util.Objects;

/**
 * Row/column label of one grid cell.
 */
public final class GridCell {

    private final int row;
    private final int column;

    public GridCell(int row, int column) {
        this.row = row;
        this.column = column;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GridCell)) {
            return false;
        }
        GridCell gridCell = (GridCell) o;
        return row == gridCell.row && column == gridCell.column;
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
