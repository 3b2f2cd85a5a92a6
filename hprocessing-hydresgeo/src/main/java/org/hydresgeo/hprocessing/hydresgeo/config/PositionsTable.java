package org.hydresgeo.hprocessing.hydresgeo.config;

import org.hydresgeo.hprocessing.core.DegenerateGeometryException;
import org.hydresgeo.hprocessing.core.UnresolvableZoneException;
import org.hydresgeo.hprocessing.core.datamodel.ZoneResolver;
import org.hydresgeo.hprocessing.core.util.RectangleUtils;

import java.awt.Rectangle;

/**
 * Zone rectangles per measurement. Every zone contributes the four columns
 * {@code <zone>_row_start}, {@code <zone>_row_end}, {@code <zone>_col_start} and {@code <zone>_col_end};
 * rows are identified by the {@code measurement} column.
 */
public class PositionsTable {

    private static final String ROW_START_SUFFIX = "_row_start";
    private static final String ROW_END_SUFFIX = "_row_end";
    private static final String COL_START_SUFFIX = "_col_start";
    private static final String COL_END_SUFFIX = "_col_end";

    private final WhitespaceTable table;

    public PositionsTable(WhitespaceTable table) {
        this.table = table;
    }

    public WhitespaceTable getTable() {
        return table;
    }

    /**
     * @return the row index of the measurement, -1 if the table has no such row
     */
    public int getMeasurementIndex(String measurement) {
        return table.findMeasurementRow(measurement);
    }

    public boolean hasZone(String zoneName) {
        return table.hasColumn(zoneName + ROW_START_SUFFIX) && table.hasColumn(zoneName + ROW_END_SUFFIX) &&
               table.hasColumn(zoneName + COL_START_SUFFIX) && table.hasColumn(zoneName + COL_END_SUFFIX);
    }

    /**
     * @throws UnresolvableZoneException if the zone columns are missing or hold no valid rectangle
     */
    public Rectangle getRectangle(int rowIndex, String zoneName) {
        if (!hasZone(zoneName)) {
            throw new UnresolvableZoneException(zoneName, "Positions table has no columns for zone '" + zoneName + "'");
        }
        try {
            return RectangleUtils.createRectangle(table.getInt(rowIndex, zoneName + ROW_START_SUFFIX),
                                                  table.getInt(rowIndex, zoneName + ROW_END_SUFFIX),
                                                  table.getInt(rowIndex, zoneName + COL_START_SUFFIX),
                                                  table.getInt(rowIndex, zoneName + COL_END_SUFFIX));
        } catch (NumberFormatException | DegenerateGeometryException e) {
            throw new UnresolvableZoneException(zoneName, "Invalid position of zone '" + zoneName + "' in row " +
                                                          rowIndex + ": " + e.getMessage());
        }
    }

    /**
     * Creates a resolver for the zones of one measurement. A missing measurement fails on the first lookup.
     */
    public ZoneResolver createZoneResolver(String measurement) {
        final int rowIndex = getMeasurementIndex(measurement);
        return zoneName -> {
            if (rowIndex < 0) {
                throw new UnresolvableZoneException(zoneName, "Positions table has no row for measurement '" +
                                                              measurement + "'");
            }
            return getRectangle(rowIndex, zoneName);
        };
    }
}
