package org.hydresgeo.hprocessing.hydresgeo;

import org.hydresgeo.hprocessing.core.datamodel.ZoneSpectraTable;
import org.hydresgeo.hprocessing.hydresgeo.lwir.LwirZoneStatistics;
import org.hydresgeo.hprocessing.hydresgeo.soilmoisture.SoilMoistureRecord;

import java.time.OffsetDateTime;

/**
 * One output row: the reflectance spectrum of a zone grid cell joined with the capture time and the
 * soil moisture and LWIR data of the zone.
 */
public final class DatasetRow {

    private final ZoneSpectraTable.Row spectraRow;
    private final OffsetDateTime dateTime;
    private final SoilMoistureRecord soilMoisture;
    private final LwirZoneStatistics lwirStatistics;

    /**
     * @param soilMoisture   the matched soil moisture record, {@code null} if none was found
     * @param lwirStatistics the LWIR statistics, {@link LwirZoneStatistics#UNAVAILABLE} if none were found
     */
    public DatasetRow(ZoneSpectraTable.Row spectraRow, OffsetDateTime dateTime, SoilMoistureRecord soilMoisture,
                      LwirZoneStatistics lwirStatistics) {
        this.spectraRow = spectraRow;
        this.dateTime = dateTime;
        this.soilMoisture = soilMoisture;
        this.lwirStatistics = lwirStatistics;
    }

    public ZoneSpectraTable.Row getSpectraRow() {
        return spectraRow;
    }

    public String getZone() {
        return spectraRow.getZone();
    }

    public OffsetDateTime getDateTime() {
        return dateTime;
    }

    public SoilMoistureRecord getSoilMoisture() {
        return soilMoisture;
    }

    public LwirZoneStatistics getLwirStatistics() {
        return lwirStatistics;
    }
}
