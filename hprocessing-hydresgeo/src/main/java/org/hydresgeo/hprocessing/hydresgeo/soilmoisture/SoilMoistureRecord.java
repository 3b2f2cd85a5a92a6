package org.hydresgeo.hprocessing.hydresgeo.soilmoisture;

import java.time.Instant;

/**
 * One row of the soil moisture data file.
 */
public final class SoilMoistureRecord {

    private final String sensorId;
    private final Instant timestamp;
    private final double volumetricSoilMoisture;
    private final double temperature;

    public SoilMoistureRecord(String sensorId, Instant timestamp, double volumetricSoilMoisture, double temperature) {
        this.sensorId = sensorId;
        this.timestamp = timestamp;
        this.volumetricSoilMoisture = volumetricSoilMoisture;
        this.temperature = temperature;
    }

    public String getSensorId() {
        return sensorId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * @return volumetric soil moisture in vol%
     */
    public double getVolumetricSoilMoisture() {
        return volumetricSoilMoisture;
    }

    /**
     * @return soil temperature in degrees Celsius
     */
    public double getTemperature() {
        return temperature;
    }

    @Override
    public String toString() {
        return sensorId + "@" + timestamp + ": " + volumetricSoilMoisture + " vol%, " + temperature + " C";
    }
}
