package org.hydresgeo.hprocessing.hydresgeo.soilmoisture;

/**
 * One TDR soil moisture sensor buried in a field of the experiment.
 */
public final class SoilMoistureSensor {

    private final int number;
    private final String field;
    private final double depth;

    public SoilMoistureSensor(int number, String field, double depth) {
        this.number = number;
        this.field = field;
        this.depth = depth;
    }

    public int getNumber() {
        return number;
    }

    /**
     * @return the field label, {@code A1} to {@code D2}
     */
    public String getField() {
        return field;
    }

    /**
     * @return the depth in centimeters
     */
    public double getDepth() {
        return depth;
    }

    /**
     * @return e.g. {@code SM_36554_A1_2.5}
     */
    public String getName() {
        return "SM_" + number + "_" + field + "_" + depth;
    }

    /**
     * @return the id of the sensor in the soil moisture data file, e.g. {@code T36554}
     */
    public String getSensorId() {
        return "T" + number;
    }

    @Override
    public String toString() {
        return getName();
    }
}
