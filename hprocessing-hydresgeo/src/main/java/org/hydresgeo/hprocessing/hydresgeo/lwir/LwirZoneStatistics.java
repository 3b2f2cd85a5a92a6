package org.hydresgeo.hprocessing.hydresgeo.lwir;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.core.UnresolvableZoneException;
import org.hydresgeo.hprocessing.hydresgeo.config.PositionsTable;

import java.awt.Rectangle;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Mean, median and population standard deviation of the LWIR temperatures inside one zone.
 */
public final class LwirZoneStatistics {

    public static final LwirZoneStatistics UNAVAILABLE = new LwirZoneStatistics(Double.NaN, Double.NaN, Double.NaN);

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);

    private final double mean;
    private final double median;
    private final double standardDeviation;

    public LwirZoneStatistics(double mean, double median, double standardDeviation) {
        this.mean = mean;
        this.median = median;
        this.standardDeviation = standardDeviation;
    }

    /**
     * Computes the statistics over the part of the rectangle that lies inside the matrix.
     */
    public static LwirZoneStatistics compute(double[][] data, Rectangle rectangle) {
        final int rowStart = Math.max(rectangle.y, 0);
        final int rowEnd = Math.min(rectangle.y + rectangle.height, data.length);
        final double[] values = new double[Math.max(rectangle.width * rectangle.height, 0)];
        int count = 0;
        for (int row = rowStart; row < rowEnd; row++) {
            final int colStart = Math.max(rectangle.x, 0);
            final int colEnd = Math.min(rectangle.x + rectangle.width, data[row].length);
            for (int col = colStart; col < colEnd; col++) {
                values[count++] = data[row][col];
            }
        }
        if (count == 0) {
            return UNAVAILABLE;
        }
        return new LwirZoneStatistics(new Mean().evaluate(values, 0, count),
                                      new Median().evaluate(values, 0, count),
                                      new StandardDeviation(false).evaluate(values, 0, count));
    }

    /**
     * Computes the statistics of all zones from the LWIR export nearest to the capture. Zones get
     * {@link #UNAVAILABLE} statistics if there is no export within half the time window, or if the LWIR
     * positions have no row for the capture date or no rectangle for the zone.
     *
     * @param captureDate the capture date as {@code yyyyMMdd}, identifying the LWIR positions row
     * @return statistics keyed by zone name, in zone order
     */
    public static Map<String, LwirZoneStatistics> computeForZones(Path lwirDirectory, PositionsTable lwirPositions,
                                                                  List<String> zones, Instant captureTime,
                                                                  String captureDate, int timeWindowWidth,
                                                                  ZoneOffset zoneOffset) throws IOException {
        Map<String, LwirZoneStatistics> statistics = new LinkedHashMap<>();
        for (String zone : zones) {
            statistics.put(zone, UNAVAILABLE);
        }
        final Path exportFile = LwirExportFiles.findNearest(lwirDirectory, captureTime, timeWindowWidth, zoneOffset);
        if (exportFile == null) {
            return statistics;
        }
        final int rowIndex = lwirPositions.getMeasurementIndex(captureDate);
        if (rowIndex < 0) {
            LOGGER.warning("LWIR positions have no row for " + captureDate);
            return statistics;
        }

        final double[][] data = LwirExportReader.read(exportFile);
        for (String zone : zones) {
            try {
                statistics.put(zone, compute(data, lwirPositions.getRectangle(rowIndex, zone)));
            } catch (UnresolvableZoneException e) {
                LOGGER.warning("No LWIR statistics for " + zone + ": " + e.getMessage());
            }
        }
        return statistics;
    }

    public double getMean() {
        return mean;
    }

    public double getMedian() {
        return median;
    }

    public double getStandardDeviation() {
        return standardDeviation;
    }

    public boolean isAvailable() {
        return !Double.isNaN(mean);
    }

    @Override
    public String toString() {
        return "LwirZoneStatistics{mean=" + mean + ", median=" + median + ", std=" + standardDeviation + "}";
    }
}
