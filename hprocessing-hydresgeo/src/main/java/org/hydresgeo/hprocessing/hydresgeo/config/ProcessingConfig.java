package org.hydresgeo.hprocessing.hydresgeo.config;

import com.google.common.primitives.Ints;
import org.hydresgeo.hprocessing.core.datamodel.GridSpec;
import org.hydresgeo.hprocessing.hydresgeo.dataio.envi.EnviAcquisitionTime;
import org.json.simple.JSONObject;
import org.json.simple.JSONValue;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * Configuration of a dataset processing run, read from a JSON file:
 * <pre>
 * {
 *   "paths": {
 *     "data_hyp": "hyp/", "data_lwir": "lwir/", "data_sm": "soilmoisture.csv", "data_output": "out.csv",
 *     "positions_hyp": "positions_hyp.txt", "positions_lwir": "positions_lwir.txt",
 *     "ignore_hyp_measurements": "...", "ignore_hyp_fields": "...", "ignore_hyp_datapoints": "...",
 *     "masks_hyp": "masks.txt"
 *   },
 *   "process": {
 *     "grid_rows": 1, "grid_columns": 1, "hyp_image_rows": 50, "hyp_image_columns": 50,
 *     "overwrite_csv_file": false, "time_window_width": 6, "timezone_offset": "+02:00"
 *   }
 * }
 * </pre>
 * All paths except {@code data_output} are relative to the data directory. The ignore tables and the masks
 * table are optional.
 */
public class ProcessingConfig {

    static final String PATHS = "paths";
    static final String PROCESS = "process";

    public static final int DEFAULT_IMAGE_ROWS = 50;
    public static final int DEFAULT_IMAGE_COLUMNS = 50;
    public static final int DEFAULT_TIME_WINDOW_WIDTH = 6;

    private Path hypDataDirectory;
    private Path lwirDataDirectory;
    private Path soilMoistureFile;
    private Path outputFile;

    private PositionsTable hypPositions;
    private PositionsTable lwirPositions;
    private IgnoreRules ignoreRules;
    private WhitespaceTable masks;

    private GridSpec grid = GridSpec.SINGLE_CELL;
    private int imageRows = DEFAULT_IMAGE_ROWS;
    private int imageColumns = DEFAULT_IMAGE_COLUMNS;
    private boolean overwriteCsvFile;
    private int timeWindowWidth = DEFAULT_TIME_WINDOW_WIDTH;
    private ZoneOffset timezoneOffset = EnviAcquisitionTime.DEFAULT_ZONE_OFFSET;

    private ProcessingConfig() {
    }

    public static ProcessingConfig read(Path configFile, Path dataDirectory) throws IOException {
        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            return read(reader, dataDirectory);
        }
    }

    @SuppressWarnings("unchecked")
    public static ProcessingConfig read(Reader reader, Path dataDirectory) throws IOException {
        final Object parsed = JSONValue.parse(reader);
        if (!(parsed instanceof JSONObject)) {
            throw new IOException("Configuration is not a JSON object");
        }
        final Map<String, Object> root = (JSONObject) parsed;
        final Map<String, Object> paths = getSection(root, PATHS);
        final Map<String, Object> process = root.containsKey(PROCESS) ? getSection(root, PROCESS) : new JSONObject();

        ProcessingConfig config = new ProcessingConfig();
        config.hypDataDirectory = dataDirectory.resolve(getRequiredString(paths, "data_hyp"));
        config.lwirDataDirectory = dataDirectory.resolve(getRequiredString(paths, "data_lwir"));
        config.soilMoistureFile = dataDirectory.resolve(getRequiredString(paths, "data_sm"));
        config.outputFile = Path.of(getRequiredString(paths, "data_output"));

        config.hypPositions = new PositionsTable(readTable(paths, "positions_hyp", dataDirectory, true));
        config.lwirPositions = new PositionsTable(readTable(paths, "positions_lwir", dataDirectory, true));
        config.ignoreRules = new IgnoreRules(readTable(paths, "ignore_hyp_measurements", dataDirectory, false),
                                             readTable(paths, "ignore_hyp_datapoints", dataDirectory, false),
                                             readTable(paths, "ignore_hyp_fields", dataDirectory, false));
        config.masks = readTable(paths, "masks_hyp", dataDirectory, false);

        final Integer gridRows = getNonNegativeInt(process, "grid_rows");
        final Integer gridColumns = getNonNegativeInt(process, "grid_columns");
        if (gridRows != null && gridColumns != null) {
            config.grid = new GridSpec(gridRows, gridColumns);
        }
        final Integer imageRows = getNonNegativeInt(process, "hyp_image_rows");
        final Integer imageColumns = getNonNegativeInt(process, "hyp_image_columns");
        if (imageRows != null && imageColumns != null) {
            config.imageRows = imageRows;
            config.imageColumns = imageColumns;
        }
        config.overwriteCsvFile = getBoolean(process, "overwrite_csv_file");
        final Integer timeWindowWidth = getNonNegativeInt(process, "time_window_width");
        if (timeWindowWidth != null) {
            config.timeWindowWidth = timeWindowWidth;
        }
        final Object timezoneOffset = process.get("timezone_offset");
        if (timezoneOffset != null) {
            try {
                config.timezoneOffset = ZoneOffset.of(timezoneOffset.toString().trim());
            } catch (DateTimeException e) {
                throw new IOException("Invalid timezone_offset '" + timezoneOffset + "'", e);
            }
        }
        return config;
    }

    public Path getHypDataDirectory() {
        return hypDataDirectory;
    }

    public Path getLwirDataDirectory() {
        return lwirDataDirectory;
    }

    public Path getSoilMoistureFile() {
        return soilMoistureFile;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    public PositionsTable getHypPositions() {
        return hypPositions;
    }

    public PositionsTable getLwirPositions() {
        return lwirPositions;
    }

    public IgnoreRules getIgnoreRules() {
        return ignoreRules;
    }

    /**
     * @return the masks table, {@code null} if no masks are configured
     */
    public WhitespaceTable getMasks() {
        return masks;
    }

    public GridSpec getGrid() {
        return grid;
    }

    public int getImageRows() {
        return imageRows;
    }

    public int getImageColumns() {
        return imageColumns;
    }

    public boolean isOverwriteCsvFile() {
        return overwriteCsvFile;
    }

    /**
     * @return the width of the time window in minutes; matches must lie within half of it
     */
    public int getTimeWindowWidth() {
        return timeWindowWidth;
    }

    public ZoneOffset getTimezoneOffset() {
        return timezoneOffset;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getSection(Map<String, Object> root, String name) throws IOException {
        final Object section = root.get(name);
        if (!(section instanceof JSONObject)) {
            throw new IOException("Configuration has no '" + name + "' section");
        }
        return (JSONObject) section;
    }

    private static String getRequiredString(Map<String, Object> section, String key) throws IOException {
        final Object value = section.get(key);
        if (value == null || value.toString().trim().isEmpty()) {
            throw new IOException("Configuration is missing '" + PATHS + "." + key + "'");
        }
        return value.toString().trim();
    }

    private static WhitespaceTable readTable(Map<String, Object> paths, String key, Path dataDirectory,
                                             boolean required) throws IOException {
        final Object value = paths.get(key);
        if (value == null || value.toString().trim().isEmpty()) {
            if (required) {
                throw new IOException("Configuration is missing '" + PATHS + "." + key + "'");
            }
            return null;
        }
        return WhitespaceTable.read(dataDirectory.resolve(value.toString().trim()));
    }

    // numbers and digit-only strings are accepted, anything else counts as not set
    private static Integer getNonNegativeInt(Map<String, Object> section, String key) {
        final Object value = section.get(key);
        if (value instanceof Number) {
            final double number = ((Number) value).doubleValue();
            return number >= 0 && number <= Integer.MAX_VALUE && number == Math.rint(number) ? (int) number : null;
        }
        if (value instanceof String && !((String) value).isEmpty() && ((String) value).chars().allMatch(Character::isDigit)) {
            // null beyond the int range
            return Ints.tryParse((String) value);
        }
        return null;
    }

    private static boolean getBoolean(Map<String, Object> section, String key) {
        final Object value = section.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && Boolean.parseBoolean(value.toString().trim());
    }
}
