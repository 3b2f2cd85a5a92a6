package org.hydresgeo.hprocessing.hydresgeo.lwir;

import org.hydresgeo.hprocessing.core.HProcessingConstants;
import org.hydresgeo.hprocessing.hydresgeo.soilmoisture.NearestDate;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Locates the LWIR camera export matching a capture. Export files are named
 * {@code ir_export_<yyyyMMdd>_<x>_<y>_<HH-mm-ss>.csv}, with the local time of the given offset.
 */
public class LwirExportFiles {

    public static final String FILE_PREFIX = "ir_export_";
    public static final String FILE_EXTENSION = ".csv";

    private static final Logger LOGGER = Logger.getLogger(HProcessingConstants.LOGGER_NAME);
    private static final DateTimeFormatter FILE_DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd HH-mm-ss");

    private LwirExportFiles() {
    }

    /**
     * @return the acquisition time encoded in the file name, {@code null} if the name does not follow the
     * export naming
     */
    public static Instant parseTimestamp(String fileName, ZoneOffset zoneOffset) {
        if (!fileName.startsWith(FILE_PREFIX) || !fileName.endsWith(FILE_EXTENSION)) {
            return null;
        }
        final String[] parts = fileName.split("_");
        if (parts.length < 6) {
            return null;
        }
        final String time = parts[5].substring(0, parts[5].length() - FILE_EXTENSION.length());
        try {
            return LocalDateTime.parse(parts[2] + " " + time, FILE_DATE_TIME_FORMATTER)
                    .toInstant(zoneOffset);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * @return all export files of the directory with their acquisition times, ordered by file name
     */
    public static Map<Path, Instant> list(Path directory, ZoneOffset zoneOffset) throws IOException {
        Map<Path, Instant> files = new TreeMap<>();
        if (!Files.isDirectory(directory)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, FILE_PREFIX + "*" + FILE_EXTENSION)) {
            for (Path file : stream) {
                final Instant timestamp = parseTimestamp(file.getFileName().toString(), zoneOffset);
                if (timestamp != null) {
                    files.put(file, timestamp);
                }
            }
        }
        return files;
    }

    /**
     * Finds the export nearest to the capture time.
     *
     * @return the export file, or {@code null} if there is none within half the time window
     */
    public static Path findNearest(Path directory, Instant captureTime, int timeWindowWidth,
                                   ZoneOffset zoneOffset) throws IOException {
        final Map<Path, Instant> files = list(directory, zoneOffset);
        if (files.isEmpty()) {
            LOGGER.warning("Did not find LWIR data in " + directory);
            return null;
        }
        final List<Path> paths = new ArrayList<>(files.keySet());
        final List<Instant> timestamps = new ArrayList<>(files.values());
        final NearestDate nearestDate = NearestDate.find(timestamps, captureTime);
        if (!nearestDate.isWithinWindow(timeWindowWidth)) {
            LOGGER.warning("Did not find LWIR data within " + timeWindowWidth + " minutes of " + captureTime);
            return null;
        }
        return paths.get(timestamps.indexOf(nearestDate.getDate()));
    }
}
