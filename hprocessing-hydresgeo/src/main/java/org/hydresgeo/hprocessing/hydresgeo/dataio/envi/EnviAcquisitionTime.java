package org.hydresgeo.hprocessing.hydresgeo.dataio.envi;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Acquisition date and time of a capture, as written by the camera into the ENVI header description:
 * <pre>
 * Date: 05/17/2017,
 * Time: 6:02:24.34 P,
 * </pre>
 * The clock is a 12 hour clock, {@code P} marks afternoon times.
 */
public class EnviAcquisitionTime {

    public static final ZoneOffset DEFAULT_ZONE_OFFSET = ZoneOffset.of("+02:00");

    private static final Pattern DATE_PATTERN = Pattern.compile("Date:\\s*(\\d{2})/(\\d{2})/(\\d{4})");
    private static final Pattern TIME_PATTERN =
            Pattern.compile("Time:\\s*(\\d{1,2}:\\d{2}:\\d{2})(?:\\.\\d*)?\\s*([AP]\\w*)");
    private static final DateTimeFormatter DATE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd H:mm:ss");

    private final String date;
    private final String time;

    EnviAcquisitionTime(String date, String time) {
        this.date = date;
        this.time = time;
    }

    public static EnviAcquisitionTime fromHeader(EnviHeader header) throws IOException {
        final String description = header.getDescription();
        if (description == null) {
            throw new IOException("ENVI header has no description holding the acquisition time");
        }
        return parse(description);
    }

    /**
     * Parses the first two lines of the header description.
     */
    public static EnviAcquisitionTime parse(String description) throws IOException {
        final String[] lines = description.trim().split("\n");
        if (lines.length < 2) {
            throw new IOException("Description does not contain date and time lines: " + description);
        }
        final Matcher dateMatcher = DATE_PATTERN.matcher(lines[0].trim());
        if (!dateMatcher.find()) {
            throw new IOException("Unexpected date line in description: " + lines[0]);
        }
        final Matcher timeMatcher = TIME_PATTERN.matcher(lines[1].trim());
        if (!timeMatcher.find()) {
            throw new IOException("Unexpected time line in description: " + lines[1]);
        }
        final String date = dateMatcher.group(3) + dateMatcher.group(1) + dateMatcher.group(2);
        return new EnviAcquisitionTime(date, formatTime(timeMatcher.group(1), timeMatcher.group(2)));
    }

    /**
     * Converts a 12 hour clock time to 24 hours, {@code ("6:02:24", "P")} gives {@code "18:02:24"}.
     * Times marked {@code A}, and times with an hour of 12 or more, are returned unchanged.
     */
    public static String formatTime(String time, String amPm) {
        final String[] parts = time.split(":");
        final int hour = Integer.parseInt(parts[0]);
        if (amPm.charAt(0) == 'P' && hour < 12) {
            return (hour + 12) % 24 + ":" + parts[1] + ":" + parts[2];
        }
        return time;
    }

    /**
     * @return the date as {@code yyyyMMdd}
     */
    public String getDate() {
        return date;
    }

    /**
     * @return the time as {@code H:mm:ss}
     */
    public String getTime() {
        return time;
    }

    public OffsetDateTime toOffsetDateTime(ZoneOffset zoneOffset) {
        return LocalDateTime.parse(date + " " + time, DATE_TIME_FORMATTER).atOffset(zoneOffset);
    }

    @Override
    public String toString() {
        return date + " " + time;
    }
}
