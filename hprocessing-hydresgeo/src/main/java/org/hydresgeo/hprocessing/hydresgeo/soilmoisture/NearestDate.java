package org.hydresgeo.hprocessing.hydresgeo.soilmoisture;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * The candidate closest in time to a target instant.
 */
public final class NearestDate {

    private static final double SECONDS_PER_MINUTE = 60.0;

    private final Instant date;
    private final double deltaMinutes;

    private NearestDate(Instant date, double deltaMinutes) {
        this.date = date;
        this.deltaMinutes = deltaMinutes;
    }

    /**
     * Finds the candidate closest to the target. On ties the first candidate wins.
     *
     * @throws IllegalArgumentException if there are no candidates
     */
    public static NearestDate find(Collection<Instant> candidates, Instant target) {
        Instant nearest = null;
        Duration nearestDistance = null;
        for (Instant candidate : candidates) {
            final Duration distance = Duration.between(target, candidate).abs();
            if (nearestDistance == null || distance.compareTo(nearestDistance) < 0) {
                nearest = candidate;
                nearestDistance = distance;
            }
        }
        if (nearest == null) {
            throw new IllegalArgumentException("No candidate dates given");
        }
        final Duration delta = Duration.between(target, nearest);
        return new NearestDate(nearest, delta.getSeconds() / SECONDS_PER_MINUTE + delta.getNano() / 6.0e10);
    }

    public Instant getDate() {
        return date;
    }

    /**
     * @return {@code nearest - target} in minutes, negative if the nearest date lies before the target
     */
    public double getDeltaMinutes() {
        return deltaMinutes;
    }

    public boolean isWithinWindow(int windowWidthMinutes) {
        return Math.abs(deltaMinutes) <= windowWidthMinutes / 2.0;
    }
}
