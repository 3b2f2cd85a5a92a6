package org.hydresgeo.hprocessing.core.datamodel;

import java.awt.Rectangle;

/**
 * Maps a zone name to its pixel rectangle ({@code x} = first column, {@code y} = first row).
 */
public interface ZoneResolver {

    /**
     * @throws org.hydresgeo.hprocessing.core.UnresolvableZoneException if no rectangle is configured for the zone
     */
    Rectangle resolve(String zoneName);
}
