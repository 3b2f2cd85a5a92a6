package org.hydresgeo.hprocessing.core.datamodel;

import com.google.common.collect.ImmutableMap;
import org.hydresgeo.hprocessing.core.UnresolvableZoneException;

import java.awt.Rectangle;
import java.util.Map;

/**
 * Zone resolver over a fixed zone name to rectangle map.
 */
public class MapZoneResolver implements ZoneResolver {

    private final Map<String, Rectangle> rectangles;

    public MapZoneResolver(Map<String, Rectangle> rectangles) {
        this.rectangles = ImmutableMap.copyOf(rectangles);
    }

    @Override
    public Rectangle resolve(String zoneName) {
        final Rectangle rectangle = rectangles.get(zoneName);
        if (rectangle == null) {
            throw new UnresolvableZoneException(zoneName, "No rectangle configured for zone '" + zoneName + "'");
        }
        return new Rectangle(rectangle);
    }
}
