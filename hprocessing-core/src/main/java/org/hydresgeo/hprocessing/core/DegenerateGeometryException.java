package org.hydresgeo.hprocessing.core;

/**
 * Thrown if a rectangle or a grid partition would have cells without pixels.
 */
public class DegenerateGeometryException extends HProcessingException {

    public DegenerateGeometryException(String message) {
        super(message);
    }
}
