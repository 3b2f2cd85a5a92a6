package org.hydresgeo.hprocessing.core;

/**
 * Thrown if wavelengths, band flags or spectra which must be aligned differ in length.
 */
public class LengthMismatchException extends HProcessingException {

    public LengthMismatchException(String message) {
        super(message);
    }
}
