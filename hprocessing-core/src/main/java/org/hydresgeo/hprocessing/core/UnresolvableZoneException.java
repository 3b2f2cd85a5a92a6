package org.hydresgeo.hprocessing.core;

/**
 * Thrown if no rectangle is configured for a zone name.
 */
public class UnresolvableZoneException extends HProcessingException {

    private final String zoneName;

    public UnresolvableZoneException(String zoneName, String message) {
        super(message);
        this.zoneName = zoneName;
    }

    public String getZoneName() {
        return zoneName;
    }
}
