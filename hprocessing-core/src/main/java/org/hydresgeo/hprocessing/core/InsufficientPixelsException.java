package org.hydresgeo.hprocessing.core;

/**
 * Thrown if a region holds fewer pixels than the selected aggregation mode needs.
 */
public class InsufficientPixelsException extends HProcessingException {

    private final int required;
    private final int available;

    public InsufficientPixelsException(int required, int available) {
        super("Aggregation requires at least " + required + " pixels, but only " + available + " are available");
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
