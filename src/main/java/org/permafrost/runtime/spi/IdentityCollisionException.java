package org.permafrost.runtime.spi;

/**
 * Thrown when two distinct objects claim the same unique load id.
 */
public class IdentityCollisionException extends RuntimeException {

    private final String loadId;

    /**
     * Creates a new collision exception.
     *
     * @param loadId The contested load id.
     * @param message Detail message.
     */
    public IdentityCollisionException(String loadId, String message) {
        super(message);
        this.loadId = loadId;
    }

    /**
     * @return the load id both objects claimed
     */
    public String getLoadId() {
        return loadId;
    }
}
