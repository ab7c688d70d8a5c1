package io.eventlog.admin;

/**
 * Thrown when an admin operation names a projection that is not registered.
 */
public final class UnknownProjectionException extends RuntimeException {
    private final String projectionName;

    public UnknownProjectionException(String projectionName) {
        super("Unknown projection: " + projectionName);
        this.projectionName = projectionName;
    }

    public String projectionName() {
        return projectionName;
    }
}
