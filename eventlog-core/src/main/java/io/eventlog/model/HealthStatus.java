package io.eventlog.model;

/**
 * Projection health derived from the number of unresolved failures.
 *
 * <ul>
 *   <li>{@link #HEALTHY}: no active failures</li>
 *   <li>{@link #DEGRADED}: 1 to 9 active failures</li>
 *   <li>{@link #CRITICAL}: 10 to 49 active failures</li>
 *   <li>{@link #OFFLINE}: 50 or more active failures</li>
 * </ul>
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    CRITICAL("critical"),
    OFFLINE("offline");

    static final int CRITICAL_THRESHOLD = 10;
    static final int OFFLINE_THRESHOLD = 50;

    private final String code;

    HealthStatus(String code) {
        this.code = code;
    }

    /**
     * Returns the persisted representation of this status.
     */
    public String code() {
        return code;
    }

    /**
     * Derives the status for a projection with the given number of active failures.
     *
     * @param activeFailures unresolved failure count (negative values are treated as 0)
     * @return the derived status
     */
    public static HealthStatus fromActiveFailures(long activeFailures) {
        if (activeFailures <= 0) {
            return HEALTHY;
        }
        if (activeFailures < CRITICAL_THRESHOLD) {
            return DEGRADED;
        }
        if (activeFailures < OFFLINE_THRESHOLD) {
            return CRITICAL;
        }
        return OFFLINE;
    }

    /**
     * Looks up a status by its persisted code.
     *
     * @param code persisted code
     * @return the matching status
     * @throws IllegalArgumentException if the code is unknown
     */
    public static HealthStatus fromCode(String code) {
        for (HealthStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown health status: " + code);
    }
}
