package io.eventlog.model;

/**
 * How a projection failure was resolved.
 */
public enum ResolutionMethod {
    /** Resolved by a later successful handling (inline, background worker, or replay). */
    AUTO_RETRY("auto_retry"),
    /** Operator re-ran the projection for the failed event and it succeeded. */
    MANUAL_RETRY("manual_retry"),
    /** Operator chose to skip the event for this projection. */
    MANUAL_SKIP("manual_skip"),
    /** Operator repaired the read model out of band. */
    MANUAL_FIX("manual_fix"),
    /** Closed by a hard reset of the projection. */
    MANUAL_RESET("manual_reset"),
    /** Resolved by an operator-triggered replay. */
    REPLAY("replay");

    private final String code;

    ResolutionMethod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Looks up a method by its persisted code.
     *
     * @param code persisted code
     * @return the matching method
     * @throws IllegalArgumentException if the code is unknown
     */
    public static ResolutionMethod fromCode(String code) {
        for (ResolutionMethod method : values()) {
            if (method.code.equals(code)) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown resolution method: " + code);
    }
}
