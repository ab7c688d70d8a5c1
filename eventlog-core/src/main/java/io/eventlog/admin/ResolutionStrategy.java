package io.eventlog.admin;

import io.eventlog.model.ResolutionMethod;

/**
 * Operator choice for resolving a single projection failure.
 */
public enum ResolutionStrategy {
    /** Re-run the projection for the failed event now. */
    RETRY(ResolutionMethod.MANUAL_RETRY),
    /** Accept that the read model will never see the event. */
    SKIP(ResolutionMethod.MANUAL_SKIP),
    /** The read model was repaired out of band. */
    MANUAL_FIX(ResolutionMethod.MANUAL_FIX);

    private final ResolutionMethod method;

    ResolutionStrategy(ResolutionMethod method) {
        this.method = method;
    }

    /**
     * The resolution method recorded when this strategy succeeds.
     */
    public ResolutionMethod method() {
        return method;
    }
}
