package io.eventlog.admin;

import io.eventlog.model.ResolutionMethod;

import java.time.Instant;

/**
 * Outcome of {@link ProjectionAdmin#resolve(String, ResolutionStrategy)}.
 */
public sealed interface ResolveResult
        permits ResolveResult.Resolved, ResolveResult.NotFound, ResolveResult.AlreadyResolved,
        ResolveResult.RetryFailed {

    String failureId();

    /**
     * The failure is now resolved.
     */
    record Resolved(String failureId, ResolutionMethod method) implements ResolveResult {
    }

    /**
     * No failure with this id exists.
     */
    record NotFound(String failureId) implements ResolveResult {
    }

    /**
     * The failure had already been resolved; nothing changed.
     */
    record AlreadyResolved(String failureId, ResolutionMethod method, Instant resolvedAt) implements ResolveResult {
    }

    /**
     * A manual retry failed again; the failure was updated and stays unresolved.
     */
    record RetryFailed(String failureId, String errorMessage) implements ResolveResult {
    }
}
