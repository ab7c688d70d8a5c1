package io.eventlog;

/**
 * Unchecked exception wrapping a storage failure (connection loss, SQL error, lock timeout).
 *
 * <p>Fatal for the current request. Callers are not expected to retry beyond the
 * repository's concurrency retry budget.
 */
public final class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
