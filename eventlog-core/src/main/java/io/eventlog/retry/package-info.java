/**
 * Backoff policies used by the aggregate repository and the projection publisher.
 */
package io.eventlog.retry;
