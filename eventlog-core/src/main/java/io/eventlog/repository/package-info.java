/**
 * Loading and saving event-sourced aggregates with optimistic concurrency and snapshots.
 */
package io.eventlog.repository;
