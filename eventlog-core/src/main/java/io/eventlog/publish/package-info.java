/**
 * Dispatch of committed events to projections with inline retry.
 */
package io.eventlog.publish;
