/**
 * Persistent model types: snapshots, projection failures, checkpoints and health metrics.
 */
package io.eventlog.model;
