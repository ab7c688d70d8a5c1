/**
 * Operator-facing health queries and compensation actions for projections: replay,
 * reset and manual resolution of failures.
 */
package io.eventlog.admin;
