/**
 * Internal helpers: daemon thread factory, transaction scoping, error formatting.
 */
package io.eventlog.util;
