/**
 * Service provider interface for database dialects.
 */
package io.eventlog.jdbc.spi;
