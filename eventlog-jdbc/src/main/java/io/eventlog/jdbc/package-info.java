/**
 * JDBC implementations of the event log, snapshot and projection stores.
 *
 * <p>Schema scripts ship as classpath resources {@code schema/h2.sql} and
 * {@code schema/postgresql.sql}. Stores take a {@link io.eventlog.jdbc.spi.Dialect}, usually
 * obtained from {@link io.eventlog.jdbc.dialect.Dialects#detect(javax.sql.DataSource)}, and
 * run in the connection and transaction handed to them by the caller.
 */
package io.eventlog.jdbc;
