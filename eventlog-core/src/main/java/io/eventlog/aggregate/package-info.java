/**
 * Aggregate base class: pending events, replay and snapshot state hooks.
 */
package io.eventlog.aggregate;
