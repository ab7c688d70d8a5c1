/**
 * Schema migration of stored event payloads and snapshot state, applied once at load time.
 *
 * <p>Register one {@link io.eventlog.upcast.Upcaster} per schema step; the
 * {@linkplain io.eventlog.repository.AggregateRepository repository} runs the chain for every
 * event and snapshot it reads.
 *
 * <pre>{@code
 * var upcasters = UpcasterRegistry.empty()
 *     .registerEvent(Upcaster.of("DocumentCreated", 1, payload -> {
 *         Map<String, Object> next = new LinkedHashMap<>(payload);
 *         next.putIfAbsent("visibility", "private");
 *         return next;
 *     }));
 * }</pre>
 */
package io.eventlog.upcast;
