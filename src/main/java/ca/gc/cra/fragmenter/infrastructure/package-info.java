/**
 * Infrastructure adapters that bind fragmenter ports to files, memory, executors, and metrics backends.
 * <p><strong>Role:</strong> Adapter layer implementing the source, sink, clock, and metrics contracts.</p>
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees; persistence adapters are single-threaded.</p>
 * <p><strong>Metrics:</strong> Forwards the {@code fragment.*} namespace to OpenTelemetry.</p>
 */
package ca.gc.cra.fragmenter.infrastructure;
