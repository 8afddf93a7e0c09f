/**
 * <strong>Purpose:</strong> Ports defining the source -> fragment -> sink workflow contracts.
 * <p><strong>Pipeline role:</strong> Adapters implement these interfaces to plug record stores, metrics
 * backends, and clocks into the batch pipeline.</p>
 * <p><strong>Concurrency:</strong> Sources and sinks are driven from the orchestrating thread; metrics ports
 * must tolerate concurrent worker updates.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fragmenter.application.port;
