/**
 * Application-level pipeline that fans record batches out to a bounded worker pool.
 * <p>{@link ca.gc.cra.fragmenter.application.pipeline.BatchOrchestrator} cuts the record set into fixed-size
 * batches and runs them one after another; {@link ca.gc.cra.fragmenter.application.pipeline.BatchWorkerPool}
 * fragments the records of one batch in parallel and reassembles results in record order.</p>
 * <p>Worker threads follow the {@code fragment-worker-*} naming convention and carry MDC keys {@code batch}
 * and {@code record} while running a task. Operational counters go through
 * {@link ca.gc.cra.fragmenter.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fragmenter.application.pipeline;
