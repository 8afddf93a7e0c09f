/**
 * Executor construction helpers for worker pools.
 * <p><strong>Concurrency:</strong> Factories return fixed-size pools with named, non-daemon threads.</p>
 */
package ca.gc.cra.fragmenter.infrastructure.exec;
