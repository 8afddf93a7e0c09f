/**
 * Record-level fragmentation: input rows, fragment rows, and offset bookkeeping.
 * <p><strong>Concurrency:</strong> Immutable values; {@link ca.gc.cra.fragmenter.domain.record.RecordFragmenter}
 * is stateless between calls.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.fragmenter.domain.record;
