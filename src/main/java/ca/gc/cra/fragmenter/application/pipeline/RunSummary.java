package ca.gc.cra.fragmenter.application.pipeline;

/**
 * Totals for one orchestrated run.
 *
 * @param batches number of batches processed
 * @param records number of input records read
 * @param fragments number of fragment records written
 * @param elapsedNanos wall time spent in the run
 * @since 0.1.0
 */
public record RunSummary(int batches, long records, long fragments, long elapsedNanos) {}
