package ca.gc.cra.fragmenter.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Batch and worker tuning parameters.
 *
 * @param batchSize maximum records loaded and processed together
 * @param workerCount worker threads per batch
 * @param taskTimeout per-record budget measured from the moment a worker starts the record
 * @since 0.1.0
 */
public record BatchSettings(int batchSize, int workerCount, Duration taskTimeout) {
  public static final int DEFAULT_BATCH_SIZE = 100_000;
  public static final Duration DEFAULT_TASK_TIMEOUT = Duration.ofSeconds(60);

  /**
   * Validates settings. Unlike worker tuning elsewhere, invalid values are rejected rather than clamped.
   *
   * @throws IllegalArgumentException if a size or the timeout is not positive
   */
  public BatchSettings {
    Objects.requireNonNull(taskTimeout, "taskTimeout");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive (was " + batchSize + ")");
    }
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive (was " + workerCount + ")");
    }
    if (taskTimeout.isNegative() || taskTimeout.isZero()) {
      throw new IllegalArgumentException("taskTimeout must be positive (was " + taskTimeout + ")");
    }
  }

  /**
   * Returns the default worker budget: available processors minus one, at least one.
   *
   * @return default worker count
   */
  public static int defaultWorkerCount() {
    return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
  }

  /**
   * Derives settings using the pipeline defaults.
   *
   * @return default settings
   */
  public static BatchSettings defaults() {
    return new BatchSettings(DEFAULT_BATCH_SIZE, defaultWorkerCount(), DEFAULT_TASK_TIMEOUT);
  }
}
