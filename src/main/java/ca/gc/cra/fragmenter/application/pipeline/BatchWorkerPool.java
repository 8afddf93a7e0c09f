package ca.gc.cra.fragmenter.application.pipeline;

import ca.gc.cra.fragmenter.application.port.MetricsPort;
import ca.gc.cra.fragmenter.domain.record.FragmentRecord;
import ca.gc.cra.fragmenter.domain.record.FragmenterSettings;
import ca.gc.cra.fragmenter.domain.record.InputRecord;
import ca.gc.cra.fragmenter.domain.record.RecordFragmenter;
import ca.gc.cra.fragmenter.domain.text.LengthWindow;
import ca.gc.cra.fragmenter.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Fragments the records of one batch in parallel and returns the results in record order.
 * <p><strong>Why:</strong> Per-record fragmentation is independent work; fanning it out across workers keeps
 * large batches from being bound to one core.</p>
 * <p><strong>Role:</strong> Application service driven by {@link BatchOrchestrator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Submit one task per record to a fixed pool of {@code fragment-worker-*} threads.</li>
 *   <li>Concatenate per-record results in input order regardless of completion order.</li>
 *   <li>Isolate failures: a record that throws or exceeds its timeout contributes no fragments.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #process(int, List)} is meant to be called from one orchestrating
 * thread at a time; tasks run concurrently on the pool.</p>
 * <p><strong>Performance:</strong> Memory is proportional to the batch; results are held until the whole batch
 * completes.</p>
 * <p><strong>Observability:</strong> Emits {@code fragment.records.*}, {@code fragment.fragments.emitted},
 * {@code fragment.offset.unresolved}, and {@code fragment.worker.uncaught}; workers carry MDC keys
 * {@code batch} and {@code record}. Record tasks are submitted, so their failures arrive through the future
 * as {@code fragment.records.failed}; {@code fragment.worker.uncaught} only counts failures that escape a
 * worker thread outside a record task.</p>
 *
 * @implNote A timed-out task is cancelled with interruption. A task that ignores interruption keeps its
 * worker busy until it returns, which reduces effective parallelism for the rest of the batch.
 * @since 0.1.0
 */
public final class BatchWorkerPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BatchWorkerPool.class);
  private static final String THREAD_PREFIX = "fragment-worker";
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final long START_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

  /**
   * Unit of per-record work executed on a worker thread.
   *
   * @since 0.1.0
   */
  @FunctionalInterface
  public interface RecordTask {
    /**
     * Produces the fragments of one record.
     *
     * @param index position of the record within its batch
     * @param record record to process
     * @return fragments in order; {@code null} is treated as empty
     * @throws Exception on any failure; the record is then skipped
     */
    List<FragmentRecord> apply(int index, InputRecord record) throws Exception;
  }

  private final RecordTask task;
  private final long timeoutNanos;
  private final MetricsPort metrics;
  private final ExecutorService executor;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates a pool that fragments records with the given fragmenter.
   *
   * @param fragmenter per-record fragmenter shared by all workers
   * @param settings worker count and task timeout; batch size is ignored here
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public BatchWorkerPool(RecordFragmenter fragmenter, BatchSettings settings, MetricsPort metrics) {
    this(Objects.requireNonNull(fragmenter, "fragmenter")::fragment,
        Objects.requireNonNull(settings, "settings").workerCount(),
        settings.taskTimeout(),
        metrics);
  }

  /**
   * Creates a pool running an arbitrary per-record task.
   *
   * @param task per-record work; must be thread-safe
   * @param workerCount number of worker threads; must be positive
   * @param taskTimeout budget per record measured from task start; must be positive
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public BatchWorkerPool(RecordTask task, int workerCount, Duration taskTimeout, MetricsPort metrics) {
    this.task = Objects.requireNonNull(task, "task");
    Objects.requireNonNull(taskTimeout, "taskTimeout");
    if (workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be positive (was " + workerCount + ")");
    }
    if (taskTimeout.isNegative() || taskTimeout.isZero()) {
      throw new IllegalArgumentException("taskTimeout must be positive (was " + taskTimeout + ")");
    }
    this.timeoutNanos = taskTimeout.toNanos();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.executor = ExecutorFactories.newWorkerPool(
        workerCount,
        THREAD_PREFIX,
        (thread, ex) -> {
          this.metrics.increment("fragment.worker.uncaught");
          log.error("Uncaught exception in fragment worker {}", thread.getName(), ex);
        });
  }

  /**
   * Fragments one batch on a short-lived pool using default field, tag, and timeout settings.
   *
   * @param records batch records in order
   * @param minLength minimum fragment length
   * @param maxLength maximum fragment length
   * @param workerCount parallel workers
   * @return concatenated fragments in record order
   * @throws IllegalArgumentException if the window or worker count is invalid
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public static List<FragmentRecord> processBatch(
      List<InputRecord> records, int minLength, int maxLength, int workerCount) throws InterruptedException {
    RecordFragmenter fragmenter =
        new RecordFragmenter(FragmenterSettings.withWindow(new LengthWindow(minLength, maxLength)));
    try (BatchWorkerPool pool = new BatchWorkerPool(
        fragmenter::fragment, workerCount, BatchSettings.DEFAULT_TASK_TIMEOUT, MetricsPort.NO_OP)) {
      return pool.process(records);
    }
  }

  /**
   * Processes a batch tagged as batch {@code 0}.
   *
   * @param records batch records in order
   * @return concatenated fragments in record order
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public List<FragmentRecord> process(List<InputRecord> records) throws InterruptedException {
    return process(0, records);
  }

  /**
   * Processes one batch. Every record is submitted before any result is awaited.
   *
   * @param batchId batch identifier used in logs and MDC
   * @param records batch records in order; must not be {@code null}
   * @return concatenated fragments in record order
   * @throws InterruptedException if the calling thread is interrupted; outstanding tasks are cancelled
   * @throws IllegalStateException if the pool has been closed
   */
  public List<FragmentRecord> process(int batchId, List<InputRecord> records) throws InterruptedException {
    Objects.requireNonNull(records, "records");
    if (closed.get()) {
      throw new IllegalStateException("worker pool is closed");
    }
    if (records.isEmpty()) {
      return List.of();
    }

    List<Submitted> submitted = new ArrayList<>(records.size());
    try {
      for (int i = 0; i < records.size(); i++) {
        InputRecord record = records.get(i);
        Submitted entry = new Submitted(i);
        int index = i;
        entry.future = executor.submit(() -> runTask(batchId, index, record, entry));
        submitted.add(entry);
      }

      List<FragmentRecord> output = new ArrayList<>();
      for (Submitted entry : submitted) {
        output.addAll(await(batchId, entry));
      }
      return output;
    } catch (InterruptedException ex) {
      cancelAll(submitted);
      log.warn("Batch {} interrupted; cancelled {} outstanding tasks", batchId, submitted.size());
      throw ex;
    } catch (RejectedExecutionException ex) {
      cancelAll(submitted);
      throw new IllegalStateException("worker pool rejected batch " + batchId, ex);
    }
  }

  private List<FragmentRecord> runTask(int batchId, int index, InputRecord record, Submitted entry)
      throws Exception {
    entry.markStarted();
    String previousBatch = MDC.get("batch");
    String previousRecord = MDC.get("record");
    MDC.put("batch", Integer.toString(batchId));
    MDC.put("record", Integer.toString(index));
    try {
      List<FragmentRecord> result = task.apply(index, record);
      return result == null ? List.of() : result;
    } finally {
      restore("batch", previousBatch);
      restore("record", previousRecord);
    }
  }

  private List<FragmentRecord> await(int batchId, Submitted entry) throws InterruptedException {
    while (true) {
      long waitNanos = entry.started
          ? entry.startedNanos + timeoutNanos - System.nanoTime()
          : START_POLL_NANOS;
      try {
        List<FragmentRecord> result = entry.future.get(Math.max(0L, waitNanos), TimeUnit.NANOSECONDS);
        record(batchId, entry.index, result);
        return result;
      } catch (TimeoutException ex) {
        if (entry.started && System.nanoTime() - entry.startedNanos >= timeoutNanos) {
          entry.future.cancel(true);
          metrics.increment("fragment.records.timeout");
          log.warn("Batch {} record {} exceeded {} ms; emitting no fragments",
              batchId, entry.index, TimeUnit.NANOSECONDS.toMillis(timeoutNanos));
          return List.of();
        }
      } catch (ExecutionException ex) {
        metrics.increment("fragment.records.failed");
        log.warn("Batch {} record {} failed; emitting no fragments", batchId, entry.index, ex.getCause());
        return List.of();
      } catch (CancellationException ex) {
        metrics.increment("fragment.records.failed");
        log.warn("Batch {} record {} was cancelled; emitting no fragments", batchId, entry.index);
        return List.of();
      }
    }
  }

  private void record(int batchId, int index, List<FragmentRecord> result) {
    metrics.increment("fragment.records.processed");
    if (result.isEmpty()) {
      metrics.increment("fragment.records.skipped");
      log.debug("Batch {} record {} produced no fragments", batchId, index);
      return;
    }
    metrics.observe("fragment.fragments.emitted", result.size());
    for (FragmentRecord fragment : result) {
      if (!fragment.offsetResolved()) {
        metrics.increment("fragment.offset.unresolved");
      }
    }
  }

  private static void cancelAll(List<Submitted> submitted) {
    for (Submitted entry : submitted) {
      if (entry.future != null) {
        entry.future.cancel(true);
      }
    }
  }

  private static void restore(String key, String previous) {
    if (previous == null) {
      MDC.remove(key);
    } else {
      MDC.put(key, previous);
    }
  }

  /**
   * Shuts the worker threads down, waiting briefly for running tasks.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Fragment workers did not stop within {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
        executor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class Submitted {
    private final int index;
    private volatile boolean started;
    private volatile long startedNanos;
    private Future<List<FragmentRecord>> future;

    private Submitted(int index) {
      this.index = index;
    }

    private void markStarted() {
      startedNanos = System.nanoTime();
      started = true;
    }
  }
}
