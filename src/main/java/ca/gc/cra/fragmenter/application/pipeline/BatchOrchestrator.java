package ca.gc.cra.fragmenter.application.pipeline;

import ca.gc.cra.fragmenter.application.port.MetricsPort;
import ca.gc.cra.fragmenter.application.port.RecordSource;
import ca.gc.cra.fragmenter.application.port.ResultSink;
import ca.gc.cra.fragmenter.domain.record.FragmentRecord;
import ca.gc.cra.fragmenter.domain.record.FragmenterSettings;
import ca.gc.cra.fragmenter.domain.record.InputRecord;
import ca.gc.cra.fragmenter.domain.record.RecordFragmenter;
import ca.gc.cra.fragmenter.domain.text.LengthWindow;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs fragmentation over a full record set in fixed-size batches.
 * <p><strong>Why:</strong> Bounds memory to one batch of records and results while keeping intra-batch
 * parallelism.</p>
 * <p><strong>Role:</strong> Application use case sitting between the {@link RecordSource}/{@link ResultSink}
 * ports and {@link BatchWorkerPool}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Partition records into consecutive batches of at most {@code batchSize}.</li>
 *   <li>Process batches strictly one after another; batch N's output precedes batch N+1's.</li>
 *   <li>Scope {@code original_index} to the record's own batch.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances are immutable; each run owns its worker pool.</p>
 * <p><strong>Observability:</strong> Logs batch progress and emits {@code fragment.batch.started} and
 * {@code fragment.batch.latencyNanos}; runs carry MDC key {@code pipeline=fragment}.</p>
 *
 * @since 0.1.0
 */
public final class BatchOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

  private final RecordFragmenter fragmenter;
  private final BatchSettings settings;
  private final MetricsPort metrics;

  /**
   * Creates an orchestrator. Settings are validated by their own constructors, so invalid configuration
   * fails before any record is read.
   *
   * @param fragmenterSettings per-record settings
   * @param settings batch size, worker count, and task timeout
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public BatchOrchestrator(FragmenterSettings fragmenterSettings, BatchSettings settings, MetricsPort metrics) {
    this(new RecordFragmenter(Objects.requireNonNull(fragmenterSettings, "fragmenterSettings")), settings, metrics);
  }

  /**
   * Creates an orchestrator around an existing fragmenter.
   *
   * @param fragmenter per-record fragmenter
   * @param settings batch size, worker count, and task timeout
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public BatchOrchestrator(RecordFragmenter fragmenter, BatchSettings settings, MetricsPort metrics) {
    this.fragmenter = Objects.requireNonNull(fragmenter, "fragmenter");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Fragments an in-memory record set with default field, tag, and timeout settings.
   *
   * @param records all records in order
   * @param batchSize records per batch; must be positive
   * @param minLength minimum fragment length; must be positive
   * @param maxLength maximum fragment length; must be at least {@code minLength}
   * @param workerCount parallel workers per batch; must be positive
   * @return flat fragment list in batch order
   * @throws IllegalArgumentException if any size is invalid; raised before any record is examined
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public static List<FragmentRecord> run(
      List<InputRecord> records, int batchSize, int minLength, int maxLength, int workerCount)
      throws InterruptedException {
    FragmenterSettings fragmenterSettings = FragmenterSettings.withWindow(new LengthWindow(minLength, maxLength));
    BatchSettings batchSettings = new BatchSettings(batchSize, workerCount, BatchSettings.DEFAULT_TASK_TIMEOUT);
    return new BatchOrchestrator(fragmenterSettings, batchSettings, MetricsPort.NO_OP).run(records);
  }

  /**
   * Fragments an in-memory record set.
   *
   * @param records all records in order; must not be {@code null}
   * @return flat fragment list in batch order
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public List<FragmentRecord> run(List<InputRecord> records) throws InterruptedException {
    Objects.requireNonNull(records, "records");
    List<FragmentRecord> output = new ArrayList<>();
    String previousPipeline = MDC.get("pipeline");
    MDC.put("pipeline", "fragment");
    try (BatchWorkerPool pool = new BatchWorkerPool(fragmenter, settings, metrics)) {
      int batchId = 0;
      for (int from = 0; from < records.size(); from += settings.batchSize()) {
        int to = Math.min(records.size(), from + settings.batchSize());
        output.addAll(processBatch(pool, batchId++, records.subList(from, to)));
      }
    } finally {
      restorePipeline(previousPipeline);
    }
    return output;
  }

  /**
   * Streams records from a source through the pipeline into a sink, one batch at a time. Each batch's
   * fragments are written with a single {@link ResultSink#write(List)} call; the sink is flushed at the end.
   * The caller owns and closes both ports.
   *
   * @param source record source
   * @param sink fragment sink
   * @return run totals
   * @throws IOException if the source or sink fails; propagated unchanged
   * @throws InterruptedException if interrupted while waiting for workers
   */
  public RunSummary run(RecordSource source, ResultSink sink) throws IOException, InterruptedException {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(sink, "sink");
    FragmenterSettings fragmenterSettings = fragmenter.settings();
    log.info("Fragmenting field '{}' into {}..{} character fragments tagged '{}'",
        fragmenterSettings.textField(),
        fragmenterSettings.window().minLength(),
        fragmenterSettings.window().maxLength(),
        fragmenterSettings.sourceType());
    long startNanos = System.nanoTime();
    int batches = 0;
    long records = 0;
    long fragments = 0;
    String previousPipeline = MDC.get("pipeline");
    MDC.put("pipeline", "fragment");
    try (BatchWorkerPool pool = new BatchWorkerPool(fragmenter, settings, metrics)) {
      Iterator<InputRecord> iterator = source.iterate();
      while (true) {
        List<InputRecord> batch = nextBatch(iterator);
        if (batch.isEmpty()) {
          break;
        }
        List<FragmentRecord> output = processBatch(pool, batches, batch);
        sink.write(output);
        batches++;
        records += batch.size();
        fragments += output.size();
      }
      sink.flush();
    } finally {
      restorePipeline(previousPipeline);
    }
    RunSummary summary = new RunSummary(batches, records, fragments, System.nanoTime() - startNanos);
    log.info("Fragmentation finished: {} batches, {} records, {} fragments", batches, records, fragments);
    return summary;
  }

  private List<FragmentRecord> processBatch(BatchWorkerPool pool, int batchId, List<InputRecord> batch)
      throws InterruptedException {
    metrics.increment("fragment.batch.started");
    log.info("Processing batch {} ({} records)", batchId, batch.size());
    long start = System.nanoTime();
    List<FragmentRecord> output = pool.process(batchId, batch);
    long elapsed = System.nanoTime() - start;
    metrics.observe("fragment.batch.latencyNanos", elapsed);
    log.info("Batch {} produced {} fragments in {} ms", batchId, output.size(), elapsed / 1_000_000L);
    return output;
  }

  private List<InputRecord> nextBatch(Iterator<InputRecord> iterator) throws IOException {
    List<InputRecord> batch = new ArrayList<>();
    try {
      while (batch.size() < settings.batchSize() && iterator.hasNext()) {
        batch.add(Objects.requireNonNull(iterator.next(), "source yielded null record"));
      }
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
    return batch;
  }

  private static void restorePipeline(String previous) {
    if (previous == null) {
      MDC.remove("pipeline");
    } else {
      MDC.put("pipeline", previous);
    }
  }
}
