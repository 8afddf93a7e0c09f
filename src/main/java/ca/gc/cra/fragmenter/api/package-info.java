/**
 * Command-line entry points for the fragmenter.
 * <p><strong>Role:</strong> Adapter layer translating {@code key=value} arguments and flags into configuration,
 * wiring NDJSON adapters and metrics, and mapping outcomes to {@link ca.gc.cra.fragmenter.api.ExitCode}s.</p>
 * <p><strong>Concurrency:</strong> CLIs run on the main thread; the pipeline manages its own workers.</p>
 * <p><strong>Output:</strong> Usage text, dry-run plans, and run summaries go to stdout via
 * {@link ca.gc.cra.fragmenter.api.CliPrinter}; diagnostics go through SLF4J.</p>
 */
package ca.gc.cra.fragmenter.api;
