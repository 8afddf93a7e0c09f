/**
 * Logging utilities for the fragmenter CLI and pipeline.
 * <p><strong>Role:</strong> Runtime level control over Logback and log-safe text previews.</p>
 * <p><strong>MDC:</strong> The pipeline sets {@code pipeline}, {@code batch}, and {@code record}; the shipped
 * {@code logback.xml} prints them.</p>
 */
package ca.gc.cra.fragmenter.logging;
