/**
 * Configuration loading and merging for the fragmenter CLI.
 * <p><strong>Role:</strong> Bootstrap layer turning CLI arguments, an optional YAML file, and embedded defaults into
 * typed settings.</p>
 * <p><strong>Precedence:</strong> CLI {@code key=value} over YAML ({@code common} then {@code fragment} section) over
 * {@link ca.gc.cra.fragmenter.config.DefaultsForMode}.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 */
package ca.gc.cra.fragmenter.config;
