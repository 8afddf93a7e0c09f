/**
 * Argument validation helpers shared by the CLI and configuration layers.
 * <p>All helpers throw {@link java.lang.IllegalArgumentException} with operator-facing messages.</p>
 */
package ca.gc.cra.fragmenter.validation;
