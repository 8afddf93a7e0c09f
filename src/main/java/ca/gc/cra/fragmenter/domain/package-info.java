/**
 * Core domain model for the fragmenter: text segmentation and record fragmentation.
 * <p><strong>Role:</strong> Domain layer without infrastructure dependencies; no logging, metrics, or I/O.</p>
 * <p><strong>Concurrency:</strong> Types are immutable and functions are pure; safe to share across worker threads.</p>
 * <p><strong>Performance:</strong> Linear passes over record text; no caching.</p>
 */
package ca.gc.cra.fragmenter.domain;
