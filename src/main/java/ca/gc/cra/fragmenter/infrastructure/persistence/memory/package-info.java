/**
 * In-memory record source and result sink for embedding the pipeline and for tests.
 */
package ca.gc.cra.fragmenter.infrastructure.persistence.memory;
