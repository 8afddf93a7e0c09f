/**
 * Newline-delimited JSON adapters for the record source and result sink ports.
 * <p>Parsing and writing use Jackson's streaming API; no object mapping is involved, so arbitrary
 * columns pass through with their order preserved.</p>
 */
package ca.gc.cra.fragmenter.infrastructure.persistence.ndjson;
