/**
 * Clock adapters used to timestamp run outputs.
 */
package ca.gc.cra.fragmenter.infrastructure.time;
