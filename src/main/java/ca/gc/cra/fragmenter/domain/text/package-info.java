/**
 * Sentence and phrase segmentation of free-form text into length-bounded fragments.
 *
 * @since 0.1.0
 */
package ca.gc.cra.fragmenter.domain.text;
