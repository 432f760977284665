/**
 * Record value types exchanged between codecs, the record writer and the record stream multiplexer.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tbfs.domain.record;
