/**
 * Typed bytes wire format: value reader, value writer and the record codec used for dump and load pipes.
 */
package ca.gc.cra.tbfs.infrastructure.codec;
