/**
 * Cluster filesystem path model: normalization, status-entry detection and the not-found error.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tbfs.domain.fs;
