/**
 * Adapters that reach the cluster through the {@code hadoop} command-line client: filesystem verbs, streaming
 * jar discovery, dump/load command construction and stderr clean-up.
 */
package ca.gc.cra.tbfs.infrastructure.hadoop;
