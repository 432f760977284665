/**
 * Application-level pipelines that move typed bytes records between the cluster and local callers.
 * <p>{@link ca.gc.cra.tbfs.application.pipeline.RecordStreamMultiplexer} fans in many dump processes under a
 * concurrency cap; {@link ca.gc.cra.tbfs.application.pipeline.RecordWriter} streams into one load process.
 * Readers are single pass and owned by one consuming thread; pump threads follow the {@code tbfs-pump-*} naming
 * convention.</p>
 * <p>Operational counters are surfaced through {@link ca.gc.cra.tbfs.application.port.MetricsPort}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tbfs.application.pipeline;
