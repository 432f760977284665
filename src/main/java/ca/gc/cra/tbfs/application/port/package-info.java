/**
 * Ports separating the record pipelines from the cluster tooling.
 * <p><strong>Role:</strong> Hexagonal boundary: {@link ca.gc.cra.tbfs.application.port.FileSystemQuery},
 * {@link ca.gc.cra.tbfs.application.port.StreamingTool} and {@link ca.gc.cra.tbfs.application.port.RecordCodec}
 * are implemented by the Hadoop and typed-bytes adapters; {@link ca.gc.cra.tbfs.application.port.MetricsPort} by
 * the OpenTelemetry adapter.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tbfs.application.port;
