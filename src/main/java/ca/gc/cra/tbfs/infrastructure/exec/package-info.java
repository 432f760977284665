/**
 * Process supervision primitives for external cluster tools.
 * <p><strong>Role:</strong> Infrastructure layer spawning commands through {@link java.lang.ProcessBuilder} with
 * explicit stream targets and a memory ceiling exported via {@code HADOOP_OPTS}.</p>
 * <p><strong>Concurrency:</strong> Captured output is drained on daemon threads so children never block on a
 * full pipe; record source pumps run on a bounded daemon pool from {@link ca.gc.cra.tbfs.infrastructure.exec.ExecutorFactories}.</p>
 * <p><strong>Errors:</strong> Nonzero exits surface as {@link ca.gc.cra.tbfs.infrastructure.exec.ExternalCommandException}.</p>
 */
package ca.gc.cra.tbfs.infrastructure.exec;
