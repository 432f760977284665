package ca.gc.cra.tbfs.application.port;

import ca.gc.cra.tbfs.domain.record.TypedRecord;
import java.io.IOException;

/**
 * Destination for records read from the cluster.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordSink {
  /**
   * Accepts one record.
   *
   * @param record record read from the cluster
   * @throws IOException if the record cannot be delivered
   */
  void accept(TypedRecord record) throws IOException;
}
