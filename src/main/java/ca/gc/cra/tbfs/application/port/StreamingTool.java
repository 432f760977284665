package ca.gc.cra.tbfs.application.port;

import java.io.IOException;
import java.util.List;

/**
 * Port building the command lines of the external record conversion tool.
 *
 * <p>A dump command writes the stored file's records, encoded with the configured {@link RecordCodec}, to its
 * stdout. A load command reads encoded records from its stdin and stores them at the destination.</p>
 *
 * @since 0.1.0
 */
public interface StreamingTool {
  /**
   * Builds the argument vector that dumps one stored file to stdout.
   *
   * @param path concrete cluster file
   * @return argv, executable first
   * @throws IOException if the tool cannot be located
   */
  List<String> dumpCommand(String path) throws IOException;

  /**
   * Builds the argument vector that loads stdin into a stored file.
   *
   * @param path cluster destination
   * @return argv, executable first
   * @throws IOException if the tool cannot be located
   */
  List<String> loadCommand(String path) throws IOException;
}
