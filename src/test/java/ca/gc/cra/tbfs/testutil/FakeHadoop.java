package ca.gc.cra.tbfs.testutil;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

/**
 * Installs a shell script that mimics the {@code hadoop} client on top of the local filesystem.
 *
 * <p>{@code fs} verbs act on local paths; {@code jar <jar> dumptb <path>} prints the local file and
 * {@code loadtb} writes stdin to it. Each invocation stores {@code $HADOOP_OPTS} in {@code last-hadoop-opts}
 * next to the script.</p>
 */
public final class FakeHadoop {
  private static final String SCRIPT = """
      #!/bin/sh
      printf '%s' "$HADOOP_OPTS" > "$(dirname "$0")/last-hadoop-opts"
      if [ "$1" = "fs" ]; then
        case "$2" in
          -test)
            case "$3" in
              -e) [ -e "$4" ]; exit $? ;;
              -d) [ -d "$4" ]; exit $? ;;
              -z) [ -f "$4" ] && [ ! -s "$4" ]; exit $? ;;
            esac ;;
          -ls)
            if [ ! -e "$3" ]; then
              echo "24/01/01 00:00:00 WARN fs.FileSystem: probing $3" >&2
              echo "ls: Cannot access $3: No such file or directory." >&2
              exit 255
            fi
            if [ -d "$3" ]; then
              echo "Found $(ls -1 "$3" | wc -l | tr -d ' ') items"
              for f in $(ls -1 "$3"); do
                echo "-rw-r--r--   1 user group 10 2024-01-01 00:00 $3/$f"
              done
            else
              echo "-rw-r--r--   1 user group 10 2024-01-01 00:00 $3"
            fi
            exit 0 ;;
          -rmr) rm -r "$3"; exit $? ;;
          -put) cp "$3" "$4"; exit $? ;;
          -get) cp "$3" "$4"; exit $? ;;
        esac
      fi
      if [ "$1" = "jar" ]; then
        case "$3" in
          dumptb)
            echo "24/01/01 00:00:00 INFO streaming.DumpTypedBytes: dumping $4" >&2
            cat "$4"; exit $? ;;
          loadtb) cat > "$4"; exit $? ;;
        esac
      fi
      echo "unsupported: $*" >&2
      exit 2
      """;

  private final Path script;
  private final Path jar;

  private FakeHadoop(Path script, Path jar) {
    this.script = script;
    this.jar = jar;
  }

  public static FakeHadoop install(Path directory) throws IOException {
    Path bin = Files.createDirectories(directory.resolve("bin"));
    Path script = bin.resolve("hadoop");
    Files.writeString(script, SCRIPT, StandardCharsets.UTF_8);
    Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
    Path jar = Files.createDirectories(directory.resolve("share/hadoop/tools/lib"))
        .resolve("hadoop-streaming-2.7.7.jar");
    Files.write(jar, new byte[] {'P', 'K'});
    return new FakeHadoop(script, jar);
  }

  public String command() {
    return script.toString();
  }

  public Path home() {
    return script.getParent().getParent();
  }

  public Path jar() {
    return jar;
  }

  public String lastHadoopOpts() throws IOException {
    return Files.readString(script.getParent().resolve("last-hadoop-opts"), StandardCharsets.UTF_8);
  }
}
