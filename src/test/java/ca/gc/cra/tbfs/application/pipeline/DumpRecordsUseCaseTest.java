package ca.gc.cra.tbfs.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tbfs.domain.record.TypedRecord;
import ca.gc.cra.tbfs.infrastructure.codec.TypedBytesCodec;
import ca.gc.cra.tbfs.testutil.FakeStreamingTool;
import ca.gc.cra.tbfs.testutil.InMemoryFileSystem;
import ca.gc.cra.tbfs.testutil.RecordingMetricsPort;
import ca.gc.cra.tbfs.testutil.TypedBytesFixtures;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class DumpRecordsUseCaseTest {
  @TempDir
  Path dir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private InMemoryFileSystem fs;
  private DumpRecordsUseCase useCase;

  @BeforeEach
  void setUp() throws IOException {
    List<String> parts = new ArrayList<>();
    for (int i = 0; i < 3; i++) {
      parts.add(TypedBytesFixtures.writeSequence(dir.resolve("part-" + i), "p" + i, 10).toString());
    }
    fs = new InMemoryFileSystem().with("/data", parts);
    useCase = new DumpRecordsUseCase(fs, FakeStreamingTool.catFiles(), new TypedBytesCodec(),
        ReaderOptions.defaults().withCapacity(2), metrics);
  }

  @Test
  void deliversEveryRecordWithoutLimit() throws IOException {
    List<TypedRecord> received = new ArrayList<>();

    long delivered = useCase.run(List.of("/data"), 0, received::add);

    assertEquals(30, delivered);
    assertEquals(30, received.size());
    assertNull(MDC.get("operation"));
  }

  @Test
  void stopsAtLimit() throws IOException {
    List<TypedRecord> received = new ArrayList<>();

    long delivered = useCase.run(List.of("/data"), 5, received::add);

    assertEquals(5, delivered);
    assertEquals(5, received.size());
  }

  @Test
  void sinkFailurePropagates() {
    IOException boom = new IOException("disk full");

    IOException ex = assertThrows(IOException.class, () -> useCase.run(List.of("/data"), 0, record -> {
      throw boom;
    }));

    assertSame(boom, ex);
    assertNull(MDC.get("operation"));
  }
}
