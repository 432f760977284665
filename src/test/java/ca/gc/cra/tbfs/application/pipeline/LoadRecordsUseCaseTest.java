package ca.gc.cra.tbfs.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.tbfs.domain.record.TypedRecord;
import ca.gc.cra.tbfs.infrastructure.codec.TypedBytesCodec;
import ca.gc.cra.tbfs.testutil.FakeStreamingTool;
import ca.gc.cra.tbfs.testutil.TypedBytesFixtures;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoadRecordsUseCaseTest {
  @TempDir
  Path dir;

  private final LoadRecordsUseCase useCase = new LoadRecordsUseCase(
      new RecordWriter(FakeStreamingTool.catFiles(), new TypedBytesCodec(), 100, null));

  @Test
  void writesOneRecordPerLine() throws IOException {
    Path input = Files.writeString(dir.resolve("in.tsv"), "alpha\t1\nbeta\nmulti\tpart\tvalue\n",
        StandardCharsets.UTF_8);
    Path target = dir.resolve("out.tb");

    long written = useCase.run(target.toString(), input);

    assertEquals(3, written);
    assertEquals(List.of(
        TypedRecord.of("alpha", "1"),
        TypedRecord.of("beta", ""),
        TypedRecord.of("multi", "part\tvalue")), TypedBytesFixtures.read(target));
  }

  @Test
  void missingInputFails() {
    assertThrows(IOException.class,
        () -> useCase.run(dir.resolve("out.tb").toString(), dir.resolve("absent.tsv")));
  }
}
