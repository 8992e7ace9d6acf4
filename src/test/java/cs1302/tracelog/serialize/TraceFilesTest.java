package cs1302.tracelog.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.tracelog.ExampleTrace;
import cs1302.tracelog.trace.Tracer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for {@link TraceFiles}. */
public class TraceFilesTest {

  @TempDir
  Path tempDir;

  /** Ensure that all three artifacts are written and read back unchanged. */
  @Test
  public void testWriteAndReadBack() throws IOException {
    Tracer tracer = ExampleTrace.record(Path.of("/work/example.py"));
    TraceFiles files = new TraceFiles(tempDir.resolve("nested").resolve("out"));
    files.write(tracer);

    assertTrue(Files.isRegularFile(files.directory().resolve(TraceFiles.METADATA_FILE)));
    assertTrue(Files.isRegularFile(files.directory().resolve(TraceFiles.PATHS_FILE)));
    assertTrue(Files.isRegularFile(files.directory().resolve(TraceFiles.EVENTS_FILE)));

    assertEquals(tracer.metadata(), files.readMetadata());
    assertEquals(tracer.paths(), files.readPaths());
    assertEquals(tracer.events(), files.readEvents());
  }

  /** Ensure that writing twice replaces the earlier files. */
  @Test
  public void testWriteIsRepeatable() throws IOException {
    Tracer tracer = ExampleTrace.record(Path.of("/work/example.py"));
    TraceFiles files = new TraceFiles(tempDir);
    files.write(tracer);
    String first = Files.readString(files.eventsFile());
    files.write(tracer);
    assertEquals(first, Files.readString(files.eventsFile()));
  }

  /** Ensure that missing and corrupt files surface as I/O errors. */
  @Test
  public void testUnreadableFiles() throws IOException {
    TraceFiles files = new TraceFiles(tempDir);
    assertThrows(NoSuchFileException.class, files::readEvents);

    Files.writeString(files.pathsFile(), "{\"not\": \"an array\"}");
    assertThrows(TraceFormatException.class, files::readPaths);
  }
}
