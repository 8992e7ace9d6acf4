package cs1302.tracelog.serialize;

import cs1302.tracelog.trace.Tracer;
import cs1302.tracelog.types.TraceLowLevelEvent;
import cs1302.tracelog.types.TraceMetadata;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The conventional layout of a stored trace: three files in one directory.
 *
 * @param directory The directory holding the trace files.
 */
public record TraceFiles(Path directory) {

  /** File name of the run metadata. */
  public static final String METADATA_FILE = "trace_metadata.json";

  /** File name of the path table. */
  public static final String PATHS_FILE = "trace_paths.json";

  /** File name of the event stream. */
  public static final String EVENTS_FILE = "trace.json";

  /**
   * Get the metadata file.
   *
   * @return The path of the metadata file in {@link #directory()}.
   */
  public Path metadataFile() {
    return directory.resolve(METADATA_FILE);
  }

  /**
   * Get the path table file.
   *
   * @return The path of the path table file in {@link #directory()}.
   */
  public Path pathsFile() {
    return directory.resolve(PATHS_FILE);
  }

  /**
   * Get the event stream file.
   *
   * @return The path of the event stream file in {@link #directory()}.
   */
  public Path eventsFile() {
    return directory.resolve(EVENTS_FILE);
  }

  /**
   * Write all three artifacts of a tracer, creating the directory if needed. Files are written
   * one after another; a failure leaves the files written so far in place.
   *
   * @param tracer The tracer to flush.
   * @throws IOException If the directory or any file could not be written.
   */
  public void write(Tracer tracer) throws IOException {
    Files.createDirectories(directory);
    tracer.storeTraceMetadata(metadataFile());
    tracer.storeTracePaths(pathsFile());
    tracer.storeTraceEvents(eventsFile());
  }

  /**
   * Read the stored metadata.
   *
   * @return The metadata.
   * @throws IOException If the file cannot be read or decoded.
   */
  public TraceMetadata readMetadata() throws IOException {
    try (Reader reader = Files.newBufferedReader(metadataFile(), StandardCharsets.UTF_8)) {
      return TraceJsonDeserializer.readMetadata(reader);
    }
  }

  /**
   * Read the stored path table.
   *
   * @return The paths, where position equals path id.
   * @throws IOException If the file cannot be read or decoded.
   */
  public List<String> readPaths() throws IOException {
    return readPaths(pathsFile());
  }

  /**
   * Read the stored event stream.
   *
   * @return The events in log order.
   * @throws IOException If the file cannot be read or decoded.
   */
  public List<TraceLowLevelEvent> readEvents() throws IOException {
    return readEvents(eventsFile());
  }

  /**
   * Read a path table from any file.
   *
   * @param file The file.
   * @return The paths, where position equals path id.
   * @throws IOException If the file cannot be read or decoded.
   */
  public static List<String> readPaths(Path file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return TraceJsonDeserializer.readPaths(reader);
    }
  }

  /**
   * Read an event stream from any file.
   *
   * @param file The file.
   * @return The events in log order.
   * @throws IOException If the file cannot be read or decoded.
   */
  public static List<TraceLowLevelEvent> readEvents(Path file) throws IOException {
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return TraceJsonDeserializer.readEvents(reader);
    }
  }
}
