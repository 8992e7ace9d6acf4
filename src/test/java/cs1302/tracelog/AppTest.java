package cs1302.tracelog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.tracelog.App.CommandBase;
import cs1302.tracelog.serialize.TraceFiles;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.skyscreamer.jsonassert.JSONAssert;
import org.skyscreamer.jsonassert.JSONCompareMode;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/** Tests for the trace-log command line. */
public class AppTest {

  private static final String SMALL_TRACE =
      """
      [
        {"Path": "/a.py"},
        {"Function": {"path_id": 0, "line": 1, "name": "<toplevel>"}},
        {"Call": {"function_id": 0, "args": []}},
        {"Type": {"kind": 30, "lang_type": "None", "specific_info": {"kind": "None"}}},
        {"Step": {"path_id": 0, "line": 3}},
        "DropLastStep"
      ]
      """;

  @TempDir
  Path tempDir;

  /**
   * Execute a command with a trace event file as input and command-line arguments, and get the
   * command's standard output.
   *
   * @param commandSupplier A supplier for the command you want to run.
   * @param trace A string containing the trace events you want to give to the command.
   * @param options The command-line arguments you want to pass to the command. Do not include
   *     -i/--input.
   * @return The standard output of the command, or empty if command execution failed.
   */
  static <T extends CommandBase> Optional<String> executeCommand(
      Supplier<T> commandSupplier, String trace, String... options) {
    File tempFile = null;
    try {
      tempFile = File.createTempFile("trace-log", ".json");
      tempFile.deleteOnExit();
      Files.writeString(tempFile.toPath(), trace);

      ArrayList<String> args = new ArrayList<>();
      args.addAll(Arrays.asList(options));
      args.add("--input=" + tempFile.getCanonicalPath());
      return captureStdout(commandSupplier.get(), args.toArray(String[]::new));
    } catch (IOException e) {
      return Optional.empty();
    } finally {
      if (tempFile != null) {
        tempFile.delete();
      }
    }
  }

  /**
   * Run a command and capture what it prints.
   *
   * @param command The command to run.
   * @param args Its command-line arguments.
   * @return The standard output of the command, or empty if it exited with a non-zero code.
   */
  static Optional<String> captureStdout(Callable<Integer> command, String... args) {
    // picocli's setOut only covers usage and version output, so swap the JVM stream instead.
    // this requires tests to run sequentially, which is the default for junit.
    PrintStream originalOut = System.out;
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    boolean ranSuccessfully = false;
    try {
      System.setOut(new PrintStream(baos, true, StandardCharsets.UTF_8));
      ranSuccessfully = new CommandLine(command).execute(args) == 0;
    } finally {
      System.setOut(originalOut);
    }
    return ranSuccessfully ? Optional.of(baos.toString(StandardCharsets.UTF_8)) : Optional.empty();
  }

  /** Ensure that a well-formed trace is reported as valid along with its counts. */
  @Test
  public void testValidateAcceptsTrace() {
    String output = executeCommand(App.Validate::new, SMALL_TRACE).get();
    assertEquals("OK: 6 events, 0 steps, 1 calls, max depth 1", output.strip());
  }

  /** Ensure that violations are listed and fail the command. */
  @Test
  public void testValidateRejectsBrokenTrace() {
    String broken =
        """
        [
          {"Step": {"path_id": 0, "line": 3}},
          {"Return": {"return_value": {"kind": "None", "type_id": 0}}}
        ]
        """;
    assertTrue(executeCommand(App.Validate::new, broken).isEmpty());
  }

  /** Ensure that unreadable input fails the command instead of crashing. */
  @Test
  public void testValidateRejectsMalformedInput() {
    assertTrue(executeCommand(App.Validate::new, "[{\"Step\": 3}]").isEmpty());
    assertTrue(executeCommand(App.Show::new, "not json at all").isEmpty());
  }

  /** Ensure that --verbose turns on debug logging for loggers the command creates. */
  @Test
  public void testVerboseEnablesDebugLogging() {
    try {
      assertFalse(LoggerFactory.getLogger("cs1302.tracelog.BeforeVerbose").isDebugEnabled());

      assertTrue(executeCommand(App.Validate::new, SMALL_TRACE, "--verbose").isPresent());

      assertTrue(LoggerFactory.getLogger("cs1302.tracelog.AfterVerbose").isDebugEnabled());
    } finally {
      System.clearProperty(App.LOG_LEVEL_PROPERTY);
    }
  }

  /** Ensure that JSON output is the normalized event stream. */
  @Test
  public void testShowJson() {
    String output = executeCommand(App.Show::new, SMALL_TRACE, "--json").get();
    JSONAssert.assertEquals(SMALL_TRACE, output, JSONCompareMode.STRICT_ORDER);
  }

  /** Ensure that the listing has one numbered line per event with names resolved. */
  @Test
  public void testShowListing() {
    String output = executeCommand(App.Show::new, SMALL_TRACE).get();
    String[] lines = output.strip().split("\n");
    assertEquals(6, lines.length);
    assertEquals("4 | Step /a.py:3", lines[4]);
    assertEquals("5 | DropLastStep", lines[5]);
    assertTrue(lines[0].contains("Path #0 /a.py"));
  }

  /** Ensure that the example session is written and passes validation with its path table. */
  @Test
  public void testExampleThenValidate() throws IOException {
    Path out = tempDir.resolve("example");
    String output =
        captureStdout(new App.Example(), "--output-dir", out.toString(), "--source", "/w/ex.py")
            .get();
    assertTrue(output.startsWith("Wrote 28 events"), output);

    TraceFiles files = new TraceFiles(out);
    String validation =
        executeCommand(
                App.Validate::new,
                Files.readString(files.eventsFile()),
                "--paths",
                files.pathsFile().toString())
            .get();
    assertEquals("OK: 28 events, 6 steps, 2 calls, max depth 2", validation.strip());
    assertEquals("[\"/w/ex.py\"]", Files.readString(files.pathsFile()));
  }
}
