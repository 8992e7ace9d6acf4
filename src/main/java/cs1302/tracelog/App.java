package cs1302.tracelog;

import cs1302.tracelog.check.TraceStreamValidator;
import cs1302.tracelog.check.TraceStreamValidator.Report;
import cs1302.tracelog.check.TraceStreamValidator.Violation;
import cs1302.tracelog.serialize.TraceFiles;
import cs1302.tracelog.serialize.TraceJsonDeserializer;
import cs1302.tracelog.serialize.TraceJsonSerializer;
import cs1302.tracelog.trace.EventDescriber;
import cs1302.tracelog.trace.Tracer;
import cs1302.tracelog.types.TraceLowLevelEvent;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.fusesource.jansi.Ansi;
import org.fusesource.jansi.AnsiConsole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Entry point for the trace log tools. */
@Command(name = "trace-log")
public class App {

  /** slf4j-simple reads this when a logger under {@code cs1302.tracelog} is created. */
  static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.cs1302.tracelog";

  public static void main(String[] args) throws Exception {
    int exitCode =
        new CommandLine(new App())
            .addSubcommand(new Validate())
            .addSubcommand(new Show())
            .addSubcommand(new Example())
            .addSubcommand(new ShowLicenses())
            .execute(args);

    System.exit(exitCode);
  } // main

  /** Base class that holds common CLI parameters. */
  @Command
  abstract static class CommandBase implements Callable<Integer> {
    @Option(
        names = {"--verbose", "-v"},
        description = "Output messages about what the tool is doing.")
    boolean verbose = false;

    @Option(
        names = {"--input", "-i"},
        description = "Input path to a trace event file (defaults to stdin if omitted).")
    File input = null;

    /** Created by {@link #configureLogging()}, after the level for this tool is known. */
    Logger logger;

    /**
     * Read and decode the event stream from {@code input}, or from stdin if {@code input} is
     * null.
     *
     * @return The decoded events.
     * @throws IOException If the input could not be read or is not a valid event stream.
     */
    protected List<TraceLowLevelEvent> readEvents() throws IOException {
      List<TraceLowLevelEvent> events;
      if (input == null) {
        // read stdin
        Reader stdin = new InputStreamReader(System.in, StandardCharsets.UTF_8);
        events = TraceJsonDeserializer.readEvents(stdin);
      } else {
        events = TraceFiles.readEvents(input.toPath());
      } // if
      logger.debug("Read {} events from {}", events.size(), input == null ? "stdin" : input);
      return events;
    } // readEvents

    /**
     * Raise the log level of this tool when {@code --verbose} is given and create the command's
     * logger. slf4j-simple fixes a logger's level when the logger is created, so this must run
     * before anything in the command logs.
     */
    protected void configureLogging() {
      if (verbose) {
        System.setProperty(LOG_LEVEL_PROPERTY, "debug");
      }
      logger = LoggerFactory.getLogger(getClass());
    }

    /**
     * Report a failed command the same way for every command.
     *
     * @param what What the command was trying to do.
     * @param cause Why it failed.
     * @return The exit code to use.
     */
    protected int fail(String what, Throwable cause) {
      System.err.println("Unable to " + what + "!");
      if (verbose) {
        logger.error("Unable to {}", what, cause);
      } else {
        System.err.println(cause.getMessage());
      } // if
      return 1;
    }
  }

  /** Check a trace event file for use-before-define and call nesting errors. */
  @Command(
      name = "validate",
      description = "Check that a trace event file can be read in one forward pass.",
      mixinStandardHelpOptions = true)
  static class Validate extends CommandBase {
    @Option(
        names = {"--paths", "-p"},
        description = "Path table written alongside the event file.")
    File paths = null;

    @Override
    public Integer call() {
      configureLogging();
      try {
        List<TraceLowLevelEvent> events = readEvents();
        Report report;
        if (paths == null) {
          report = TraceStreamValidator.validate(events);
        } else {
          logger.debug("Checking paths against {}", paths);
          report = TraceStreamValidator.validate(events, TraceFiles.readPaths(paths.toPath()));
        } // if

        if (report.isValid()) {
          System.out.printf(
              "OK: %d events, %d steps, %d calls, max depth %d%n",
              report.events(), report.steps(), report.calls(), report.maxDepth());
          return 0;
        } // if
        for (Violation violation : report.violations()) {
          System.out.println(violation);
        } // for
        return 1;
      } catch (IOException cause) {
        return fail("validate trace", cause);
      } // try
    }
  }

  /** Print the events of a trace event file. */
  @Command(
      name = "show",
      description = "Print the events of a trace event file, one per line.",
      mixinStandardHelpOptions = true)
  static class Show extends CommandBase {
    @Option(
        names = {"--json", "-j"},
        description = "Output the events as indented JSON instead.")
    boolean outputJson = false;

    @Override
    public Integer call() {
      configureLogging();
      try {
        List<TraceLowLevelEvent> events = readEvents();

        if (outputJson) {
          PrintWriter out = new PrintWriter(System.out, true, StandardCharsets.UTF_8);
          TraceJsonSerializer.PRETTY.write(TraceJsonSerializer.PRETTY.serializeEvents(events), out);
          out.println();
          return 0;
        } // if

        int digitLength = ((int) Math.log10(Math.max(events.size(), 1))) + 1;
        EventDescriber describer = new EventDescriber();
        StringBuilder listing = new StringBuilder();
        AnsiConsole.systemInstall();
        for (int i = 0; i < events.size(); i++) {
          TraceLowLevelEvent event = events.get(i);
          String line = String.format("%" + digitLength + "d | %s", i, describer.describe(event));
          if (EventDescriber.isDefinition(event)) {
            listing.append(Ansi.ansi().fgGreen().a(line).reset());
          } else {
            listing.append(line);
          } // if

          if (i < events.size() - 1) {
            listing.append('\n');
          } // if
        } // for
        AnsiConsole.systemUninstall();
        System.out.println(listing);
        return 0;
      } catch (IOException cause) {
        return fail("show trace", cause);
      } // try
    }
  }

  /** Record the built-in example session and store it. */
  @Command(
      name = "example",
      description = "Record a small example session and write its trace files.",
      mixinStandardHelpOptions = true)
  static class Example implements Callable<Integer> {
    @Option(
        names = {"--output-dir", "-o"},
        description = "Directory to write the trace files to.",
        required = true)
    File outputDir;

    @Option(
        names = {"--source", "-s"},
        description = "Source path to record for the example program.")
    String source = "example.py";

    @Override
    public Integer call() {
      Tracer tracer = ExampleTrace.record(Path.of(source).toAbsolutePath());
      TraceFiles files = new TraceFiles(outputDir.toPath());
      try {
        files.write(tracer);
      } catch (IOException cause) {
        System.err.println("Unable to write trace files!");
        System.err.println(cause.getMessage());
        return 1;
      } // try
      System.out.printf("Wrote %d events to %s%n", tracer.events().size(), files.eventsFile());
      return 0;
    }
  }

  /** Print dependency licenses to console. */
  @Command(
      name = "show-licenses",
      description = "Show the licenses for projects used in this program and then exit.",
      mixinStandardHelpOptions = true)
  static class ShowLicenses implements Runnable {
    @Override
    public void run() {
      System.out.println(
          """
          This program includes and uses several open source projects.
          \tJansi (https://fusesource.github.io/jansi/)
          \tJSON-Java (https://github.com/stleary/JSON-java)
          \tPicocli (https://picocli.info/)
          \tSLF4J (https://www.slf4j.org/)
          Jansi and picocli are licensed under the Apache License 2.0
          (https://www.apache.org/licenses/LICENSE-2.0). SLF4J is licensed under the MIT
          License. JSON-Java has been dedicated to the public domain. Thank you to the authors
          and contributors of those projects!
          """);
    }
  }
}
