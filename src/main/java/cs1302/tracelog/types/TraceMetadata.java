package cs1302.tracelog.types;

import java.util.List;
import java.util.Objects;

/**
 * Describes the recorded run.
 *
 * @param workdir The working directory of the recorded program.
 * @param program The program that was recorded.
 * @param args The program's arguments.
 */
public record TraceMetadata(String workdir, String program, List<String> args) {
  public TraceMetadata {
    Objects.requireNonNull(workdir, "workdir");
    Objects.requireNonNull(program, "program");
    args = List.copyOf(args);
  }
}
