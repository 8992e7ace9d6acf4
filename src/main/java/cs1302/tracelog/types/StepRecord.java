package cs1302.tracelog.types;

import java.util.Objects;

/**
 * A location the program reached.
 *
 * @param pathId The source path.
 * @param line The line within that path.
 */
public record StepRecord(PathId pathId, Line line) {
  public StepRecord {
    Objects.requireNonNull(pathId, "pathId");
    Objects.requireNonNull(line, "line");
  }
}
