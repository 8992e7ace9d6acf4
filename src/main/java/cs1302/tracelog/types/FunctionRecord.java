package cs1302.tracelog.types;

import java.util.Objects;

/**
 * A function table entry, anchored to its declaration site.
 *
 * @param pathId The path the function is declared in.
 * @param line The declaration line.
 * @param name The function's name. This is also its interning key.
 */
public record FunctionRecord(PathId pathId, Line line, String name) {
  public FunctionRecord {
    Objects.requireNonNull(pathId, "pathId");
    Objects.requireNonNull(line, "line");
    Objects.requireNonNull(name, "name");
  }
}
