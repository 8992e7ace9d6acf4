package cs1302.tracelog.types;

/**
 * Index of a source path in the path table.
 *
 * @param index The position of the path in the order it was first registered.
 */
public record PathId(int index) {
  public PathId {
    if (index < 0) {
      throw new IllegalArgumentException("PathId must be non-negative");
    }
  }
}
