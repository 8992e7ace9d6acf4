package cs1302.tracelog.types;

/**
 * Index of a function in the function table. Id 0 is always the toplevel frame.
 *
 * @param index The position of the function in the order it was first registered.
 */
public record FunctionId(int index) {
  public FunctionId {
    if (index < 0) {
      throw new IllegalArgumentException("FunctionId must be non-negative");
    }
  }
}
