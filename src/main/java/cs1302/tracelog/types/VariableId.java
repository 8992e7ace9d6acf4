package cs1302.tracelog.types;

/**
 * Index of a variable name in the variable table.
 *
 * @param index The position of the name in the order it was first registered.
 */
public record VariableId(int index) {
  public VariableId {
    if (index < 0) {
      throw new IllegalArgumentException("VariableId must be non-negative");
    }
  }
}
