package cs1302.tracelog.types;

/**
 * Index of a type in the type table. Id 0 is always the "none" type.
 *
 * @param index The position of the type in the order it was first registered.
 */
public record TypeId(int index) {
  public TypeId {
    if (index < 0) {
      throw new IllegalArgumentException("TypeId must be non-negative");
    }
  }
}
