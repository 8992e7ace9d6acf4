package cs1302.tracelog.types;

import java.util.Objects;

/**
 * Rebinds one element of an aggregate to another place.
 *
 * @param place The aggregate's place.
 * @param index The element index.
 * @param itemPlace The place the element now refers to.
 */
public record AssignCompoundItemRecord(Place place, int index, Place itemPlace) {
  public AssignCompoundItemRecord {
    Objects.requireNonNull(place, "place");
    Objects.requireNonNull(itemPlace, "itemPlace");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative");
    }
  }
}
