package cs1302.tracelog.types;

import java.util.Objects;

/**
 * Defines an aggregate stored at a place. Its elements may be {@link ValueRecord.Cell}s pointing
 * at other places.
 *
 * @param place The aggregate's place.
 * @param value The aggregate.
 */
public record CompoundValueRecord(Place place, ValueRecord value) {
  public CompoundValueRecord {
    Objects.requireNonNull(place, "place");
    Objects.requireNonNull(value, "value");
  }
}
