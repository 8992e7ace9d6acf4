package cs1302.tracelog.types;

import java.util.Objects;

/**
 * Defines a scalar stored at a place.
 *
 * @param place The cell's place.
 * @param value The initial value.
 */
public record CellValueRecord(Place place, ValueRecord value) {
  public CellValueRecord {
    Objects.requireNonNull(place, "place");
    Objects.requireNonNull(value, "value");
  }
}
