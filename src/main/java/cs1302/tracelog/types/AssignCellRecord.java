package cs1302.tracelog.types;

import java.util.Objects;

/**
 * Overwrites the value stored in a cell.
 *
 * @param place The cell's place.
 * @param newValue The value now stored there.
 */
public record AssignCellRecord(Place place, ValueRecord newValue) {
  public AssignCellRecord {
    Objects.requireNonNull(place, "place");
    Objects.requireNonNull(newValue, "newValue");
  }
}
