package cs1302.tracelog.types;

import java.util.Objects;

/**
 * Binds a variable name to a place, as opposed to a full value snapshot.
 *
 * @param variableId The variable.
 * @param place The place.
 */
public record VariableCellRecord(VariableId variableId, Place place) {
  public VariableCellRecord {
    Objects.requireNonNull(variableId, "variableId");
    Objects.requireNonNull(place, "place");
  }
}
