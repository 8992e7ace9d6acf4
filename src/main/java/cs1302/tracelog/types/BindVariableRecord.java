package cs1302.tracelog.types;

import java.util.Objects;

/**
 * Binds a variable to the place holding its value.
 *
 * @param variableId The variable.
 * @param place The place.
 */
public record BindVariableRecord(VariableId variableId, Place place) {
  public BindVariableRecord {
    Objects.requireNonNull(variableId, "variableId");
    Objects.requireNonNull(place, "place");
  }
}
