package cs1302.tracelog.types;

import java.util.Objects;

/**
 * A complete snapshot of a value bound to a variable.
 *
 * @param variableId The variable.
 * @param value The variable's value.
 */
public record FullValueRecord(VariableId variableId, ValueRecord value) {
  public FullValueRecord {
    Objects.requireNonNull(variableId, "variableId");
    Objects.requireNonNull(value, "value");
  }
}
