package cs1302.tracelog.types;

import java.util.Objects;

/**
 * An assignment or parameter pass between variables.
 *
 * @param to The receiving variable.
 * @param passBy Whether the value was copied or shared.
 * @param from Where the value came from.
 */
public record AssignmentRecord(VariableId to, PassBy passBy, RValue from) {
  public AssignmentRecord {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(passBy, "passBy");
    Objects.requireNonNull(from, "from");
  }
}
