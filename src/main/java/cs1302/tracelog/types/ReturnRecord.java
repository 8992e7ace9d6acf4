package cs1302.tracelog.types;

import java.util.Objects;

/**
 * Exit from the innermost open call.
 *
 * @param returnValue The returned value.
 */
public record ReturnRecord(ValueRecord returnValue) {
  public ReturnRecord {
    Objects.requireNonNull(returnValue, "returnValue");
  }
}
