package cs1302.tracelog.types;

import java.util.List;
import java.util.Objects;

/**
 * Entry into a function. Calls carry no key or parent; nesting follows from the order of calls
 * and returns.
 *
 * @param functionId The callee.
 * @param args The arguments, in declaration order.
 */
public record CallRecord(FunctionId functionId, List<FullValueRecord> args) {
  public CallRecord {
    Objects.requireNonNull(functionId, "functionId");
    args = List.copyOf(args);
  }
}
