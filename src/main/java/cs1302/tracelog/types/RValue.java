package cs1302.tracelog.types;

import java.util.List;
import java.util.Objects;

/** The source side of an assignment. */
public sealed interface RValue {

  /** A value taken from a single variable. */
  record Simple(VariableId variableId) implements RValue {
    public Simple {
      Objects.requireNonNull(variableId, "variableId");
    }
  }

  /** A value built from several variables, e.g. a concatenation or a constructor call. */
  record Compound(List<VariableId> variableIds) implements RValue {
    public Compound {
      variableIds = List.copyOf(variableIds);
    }
  }
}
