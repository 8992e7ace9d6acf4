package cs1302.tracelog.check;

import cs1302.tracelog.trace.PlaceGraph;
import cs1302.tracelog.trace.ValueTypeCheck;
import cs1302.tracelog.types.CallKey;
import cs1302.tracelog.types.FullValueRecord;
import cs1302.tracelog.types.PathId;
import cs1302.tracelog.types.Place;
import cs1302.tracelog.types.RValue;
import cs1302.tracelog.types.TraceLowLevelEvent;
import cs1302.tracelog.types.TypeId;
import cs1302.tracelog.types.TypeRecord;
import cs1302.tracelog.types.ValueRecord;
import cs1302.tracelog.types.VariableId;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Checks a decoded event stream in one forward pass: every id and place must be defined before it
 * is used, values must match their types, and returns must match open calls.
 *
 * <p>Instances hold the state of a single pass; use {@link #validate} for one-shot checks.
 */
public final class TraceStreamValidator implements TraceLowLevelEvent.Visitor<Void> {

  /**
   * A problem found in the stream.
   *
   * @param index The position of the offending event.
   * @param message What is wrong with it.
   */
  public record Violation(int index, String message) {
    @Override
    public String toString() {
      return String.format("event %d: %s", index, message);
    }
  }

  /**
   * The outcome of a validation pass.
   *
   * @param violations Every problem found, in stream order.
   * @param events The number of events checked.
   * @param steps The number of steps not cancelled by a {@code DropLastStep}.
   * @param calls The number of calls.
   * @param maxDepth The deepest call nesting reached.
   * @param lastCall The key of the last call in the stream, or {@link CallKey#NO_KEY}.
   * @param openCalls The number of calls still open at the end of the stream.
   */
  public record Report(
      List<Violation> violations,
      int events,
      int steps,
      int calls,
      int maxDepth,
      CallKey lastCall,
      int openCalls) {

    public Report {
      violations = List.copyOf(violations);
    }

    /**
     * Check whether the stream passed.
     *
     * @return True if no violation was found.
     */
    public boolean isValid() {
      return violations.isEmpty();
    }
  }

  private final Optional<List<String>> pathTable;
  private final List<Violation> violations = new ArrayList<>();
  private final List<TypeRecord> types = new ArrayList<>();
  private final PlaceGraph placeGraph = new PlaceGraph();
  private final Deque<CallKey> openCalls = new ArrayDeque<>();

  private int index = 0;
  private int paths = 0;
  private int functions = 0;
  private int variables = 0;
  private int steps = 0;
  private int maxDepth = 0;
  private CallKey lastCall = CallKey.NO_KEY;

  private TraceStreamValidator(Optional<List<String>> pathTable) {
    this.pathTable = pathTable;
  }

  /**
   * Validate an event stream on its own.
   *
   * @param events The events in log order.
   * @return The report.
   */
  public static Report validate(List<TraceLowLevelEvent> events) {
    return run(events, Optional.empty());
  }

  /**
   * Validate an event stream against its stored path table. Each {@code Path} event must then
   * match the table entry with the same id.
   *
   * @param events The events in log order.
   * @param pathTable The stored paths.
   * @return The report.
   */
  public static Report validate(List<TraceLowLevelEvent> events, List<String> pathTable) {
    return run(events, Optional.of(pathTable));
  }

  private static Report run(List<TraceLowLevelEvent> events, Optional<List<String>> pathTable) {
    TraceStreamValidator validator = new TraceStreamValidator(pathTable);
    for (TraceLowLevelEvent event : events) {
      event.accept(validator);
      validator.index++;
    } // for
    if (pathTable.isPresent() && pathTable.get().size() != validator.paths) {
      validator.violations.add(
          new Violation(
              events.size(),
              String.format(
                  "path table has %d entries but the stream defines %d paths",
                  pathTable.get().size(), validator.paths)));
    } // if
    return new Report(
        validator.violations,
        events.size(),
        validator.steps,
        (int) (validator.lastCall.key() + 1),
        validator.maxDepth,
        validator.lastCall,
        validator.openCalls.size());
  }

  private void violation(String format, Object... args) {
    violations.add(new Violation(index, String.format(format, args)));
  }

  private void checkPath(PathId pathId) {
    if (pathId.index() >= paths) {
      violation("path id %d is used before it is defined", pathId.index());
    }
  }

  private void checkVariable(VariableId variableId) {
    if (variableId.index() >= variables) {
      violation("variable id %d is used before it is defined", variableId.index());
    }
  }

  private void checkValue(ValueRecord value) {
    ValueTypeCheck.findProblem(value, Collections.unmodifiableList(types))
        .ifPresent(problem -> violation("%s", problem));
  }

  private void checkPlace(Optional<String> problem, Runnable record) {
    if (problem.isPresent()) {
      violation("%s", problem.get());
    } else {
      record.run();
    }
  }

  @Override
  public Void visitStep(TraceLowLevelEvent.Step event) {
    checkPath(event.step().pathId());
    steps++;
    return null;
  }

  @Override
  public Void visitPath(TraceLowLevelEvent.Path event) {
    if (pathTable.isPresent()) {
      List<String> table = pathTable.get();
      if (paths >= table.size()) {
        violation("path %s is missing from the path table", event.path());
      } else if (!table.get(paths).equals(event.path())) {
        violation("path %d is %s in the stream but %s in the path table",
            paths, event.path(), table.get(paths));
      } // if
    } // if
    paths++;
    return null;
  }

  @Override
  public Void visitVariableName(TraceLowLevelEvent.VariableName event) {
    variables++;
    return null;
  }

  @Override
  public Void visitVariable(TraceLowLevelEvent.Variable event) {
    variables++;
    return null;
  }

  @Override
  public Void visitType(TraceLowLevelEvent.Type event) {
    for (TypeId referenced : event.type().specificInfo().referencedTypeIds()) {
      // self references get the id this event defines
      if (referenced.index() > types.size()) {
        violation("type %s refers to type id %d before it is defined",
            event.type().langType(), referenced.index());
      }
    } // for
    types.add(event.type());
    return null;
  }

  @Override
  public Void visitValue(TraceLowLevelEvent.Value event) {
    checkVariable(event.value().variableId());
    checkValue(event.value().value());
    return null;
  }

  @Override
  public Void visitFunction(TraceLowLevelEvent.Function event) {
    checkPath(event.function().pathId());
    functions++;
    return null;
  }

  @Override
  public Void visitCall(TraceLowLevelEvent.Call event) {
    if (event.call().functionId().index() >= functions) {
      violation("function id %d is called before it is defined",
          event.call().functionId().index());
    }
    for (FullValueRecord arg : event.call().args()) {
      checkVariable(arg.variableId());
      checkValue(arg.value());
    } // for
    lastCall = lastCall.next();
    openCalls.push(lastCall);
    maxDepth = Math.max(maxDepth, openCalls.size());
    return null;
  }

  @Override
  public Void visitReturn(TraceLowLevelEvent.Return event) {
    if (openCalls.isEmpty()) {
      violation("return without an open call");
    } else {
      openCalls.pop();
    } // if
    checkValue(event.returnRecord().returnValue());
    return null;
  }

  @Override
  public Void visitEvent(TraceLowLevelEvent.Event event) {
    return null;
  }

  @Override
  public Void visitAsm(TraceLowLevelEvent.Asm event) {
    return null;
  }

  @Override
  public Void visitBindVariable(TraceLowLevelEvent.BindVariable event) {
    checkVariable(event.binding().variableId());
    return null;
  }

  @Override
  public Void visitAssignment(TraceLowLevelEvent.Assignment event) {
    checkVariable(event.assignment().to());
    RValue from = event.assignment().from();
    if (from instanceof RValue.Simple simple) {
      checkVariable(simple.variableId());
    } else if (from instanceof RValue.Compound compound) {
      compound.variableIds().forEach(this::checkVariable);
    } // if
    return null;
  }

  @Override
  public Void visitDropVariables(TraceLowLevelEvent.DropVariables event) {
    event.variableIds().forEach(this::checkVariable);
    return null;
  }

  @Override
  public Void visitCompoundValue(TraceLowLevelEvent.CompoundValue event) {
    Place place = event.compoundValue().place();
    ValueRecord value = event.compoundValue().value();
    checkValue(value);
    checkPlace(
        placeGraph.checkCompoundValue(place, value),
        () -> placeGraph.recordCompoundValue(place, value));
    return null;
  }

  @Override
  public Void visitCellValue(TraceLowLevelEvent.CellValue event) {
    Place place = event.cellValue().place();
    ValueRecord value = event.cellValue().value();
    checkValue(value);
    checkPlace(
        placeGraph.checkCellValue(place, value), () -> placeGraph.recordCellValue(place, value));
    return null;
  }

  @Override
  public Void visitAssignCompoundItem(TraceLowLevelEvent.AssignCompoundItem event) {
    Place place = event.assignment().place();
    int itemIndex = event.assignment().index();
    Place itemPlace = event.assignment().itemPlace();
    checkPlace(
        placeGraph.checkAssignCompoundItem(place, itemIndex, itemPlace),
        () -> placeGraph.recordAssignCompoundItem(place, itemIndex, itemPlace));
    return null;
  }

  @Override
  public Void visitAssignCell(TraceLowLevelEvent.AssignCell event) {
    Place place = event.assignment().place();
    ValueRecord newValue = event.assignment().newValue();
    checkValue(newValue);
    checkPlace(
        placeGraph.checkAssignCell(place, newValue),
        () -> placeGraph.recordAssignCell(place, newValue));
    return null;
  }

  @Override
  public Void visitVariableCell(TraceLowLevelEvent.VariableCell event) {
    checkVariable(event.binding().variableId());
    if (!placeGraph.isKnown(event.binding().place())) {
      violation("place %d is bound before it is defined", event.binding().place().id());
    }
    return null;
  }

  @Override
  public Void visitDropVariable(TraceLowLevelEvent.DropVariable event) {
    checkVariable(event.variableId());
    return null;
  }

  @Override
  public Void visitDropLastStep(TraceLowLevelEvent.DropLastStep event) {
    if (steps == 0) {
      violation("DropLastStep without a step to drop");
    } else {
      steps--;
    } // if
    return null;
  }
}
