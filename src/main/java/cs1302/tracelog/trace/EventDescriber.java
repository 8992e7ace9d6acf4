package cs1302.tracelog.trace;

import cs1302.tracelog.types.AssignCellRecord;
import cs1302.tracelog.types.AssignCompoundItemRecord;
import cs1302.tracelog.types.CellValueRecord;
import cs1302.tracelog.types.CompoundValueRecord;
import cs1302.tracelog.types.FullValueRecord;
import cs1302.tracelog.types.PathId;
import cs1302.tracelog.types.RValue;
import cs1302.tracelog.types.TraceLowLevelEvent;
import cs1302.tracelog.types.VariableCellRecord;
import cs1302.tracelog.types.VariableId;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Describes events one line at a time, resolving ids to the names defined earlier in the same
 * stream and cells to the values stored at their places.
 *
 * <p>Events must be described in log order, since each definition event extends the tables used
 * for later ones.
 */
public final class EventDescriber implements TraceLowLevelEvent.Visitor<String> {

  private final List<String> paths = new ArrayList<>();
  private final List<String> functions = new ArrayList<>();
  private final List<String> variables = new ArrayList<>();
  private final List<String> types = new ArrayList<>();
  private final PlaceGraph placeGraph = new PlaceGraph();

  /**
   * Describe the next event of the stream.
   *
   * @param event The event.
   * @return A one-line description.
   */
  public String describe(TraceLowLevelEvent event) {
    return event.accept(this);
  }

  /**
   * Check whether an event defines a table entry.
   *
   * @param event The event.
   * @return True for path, function, type and variable name definitions.
   */
  public static boolean isDefinition(TraceLowLevelEvent event) {
    return event instanceof TraceLowLevelEvent.Path
        || event instanceof TraceLowLevelEvent.Function
        || event instanceof TraceLowLevelEvent.Type
        || event instanceof TraceLowLevelEvent.VariableName
        || event instanceof TraceLowLevelEvent.Variable;
  }

  private static String lookup(List<String> table, int index) {
    return index < table.size() ? table.get(index) : "#" + index;
  }

  private String path(PathId pathId) {
    return lookup(paths, pathId.index());
  }

  private String variable(VariableId variableId) {
    return lookup(variables, variableId.index());
  }

  private String variables(List<VariableId> variableIds) {
    return variableIds.stream().map(this::variable).collect(Collectors.joining(", "));
  }

  private String binding(FullValueRecord fullValue) {
    return variable(fullValue.variableId()) + " = " + placeGraph.render(fullValue.value());
  }

  @Override
  public String visitStep(TraceLowLevelEvent.Step event) {
    return String.format("Step %s:%d", path(event.step().pathId()), event.step().line().line());
  }

  @Override
  public String visitPath(TraceLowLevelEvent.Path event) {
    paths.add(event.path());
    return String.format("Path #%d %s", paths.size() - 1, event.path());
  }

  @Override
  public String visitVariableName(TraceLowLevelEvent.VariableName event) {
    variables.add(event.name());
    return String.format("VariableName #%d %s", variables.size() - 1, event.name());
  }

  @Override
  public String visitVariable(TraceLowLevelEvent.Variable event) {
    variables.add(event.name());
    return String.format("Variable #%d %s", variables.size() - 1, event.name());
  }

  @Override
  public String visitType(TraceLowLevelEvent.Type event) {
    types.add(event.type().langType());
    return String.format(
        "Type #%d %s (%s)", types.size() - 1, event.type().langType(), event.type().kind());
  }

  @Override
  public String visitValue(TraceLowLevelEvent.Value event) {
    return "Value " + binding(event.value());
  }

  @Override
  public String visitFunction(TraceLowLevelEvent.Function event) {
    functions.add(event.function().name());
    return String.format(
        "Function #%d %s at %s:%d",
        functions.size() - 1,
        event.function().name(),
        path(event.function().pathId()),
        event.function().line().line());
  }

  @Override
  public String visitCall(TraceLowLevelEvent.Call event) {
    return String.format(
        "Call %s(%s)",
        lookup(functions, event.call().functionId().index()),
        event.call().args().stream().map(this::binding).collect(Collectors.joining(", ")));
  }

  @Override
  public String visitReturn(TraceLowLevelEvent.Return event) {
    return "Return " + placeGraph.render(event.returnRecord().returnValue());
  }

  @Override
  public String visitEvent(TraceLowLevelEvent.Event event) {
    return String.format("Event %s %s", event.event().kind(), event.event().content());
  }

  @Override
  public String visitAsm(TraceLowLevelEvent.Asm event) {
    return "Asm " + String.join("; ", event.instructions());
  }

  @Override
  public String visitBindVariable(TraceLowLevelEvent.BindVariable event) {
    return String.format(
        "BindVariable %s @%d", variable(event.binding().variableId()),
        event.binding().place().id());
  }

  @Override
  public String visitAssignment(TraceLowLevelEvent.Assignment event) {
    RValue from = event.assignment().from();
    String source;
    if (from instanceof RValue.Simple simple) {
      source = variable(simple.variableId());
    } else {
      source = "[" + variables(((RValue.Compound) from).variableIds()) + "]";
    } // if
    return String.format(
        "Assignment %s <- %s by %s",
        variable(event.assignment().to()), source, event.assignment().passBy());
  }

  @Override
  public String visitDropVariables(TraceLowLevelEvent.DropVariables event) {
    return "DropVariables " + variables(event.variableIds());
  }

  @Override
  public String visitCompoundValue(TraceLowLevelEvent.CompoundValue event) {
    CompoundValueRecord record = event.compoundValue();
    if (placeGraph.checkCompoundValue(record.place(), record.value()).isEmpty()) {
      placeGraph.recordCompoundValue(record.place(), record.value());
    }
    return String.format(
        "CompoundValue @%d = %s", record.place().id(), placeGraph.render(record.value()));
  }

  @Override
  public String visitCellValue(TraceLowLevelEvent.CellValue event) {
    CellValueRecord record = event.cellValue();
    if (placeGraph.checkCellValue(record.place(), record.value()).isEmpty()) {
      placeGraph.recordCellValue(record.place(), record.value());
    }
    return String.format(
        "CellValue @%d = %s", record.place().id(), placeGraph.render(record.value()));
  }

  @Override
  public String visitAssignCompoundItem(TraceLowLevelEvent.AssignCompoundItem event) {
    AssignCompoundItemRecord record = event.assignment();
    if (placeGraph.checkAssignCompoundItem(record.place(), record.index(), record.itemPlace())
        .isEmpty()) {
      placeGraph.recordAssignCompoundItem(record.place(), record.index(), record.itemPlace());
    }
    return String.format(
        "AssignCompoundItem @%d[%d] = @%d",
        record.place().id(), record.index(), record.itemPlace().id());
  }

  @Override
  public String visitAssignCell(TraceLowLevelEvent.AssignCell event) {
    AssignCellRecord record = event.assignment();
    if (placeGraph.checkAssignCell(record.place(), record.newValue()).isEmpty()) {
      placeGraph.recordAssignCell(record.place(), record.newValue());
    }
    return String.format(
        "AssignCell @%d = %s", record.place().id(), placeGraph.render(record.newValue()));
  }

  @Override
  public String visitVariableCell(TraceLowLevelEvent.VariableCell event) {
    VariableCellRecord record = event.binding();
    String rendered =
        placeGraph.valueAt(record.place()).map(placeGraph::render).orElse("<unset>");
    return String.format(
        "VariableCell %s @%d = %s",
        variable(record.variableId()), record.place().id(), rendered);
  }

  @Override
  public String visitDropVariable(TraceLowLevelEvent.DropVariable event) {
    return "DropVariable " + variable(event.variableId());
  }

  @Override
  public String visitDropLastStep(TraceLowLevelEvent.DropLastStep event) {
    return "DropLastStep";
  }
}
