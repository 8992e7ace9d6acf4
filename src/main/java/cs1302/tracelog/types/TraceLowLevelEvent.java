package cs1302.tracelog.types;

import java.util.List;
import java.util.Objects;

/**
 * A single entry of the trace event log.
 *
 * <p>Definition events ({@link Path}, {@link Function}, {@link Type}, {@link VariableName}) always
 * precede the first event that uses the id they define, so the log can be consumed in one
 * forward pass.
 */
public sealed interface TraceLowLevelEvent {

  /** The single {@link DropLastStep} instance. */
  TraceLowLevelEvent DROP_LAST_STEP = new DropLastStep();

  /**
   * Dispatch on the kind of this event.
   *
   * @param visitor The visitor to call.
   * @param <R> The visitor's result type.
   * @return Whatever the visitor returned.
   */
  <R> R accept(Visitor<R> visitor);

  /**
   * The name this kind of event is tagged with in serialized form.
   *
   * @return The event's kind name.
   */
  default String kindName() {
    return getClass().getSimpleName();
  }

  /**
   * One method per event kind.
   *
   * @param <R> The result type.
   */
  interface Visitor<R> {
    R visitStep(Step event);

    R visitPath(Path event);

    R visitVariableName(VariableName event);

    R visitVariable(Variable event);

    R visitType(Type event);

    R visitValue(Value event);

    R visitFunction(Function event);

    R visitCall(Call event);

    R visitReturn(Return event);

    R visitEvent(Event event);

    R visitAsm(Asm event);

    R visitBindVariable(BindVariable event);

    R visitAssignment(Assignment event);

    R visitDropVariables(DropVariables event);

    R visitCompoundValue(CompoundValue event);

    R visitCellValue(CellValue event);

    R visitAssignCompoundItem(AssignCompoundItem event);

    R visitAssignCell(AssignCell event);

    R visitVariableCell(VariableCell event);

    R visitDropVariable(DropVariable event);

    R visitDropLastStep(DropLastStep event);
  }

  /** A location reached by the program. */
  record Step(StepRecord step) implements TraceLowLevelEvent {
    public Step {
      Objects.requireNonNull(step, "step");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStep(this);
    }
  }

  /** Defines the next path id. */
  record Path(String path) implements TraceLowLevelEvent {
    public Path {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPath(this);
    }
  }

  /** Defines the next variable id. */
  record VariableName(String name) implements TraceLowLevelEvent {
    public VariableName {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVariableName(this);
    }
  }

  /** Older spelling of {@link VariableName}. Read for compatibility, never emitted. */
  record Variable(String name) implements TraceLowLevelEvent {
    public Variable {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVariable(this);
    }
  }

  /** Defines the next type id. */
  record Type(TypeRecord type) implements TraceLowLevelEvent {
    public Type {
      Objects.requireNonNull(type, "type");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitType(this);
    }
  }

  /** A full value snapshot bound to a variable. */
  record Value(FullValueRecord value) implements TraceLowLevelEvent {
    public Value {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitValue(this);
    }
  }

  /** Defines the next function id. */
  record Function(FunctionRecord function) implements TraceLowLevelEvent {
    public Function {
      Objects.requireNonNull(function, "function");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFunction(this);
    }
  }

  /** Entry into a function. */
  record Call(CallRecord call) implements TraceLowLevelEvent {
    public Call {
      Objects.requireNonNull(call, "call");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** Exit from the innermost open call. */
  record Return(ReturnRecord returnRecord) implements TraceLowLevelEvent {
    public Return {
      Objects.requireNonNull(returnRecord, "returnRecord");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReturn(this);
    }
  }

  /** An I/O or log side effect. */
  record Event(RecordEvent event) implements TraceLowLevelEvent {
    public Event {
      Objects.requireNonNull(event, "event");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEvent(this);
    }
  }

  /** Raw instruction text for the current step. Advisory only. */
  record Asm(List<String> instructions) implements TraceLowLevelEvent {
    public Asm {
      instructions = List.copyOf(instructions);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAsm(this);
    }
  }

  // history events
  record BindVariable(BindVariableRecord binding) implements TraceLowLevelEvent {
    public BindVariable {
      Objects.requireNonNull(binding, "binding");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBindVariable(this);
    }
  }

  record Assignment(AssignmentRecord assignment) implements TraceLowLevelEvent {
    public Assignment {
      Objects.requireNonNull(assignment, "assignment");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignment(this);
    }
  }

  record DropVariables(List<VariableId> variableIds) implements TraceLowLevelEvent {
    public DropVariables {
      variableIds = List.copyOf(variableIds);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDropVariables(this);
    }
  }

  // structural value tracking, places may alias and be mutated in place
  record CompoundValue(CompoundValueRecord compoundValue) implements TraceLowLevelEvent {
    public CompoundValue {
      Objects.requireNonNull(compoundValue, "compoundValue");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCompoundValue(this);
    }
  }

  record CellValue(CellValueRecord cellValue) implements TraceLowLevelEvent {
    public CellValue {
      Objects.requireNonNull(cellValue, "cellValue");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCellValue(this);
    }
  }

  record AssignCompoundItem(AssignCompoundItemRecord assignment) implements TraceLowLevelEvent {
    public AssignCompoundItem {
      Objects.requireNonNull(assignment, "assignment");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignCompoundItem(this);
    }
  }

  record AssignCell(AssignCellRecord assignment) implements TraceLowLevelEvent {
    public AssignCell {
      Objects.requireNonNull(assignment, "assignment");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitAssignCell(this);
    }
  }

  record VariableCell(VariableCellRecord binding) implements TraceLowLevelEvent {
    public VariableCell {
      Objects.requireNonNull(binding, "binding");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVariableCell(this);
    }
  }

  record DropVariable(VariableId variableId) implements TraceLowLevelEvent {
    public DropVariable {
      Objects.requireNonNull(variableId, "variableId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDropVariable(this);
    }
  }

  /** Cancels the most recent step without removing it from the log. */
  record DropLastStep() implements TraceLowLevelEvent {
    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitDropLastStep(this);
    }
  }
}
