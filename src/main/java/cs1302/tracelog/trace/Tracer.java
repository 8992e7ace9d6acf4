package cs1302.tracelog.trace;

import cs1302.tracelog.serialize.TraceJsonSerializer;
import cs1302.tracelog.types.AssignCellRecord;
import cs1302.tracelog.types.AssignCompoundItemRecord;
import cs1302.tracelog.types.AssignmentRecord;
import cs1302.tracelog.types.BindVariableRecord;
import cs1302.tracelog.types.CallRecord;
import cs1302.tracelog.types.CellValueRecord;
import cs1302.tracelog.types.CompoundValueRecord;
import cs1302.tracelog.types.EventLogKind;
import cs1302.tracelog.types.FullValueRecord;
import cs1302.tracelog.types.FunctionId;
import cs1302.tracelog.types.FunctionRecord;
import cs1302.tracelog.types.Line;
import cs1302.tracelog.types.PassBy;
import cs1302.tracelog.types.PathId;
import cs1302.tracelog.types.Place;
import cs1302.tracelog.types.RValue;
import cs1302.tracelog.types.RecordEvent;
import cs1302.tracelog.types.ReturnRecord;
import cs1302.tracelog.types.StepRecord;
import cs1302.tracelog.types.TraceLowLevelEvent;
import cs1302.tracelog.types.TraceMetadata;
import cs1302.tracelog.types.TypeId;
import cs1302.tracelog.types.TypeKind;
import cs1302.tracelog.types.TypeRecord;
import cs1302.tracelog.types.ValueRecord;
import cs1302.tracelog.types.VariableCellRecord;
import cs1302.tracelog.types.VariableId;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a trace event log, one event-emitting call at a time.
 *
 * <p>The tracer owns the path, function, variable and type tables of a session. Every id it hands
 * out is defined by an event appended before the id is first used, so the resulting log can be
 * read in a single forward pass. Calls that would break that guarantee (using an id or place that
 * was never defined, or anything before {@link #start}) are bugs in the instrumentation feeding
 * the tracer and fail immediately with an {@link IllegalStateException} or
 * {@link IllegalArgumentException}; nothing is appended in that case.
 *
 * <p>A tracer is meant to be driven by exactly one thread.
 */
public class Tracer {

  private static final Logger LOGGER = LoggerFactory.getLogger(Tracer.class);
  private static final TraceJsonSerializer SERIALIZER = TraceJsonSerializer.COMPACT;

  /** The "none" type, always the first type of a session. */
  public static final TypeId NONE_TYPE_ID = new TypeId(0);

  /** The absent value, typed with {@link #NONE_TYPE_ID}. */
  public static final ValueRecord NONE_VALUE = new ValueRecord.None(NONE_TYPE_ID);

  /** The synthetic outermost function, always the first function of a session. */
  public static final FunctionId TOP_LEVEL_FUNCTION_ID = new FunctionId(0);

  /** Name under which the toplevel function is registered. */
  public static final String TOP_LEVEL_FUNCTION_NAME = "<toplevel>";

  private final TraceMetadata metadata;
  private final List<TraceLowLevelEvent> events = new ArrayList<>();

  private final InternTable<String, PathId> paths = new InternTable<>(PathId::new);
  private final InternTable<String, FunctionId> functions = new InternTable<>(FunctionId::new);
  private final InternTable<String, VariableId> variables = new InternTable<>(VariableId::new);
  private final InternTable<String, TypeId> types = new InternTable<>(TypeId::new);

  // indexed by FunctionId, used for the step that precedes each call
  private final List<FunctionRecord> functionRecords = new ArrayList<>();
  // indexed by TypeId
  private final List<TypeRecord> typeRecords = new ArrayList<>();
  private final PlaceGraph placeGraph = new PlaceGraph();

  private boolean started = false;

  /**
   * Create a tracer for a program running in the current working directory.
   *
   * @param program The recorded program.
   * @param args The recorded program's arguments.
   */
  public Tracer(String program, List<String> args) {
    this(System.getProperty("user.dir"), program, args);
  }

  /**
   * Create a tracer.
   *
   * @param workdir The working directory of the recorded program.
   * @param program The recorded program.
   * @param args The recorded program's arguments.
   */
  public Tracer(String workdir, String program, List<String> args) {
    this.metadata = new TraceMetadata(workdir, program, args);
  }

  /**
   * Begin the session: registers and calls the toplevel function and registers the "none" type.
   * Must be called exactly once, before anything else.
   *
   * @param path The path of the recorded program's entry point.
   * @param line The line execution starts at.
   * @throws IllegalStateException If the session was already started.
   */
  public void start(Path path, Line line) {
    if (started) {
      throw new IllegalStateException("start() must be called exactly once");
    }
    started = true;
    LOGGER.debug("Starting trace of {} at {}:{}", metadata.program(), path, line.line());

    FunctionId functionId = ensureFunctionId(TOP_LEVEL_FUNCTION_NAME, path, line);
    registerCall(functionId, List.of());
    if (!functionId.equals(TOP_LEVEL_FUNCTION_ID)) {
      throw new IllegalStateException("toplevel function must have id 0, got " + functionId);
    }

    // other base types are left to the caller, languages differ too much to hardcode them
    TypeId noneTypeId = ensureTypeId(TypeKind.NONE, "None");
    if (!noneTypeId.equals(NONE_TYPE_ID)) {
      throw new IllegalStateException("none type must have id 0, got " + noneTypeId);
    }
  }

  // ids

  /**
   * Get the id of a path, defining it if it is new.
   *
   * @param path The path. It is normalized before lookup.
   * @return The path's id.
   */
  public PathId ensurePathId(Path path) {
    requireStarted();
    return paths.ensureId(
        path.normalize().toString(),
        id -> events.add(new TraceLowLevelEvent.Path(paths.keyAt(id.index()))));
  }

  /**
   * Get the id of a function, defining it (and its path) if it is new.
   *
   * <p>Functions are keyed by name alone. A second function with the same name but a different
   * declaration site shares the first one's id and declaration site.
   *
   * @param name The function's name.
   * @param path The path the function is declared in.
   * @param line The declaration line.
   * @return The function's id.
   */
  public FunctionId ensureFunctionId(String name, Path path, Line line) {
    requireStarted();
    FunctionId functionId =
        functions.ensureId(name, id -> emitFunction(name, ensurePathId(path), line));
    FunctionRecord known = functionRecords.get(functionId.index());
    boolean sameSite =
        known.line().equals(line)
            && paths.find(path.normalize().toString()).map(known.pathId()::equals).orElse(false);
    if (!sameSite) {
      LOGGER.debug(
          "Function {} declared at line {} is aliased by a function of the same name at {}:{}",
          name, known.line().line(), path, line.line());
    }
    return functionId;
  }

  /**
   * Get the id of a type, defining it if it is new. Types defined this way carry no structural
   * info; use {@link #ensureRawTypeId} for structs and pointers.
   *
   * @param kind The type's category.
   * @param langType The type's name in the recorded language.
   * @return The type's id.
   */
  public TypeId ensureTypeId(TypeKind kind, String langType) {
    return ensureRawTypeId(new TypeRecord(kind, langType));
  }

  /**
   * Get the id of a type, defining it with its full record if it is new.
   *
   * @param type The type. Its {@code langType} is the lookup key.
   * @return The type's id.
   * @throws IllegalArgumentException If the type's refinement names unknown types.
   */
  public TypeId ensureRawTypeId(TypeRecord type) {
    requireStarted();
    Optional<TypeId> existing = types.find(type.langType());
    if (existing.isPresent()) {
      return existing.get();
    }
    checkRefinement(type);
    return types.ensureId(type.langType(), id -> emitType(type));
  }

  /**
   * Get the id of a variable name, defining it if it is new.
   *
   * @param name The variable's name.
   * @return The variable's id.
   */
  public VariableId ensureVariableId(String name) {
    requireStarted();
    return variables.ensureId(name, id -> events.add(new TraceLowLevelEvent.VariableName(name)));
  }

  // explicit definitions

  /**
   * Define a new path.
   *
   * @param path The path.
   * @return The new path's id.
   * @throws IllegalStateException If the path is already defined.
   */
  public PathId registerPath(Path path) {
    requireNew(paths, path.normalize().toString(), "path");
    return ensurePathId(path);
  }

  /**
   * Define a new function.
   *
   * @param name The function's name.
   * @param path The path the function is declared in.
   * @param line The declaration line.
   * @return The new function's id.
   * @throws IllegalStateException If a function with that name is already defined.
   */
  public FunctionId registerFunction(String name, Path path, Line line) {
    requireNew(functions, name, "function");
    return ensureFunctionId(name, path, line);
  }

  /**
   * Define a new type without structural info.
   *
   * @param kind The type's category.
   * @param langType The type's name in the recorded language.
   * @return The new type's id.
   * @throws IllegalStateException If a type with that name is already defined.
   */
  public TypeId registerType(TypeKind kind, String langType) {
    requireNew(types, langType, "type");
    return ensureTypeId(kind, langType);
  }

  /**
   * Define a new variable name.
   *
   * @param name The variable's name.
   * @return The new variable's id.
   * @throws IllegalStateException If the name is already defined.
   */
  public VariableId registerVariableName(String name) {
    requireNew(variables, name, "variable");
    return ensureVariableId(name);
  }

  // control flow

  /**
   * Record that execution reached a location.
   *
   * @param path The path.
   * @param line The line.
   */
  public void registerStep(Path path, Line line) {
    PathId pathId = ensurePathId(path);
    events.add(new TraceLowLevelEvent.Step(new StepRecord(pathId, line)));
  }

  /**
   * Record a call. For any function other than the toplevel one, this first records each argument
   * as a full value and then a step at the callee's declaration site, so the emitted sequence is
   * {@code Value(arg0) ... Value(argN) Step(declaration) Call}.
   *
   * @param functionId The callee, as returned by {@link #ensureFunctionId}.
   * @param args The arguments, e.g. built with {@link #arg}.
   * @throws IllegalArgumentException If the function or an argument's type is unknown.
   */
  public void registerCall(FunctionId functionId, List<FullValueRecord> args) {
    requireStarted();
    if (!functions.hasIndex(functionId.index())) {
      throw new IllegalArgumentException(
          String.format("function id %d was never registered", functionId.index()));
    }
    for (FullValueRecord arg : args) {
      requireVariable(arg.variableId());
      requireWellTyped(arg.value());
    }

    if (!functionId.equals(TOP_LEVEL_FUNCTION_ID)) {
      for (FullValueRecord arg : args) {
        events.add(new TraceLowLevelEvent.Value(arg));
      }
      FunctionRecord function = functionRecords.get(functionId.index());
      events.add(
          new TraceLowLevelEvent.Step(new StepRecord(function.pathId(), function.line())));
    } // if
    events.add(new TraceLowLevelEvent.Call(new CallRecord(functionId, args)));
  }

  /**
   * Build a call argument, defining the parameter name if it is new.
   *
   * @param name The parameter's name.
   * @param value The argument's value.
   * @return The argument record to pass to {@link #registerCall}.
   */
  public FullValueRecord arg(String name, ValueRecord value) {
    return new FullValueRecord(ensureVariableId(name), value);
  }

  /**
   * Record a return from the innermost open call.
   *
   * @param returnValue The returned value, {@link #NONE_VALUE} for none.
   */
  public void registerReturn(ValueRecord returnValue) {
    requireStarted();
    requireWellTyped(returnValue);
    events.add(new TraceLowLevelEvent.Return(new ReturnRecord(returnValue)));
  }

  /**
   * Record an I/O or log side effect.
   *
   * @param kind What happened.
   * @param content The payload, e.g. written text.
   */
  public void registerSpecialEvent(EventLogKind kind, String content) {
    registerSpecialEvent(kind, "", content);
  }

  /**
   * Record an I/O or log side effect with extra metadata.
   *
   * @param kind What happened.
   * @param metadata Free-form extra data.
   * @param content The payload, e.g. written text.
   */
  public void registerSpecialEvent(EventLogKind kind, String metadata, String content) {
    requireStarted();
    events.add(new TraceLowLevelEvent.Event(new RecordEvent(kind, metadata, content)));
  }

  /**
   * Record the machine instructions of the current step.
   *
   * @param instructions The instructions as text.
   */
  public void registerAsm(List<String> instructions) {
    requireStarted();
    events.add(new TraceLowLevelEvent.Asm(instructions));
  }

  /**
   * Cancel the most recently recorded step. The step stays in the log; a marker is appended.
   */
  public void dropLastStep() {
    requireStarted();
    events.add(TraceLowLevelEvent.DROP_LAST_STEP);
  }

  // full values

  /**
   * Record a variable's complete value.
   *
   * @param name The variable's name.
   * @param value The value.
   */
  public void registerVariableWithFullValue(String name, ValueRecord value) {
    requireStarted();
    requireWellTyped(value);
    registerFullValue(ensureVariableId(name), value);
  }

  /**
   * Record a complete value for an already defined variable.
   *
   * @param variableId The variable.
   * @param value The value.
   */
  public void registerFullValue(VariableId variableId, ValueRecord value) {
    requireStarted();
    requireVariable(variableId);
    requireWellTyped(value);
    events.add(new TraceLowLevelEvent.Value(new FullValueRecord(variableId, value)));
  }

  // places

  /**
   * Define an aggregate at a place. Elements that are {@link ValueRecord.Cell}s refer to other
   * places and become assignable with {@link #assignCell}.
   *
   * @param place The aggregate's place.
   * @param value A sequence, tuple or struct.
   */
  public void registerCompoundValue(Place place, ValueRecord value) {
    requireStarted();
    requireWellTyped(value);
    requireValid(placeGraph.checkCompoundValue(place, value));
    placeGraph.recordCompoundValue(place, value);
    events.add(new TraceLowLevelEvent.CompoundValue(new CompoundValueRecord(place, value)));
  }

  /**
   * Define a scalar cell at a place.
   *
   * @param place The cell's place.
   * @param value The cell's value.
   */
  public void registerCellValue(Place place, ValueRecord value) {
    requireStarted();
    requireWellTyped(value);
    requireValid(placeGraph.checkCellValue(place, value));
    placeGraph.recordCellValue(place, value);
    events.add(new TraceLowLevelEvent.CellValue(new CellValueRecord(place, value)));
  }

  /**
   * Rebind one element of an aggregate to another place.
   *
   * @param place A place defined by {@link #registerCompoundValue}.
   * @param index The element to rebind.
   * @param itemPlace A defined place the element will refer to.
   */
  public void assignCompoundItem(Place place, int index, Place itemPlace) {
    requireStarted();
    requireValid(placeGraph.checkAssignCompoundItem(place, index, itemPlace));
    placeGraph.recordAssignCompoundItem(place, index, itemPlace);
    events.add(
        new TraceLowLevelEvent.AssignCompoundItem(
            new AssignCompoundItemRecord(place, index, itemPlace)));
  }

  /**
   * Overwrite the value stored in a cell.
   *
   * @param place A place defined by {@link #registerCellValue} or bound as a compound element.
   * @param newValue The value now stored there.
   */
  public void assignCell(Place place, ValueRecord newValue) {
    requireStarted();
    requireWellTyped(newValue);
    requireValid(placeGraph.checkAssignCell(place, newValue));
    placeGraph.recordAssignCell(place, newValue);
    events.add(new TraceLowLevelEvent.AssignCell(new AssignCellRecord(place, newValue)));
  }

  /**
   * Bind a variable to a place.
   *
   * @param name The variable's name.
   * @param place A place defined by a cell or compound value.
   */
  public void registerVariable(String name, Place place) {
    requireStarted();
    if (!placeGraph.isKnown(place)) {
      throw new IllegalStateException(
          String.format("place %d was never defined", place.id()));
    }
    VariableId variableId = ensureVariableId(name);
    events.add(new TraceLowLevelEvent.VariableCell(new VariableCellRecord(variableId, place)));
  }

  /**
   * Retire a variable's binding.
   *
   * @param name The variable's name.
   */
  public void dropVariable(String name) {
    events.add(new TraceLowLevelEvent.DropVariable(ensureVariableId(name)));
  }

  // history

  /**
   * Record that a variable now lives at a place.
   *
   * @param name The variable's name.
   * @param place The place, as identified by the recorded language.
   */
  public void bindVariable(String name, Place place) {
    VariableId variableId = ensureVariableId(name);
    events.add(new TraceLowLevelEvent.BindVariable(new BindVariableRecord(variableId, place)));
  }

  /**
   * Build the source of an assignment from one variable.
   *
   * @param name The source variable.
   * @return The rvalue.
   */
  public RValue simpleRValue(String name) {
    return new RValue.Simple(ensureVariableId(name));
  }

  /**
   * Build the source of an assignment from several variables.
   *
   * @param names The source variables.
   * @return The rvalue.
   */
  public RValue compoundRValue(List<String> names) {
    List<VariableId> variableIds = new ArrayList<>(names.size());
    for (String name : names) {
      variableIds.add(ensureVariableId(name));
    }
    return new RValue.Compound(variableIds);
  }

  /**
   * Record an assignment or parameter pass.
   *
   * @param to The receiving variable's name.
   * @param from Where the value came from, see {@link #simpleRValue} and {@link #compoundRValue}.
   * @param passBy Whether the value was copied or shared.
   */
  public void assign(String to, RValue from, PassBy passBy) {
    VariableId toId = ensureVariableId(to);
    if (from instanceof RValue.Simple simple) {
      requireVariable(simple.variableId());
    } else if (from instanceof RValue.Compound compound) {
      compound.variableIds().forEach(this::requireVariable);
    } // if
    events.add(new TraceLowLevelEvent.Assignment(new AssignmentRecord(toId, passBy, from)));
  }

  /**
   * Retire several variables at once, e.g. at the end of a scope.
   *
   * @param names The variables' names.
   */
  public void dropVariables(List<String> names) {
    List<VariableId> variableIds = new ArrayList<>(names.size());
    for (String name : names) {
      variableIds.add(ensureVariableId(name));
    }
    events.add(new TraceLowLevelEvent.DropVariables(variableIds));
  }

  // state

  /**
   * Get the events recorded so far.
   *
   * @return An unmodifiable view of the log.
   */
  public List<TraceLowLevelEvent> events() {
    return Collections.unmodifiableList(events);
  }

  /**
   * Get the path table.
   *
   * @return The normalized paths, where position equals path id index.
   */
  public List<String> paths() {
    return paths.keys();
  }

  /**
   * Get the run description.
   *
   * @return The metadata given at construction.
   */
  public TraceMetadata metadata() {
    return metadata;
  }

  /**
   * Get a registered type.
   *
   * @param typeId A type id handed out by this tracer.
   * @return The type's record.
   */
  public TypeRecord type(TypeId typeId) {
    return typeRecords.get(typeId.index());
  }

  /**
   * Get the place graph built from the structural events so far.
   *
   * @return The place graph.
   */
  public PlaceGraph placeGraph() {
    return placeGraph;
  }

  // sinks

  /**
   * Write the run metadata.
   *
   * @param writer Where to write.
   * @throws IOException If writing failed. The log is unaffected and may be written again.
   */
  public void writeTraceMetadata(Writer writer) throws IOException {
    SERIALIZER.write(SERIALIZER.serializeMetadata(metadata), writer);
  }

  /**
   * Write the path table.
   *
   * @param writer Where to write.
   * @throws IOException If writing failed. The log is unaffected and may be written again.
   */
  public void writeTracePaths(Writer writer) throws IOException {
    SERIALIZER.write(SERIALIZER.serializePaths(paths()), writer);
  }

  /**
   * Write the event stream.
   *
   * @param writer Where to write.
   * @throws IOException If writing failed. The log is unaffected and may be written again.
   */
  public void writeTraceEvents(Writer writer) throws IOException {
    SERIALIZER.write(SERIALIZER.serializeEvents(events), writer);
  }

  /**
   * Write the run metadata to a file.
   *
   * @param file The file to create or replace.
   * @throws IOException If writing failed.
   */
  public void storeTraceMetadata(Path file) throws IOException {
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      writeTraceMetadata(writer);
    }
    LOGGER.debug("Wrote trace metadata to {}", file);
  }

  /**
   * Write the path table to a file.
   *
   * @param file The file to create or replace.
   * @throws IOException If writing failed.
   */
  public void storeTracePaths(Path file) throws IOException {
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      writeTracePaths(writer);
    }
    LOGGER.debug("Wrote {} paths to {}", paths.size(), file);
  }

  /**
   * Write the event stream to a file.
   *
   * @param file The file to create or replace.
   * @throws IOException If writing failed.
   */
  public void storeTraceEvents(Path file) throws IOException {
    try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
      writeTraceEvents(writer);
    }
    LOGGER.debug("Wrote {} events to {}", events.size(), file);
  }

  private void emitFunction(String name, PathId pathId, Line line) {
    FunctionRecord function = new FunctionRecord(pathId, line, name);
    functionRecords.add(function);
    events.add(new TraceLowLevelEvent.Function(function));
  }

  private void emitType(TypeRecord type) {
    typeRecords.add(type);
    events.add(new TraceLowLevelEvent.Type(type));
  }

  private void checkRefinement(TypeRecord type) {
    for (TypeId typeId : type.specificInfo().referencedTypeIds()) {
      // a struct may refer to itself, which will get the next id
      if (typeId.index() > types.size()) {
        throw new IllegalArgumentException(
            String.format("type %s refers to type id %d which was never registered",
                type.langType(), typeId.index()));
      }
    }
  }

  private void requireStarted() {
    if (!started) {
      throw new IllegalStateException("start() must be called before recording anything");
    }
  }

  private void requireNew(InternTable<String, ?> table, String key, String what) {
    requireStarted();
    if (table.find(key).isPresent()) {
      throw new IllegalStateException(String.format("%s %s is already registered", what, key));
    }
  }

  private void requireVariable(VariableId variableId) {
    if (!variables.hasIndex(variableId.index())) {
      throw new IllegalArgumentException(
          String.format("variable id %d was never registered", variableId.index()));
    }
  }

  private void requireWellTyped(ValueRecord value) {
    ValueTypeCheck.findProblem(value, typeRecords)
        .ifPresent(
            problem -> {
              throw new IllegalArgumentException(problem);
            });
  }

  private static void requireValid(Optional<String> problem) {
    if (problem.isPresent()) {
      throw new IllegalStateException(problem.get());
    }
  }
}
