package cs1302.tracelog.serialize;

import cs1302.tracelog.types.AssignCellRecord;
import cs1302.tracelog.types.AssignCompoundItemRecord;
import cs1302.tracelog.types.AssignmentRecord;
import cs1302.tracelog.types.BindVariableRecord;
import cs1302.tracelog.types.CallRecord;
import cs1302.tracelog.types.CellValueRecord;
import cs1302.tracelog.types.CompoundValueRecord;
import cs1302.tracelog.types.EventLogKind;
import cs1302.tracelog.types.FieldTypeRecord;
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
import cs1302.tracelog.types.TypeSpecificInfo;
import cs1302.tracelog.types.ValueRecord;
import cs1302.tracelog.types.VariableCellRecord;
import cs1302.tracelog.types.VariableId;
import java.io.Reader;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/** Reads the JSON written by {@link TraceJsonSerializer} back into trace records. */
public final class TraceJsonDeserializer {

  private TraceJsonDeserializer() {}

  /**
   * Read run metadata.
   *
   * @param reader The JSON source.
   * @return The metadata.
   * @throws TraceFormatException If the input is not valid metadata.
   */
  public static TraceMetadata readMetadata(Reader reader) throws TraceFormatException {
    try {
      return parseMetadata(new JSONObject(new JSONTokener(reader)));
    } catch (JSONException | IllegalArgumentException e) {
      throw new TraceFormatException("Invalid trace metadata: " + e.getMessage(), e);
    }
  }

  /**
   * Read a path table.
   *
   * @param reader The JSON source.
   * @return The paths, where position equals path id.
   * @throws TraceFormatException If the input is not a JSON array of strings.
   */
  public static List<String> readPaths(Reader reader) throws TraceFormatException {
    try {
      JSONArray array = new JSONArray(new JSONTokener(reader));
      List<String> paths = new ArrayList<>(array.length());
      for (int i = 0; i < array.length(); i++) {
        paths.add(array.getString(i));
      }
      return paths;
    } catch (JSONException e) {
      throw new TraceFormatException("Invalid trace paths: " + e.getMessage(), e);
    }
  }

  /**
   * Read an event stream.
   *
   * @param reader The JSON source.
   * @return The events in log order.
   * @throws TraceFormatException If any event cannot be decoded. The message names its index.
   */
  public static List<TraceLowLevelEvent> readEvents(Reader reader) throws TraceFormatException {
    JSONArray array;
    try {
      array = new JSONArray(new JSONTokener(reader));
    } catch (JSONException e) {
      throw new TraceFormatException("Invalid trace events: " + e.getMessage(), e);
    }
    List<TraceLowLevelEvent> events = new ArrayList<>(array.length());
    for (int i = 0; i < array.length(); i++) {
      try {
        events.add(parseEvent(array.get(i)));
      } catch (JSONException | IllegalArgumentException e) {
        throw new TraceFormatException(
            String.format("Invalid trace event at index %d: %s", i, e.getMessage()), e);
      }
    } // for
    return events;
  }

  /**
   * Decode one serialized event.
   *
   * @param json A JSONObject with the event kind as its single key, or the kind name as a String.
   * @return The event.
   * @throws JSONException If a member is missing or has the wrong type.
   * @throws IllegalArgumentException If the event kind is unknown or a field is out of range.
   */
  public static TraceLowLevelEvent parseEvent(Object json) {
    if (json instanceof String kind) {
      if (kind.equals("DropLastStep")) {
        return TraceLowLevelEvent.DROP_LAST_STEP;
      }
      throw new IllegalArgumentException("Unknown event kind " + kind);
    }
    if (!(json instanceof JSONObject object) || object.length() != 1) {
      throw new IllegalArgumentException("An event must be an object with exactly one key");
    }
    String kind = object.keys().next();
    return switch (kind) {
      case "Step" -> new TraceLowLevelEvent.Step(parseStep(object.getJSONObject(kind)));
      case "Path" -> new TraceLowLevelEvent.Path(object.getString(kind));
      case "VariableName" -> new TraceLowLevelEvent.VariableName(object.getString(kind));
      case "Variable" -> new TraceLowLevelEvent.Variable(object.getString(kind));
      case "Type" -> new TraceLowLevelEvent.Type(parseType(object.getJSONObject(kind)));
      case "Value" -> new TraceLowLevelEvent.Value(parseFullValue(object.getJSONObject(kind)));
      case "Function" ->
          new TraceLowLevelEvent.Function(parseFunction(object.getJSONObject(kind)));
      case "Call" -> new TraceLowLevelEvent.Call(parseCall(object.getJSONObject(kind)));
      case "Return" -> new TraceLowLevelEvent.Return(
          new ReturnRecord(parseValue(object.getJSONObject(kind).getJSONObject("return_value"))));
      case "Event" -> new TraceLowLevelEvent.Event(parseRecordEvent(object.getJSONObject(kind)));
      case "Asm" -> new TraceLowLevelEvent.Asm(parseStrings(object.getJSONArray(kind)));
      case "BindVariable" -> {
        JSONObject payload = object.getJSONObject(kind);
        yield new TraceLowLevelEvent.BindVariable(
            new BindVariableRecord(variableId(payload, "variable_id"), place(payload, "place")));
      }
      case "Assignment" ->
          new TraceLowLevelEvent.Assignment(parseAssignment(object.getJSONObject(kind)));
      case "DropVariables" ->
          new TraceLowLevelEvent.DropVariables(parseVariableIds(object.getJSONArray(kind)));
      case "CompoundValue" -> {
        JSONObject payload = object.getJSONObject(kind);
        yield new TraceLowLevelEvent.CompoundValue(
            new CompoundValueRecord(
                place(payload, "place"), parseValue(payload.getJSONObject("value"))));
      }
      case "CellValue" -> {
        JSONObject payload = object.getJSONObject(kind);
        yield new TraceLowLevelEvent.CellValue(
            new CellValueRecord(
                place(payload, "place"), parseValue(payload.getJSONObject("value"))));
      }
      case "AssignCompoundItem" -> {
        JSONObject payload = object.getJSONObject(kind);
        yield new TraceLowLevelEvent.AssignCompoundItem(
            new AssignCompoundItemRecord(
                place(payload, "place"), payload.getInt("index"), place(payload, "item_place")));
      }
      case "AssignCell" -> {
        JSONObject payload = object.getJSONObject(kind);
        yield new TraceLowLevelEvent.AssignCell(
            new AssignCellRecord(
                place(payload, "place"), parseValue(payload.getJSONObject("new_value"))));
      }
      case "VariableCell" -> {
        JSONObject payload = object.getJSONObject(kind);
        yield new TraceLowLevelEvent.VariableCell(
            new VariableCellRecord(variableId(payload, "variable_id"), place(payload, "place")));
      }
      case "DropVariable" ->
          new TraceLowLevelEvent.DropVariable(new VariableId(object.getInt(kind)));
      default -> throw new IllegalArgumentException("Unknown event kind " + kind);
    };
  }

  /**
   * Decode one serialized value.
   *
   * @param json The value object, tagged with {@code "kind"}.
   * @return The value.
   * @throws JSONException If a member is missing or has the wrong type.
   * @throws IllegalArgumentException If the value kind is unknown.
   */
  public static ValueRecord parseValue(JSONObject json) {
    String kind = json.getString("kind");
    if (kind.equals("Cell")) {
      return new ValueRecord.Cell(place(json, "place"));
    }
    TypeId typeId = new TypeId(json.getInt("type_id"));
    return switch (kind) {
      case "Int" -> new ValueRecord.Int(json.getLong("i"), typeId);
      case "Int128" -> new ValueRecord.Int128(json.getBigInteger("i"), typeId);
      case "Float" -> new ValueRecord.Float(parseDouble(json.get("f")), typeId);
      case "Bool" -> new ValueRecord.Bool(json.getBoolean("b"), typeId);
      case "String" -> new ValueRecord.String(json.getString("text"), typeId);
      case "Sequence" -> new ValueRecord.Sequence(
          parseValues(json.getJSONArray("elements")), json.getBoolean("is_slice"), typeId);
      case "Tuple" -> new ValueRecord.Tuple(parseValues(json.getJSONArray("elements")), typeId);
      case "Struct" ->
          new ValueRecord.Struct(parseValues(json.getJSONArray("field_values")), typeId);
      case "Variant" -> new ValueRecord.Variant(
          json.getString("discriminator"), parseValue(json.getJSONObject("contents")), typeId);
      case "Reference" -> new ValueRecord.Reference(
          parseValue(json.getJSONObject("dereferenced")),
          unsignedLong(json, "address"),
          json.getBoolean("mutable"),
          typeId);
      case "Raw" -> new ValueRecord.Raw(json.getString("r"), typeId);
      case "Error" -> new ValueRecord.Error(json.getString("msg"), typeId);
      case "None" -> new ValueRecord.None(typeId);
      case "BigInt" -> new ValueRecord.BigInt(
          Base64.getDecoder().decode(json.getString("b")), json.getBoolean("negative"), typeId);
      default -> throw new IllegalArgumentException("Unknown value kind " + kind);
    };
  }

  /**
   * Decode one serialized type record.
   *
   * @param json The type object.
   * @return The type.
   * @throws JSONException If a member is missing or has the wrong type.
   * @throws IllegalArgumentException If the type kind code is unknown.
   */
  public static TypeRecord parseType(JSONObject json) {
    return new TypeRecord(
        TypeKind.fromCode(json.getInt("kind")),
        json.getString("lang_type"),
        parseSpecificInfo(json.getJSONObject("specific_info")));
  }

  private static TypeSpecificInfo parseSpecificInfo(JSONObject json) {
    String kind = json.getString("kind");
    return switch (kind) {
      case "None" -> TypeSpecificInfo.NONE;
      case "Struct" -> {
        JSONArray fields = json.getJSONArray("fields");
        List<FieldTypeRecord> parsed = new ArrayList<>(fields.length());
        for (int i = 0; i < fields.length(); i++) {
          JSONObject field = fields.getJSONObject(i);
          parsed.add(new FieldTypeRecord(field.getString("name"), typeId(field, "type_id")));
        }
        yield new TypeSpecificInfo.Struct(parsed);
      }
      case "Pointer" -> new TypeSpecificInfo.Pointer(typeId(json, "dereference_type_id"));
      default -> throw new IllegalArgumentException("Unknown type info kind " + kind);
    };
  }

  private static TraceMetadata parseMetadata(JSONObject json) {
    return new TraceMetadata(
        json.getString("workdir"),
        json.getString("program"),
        parseStrings(json.getJSONArray("args")));
  }

  private static StepRecord parseStep(JSONObject json) {
    return new StepRecord(new PathId(json.getInt("path_id")), new Line(json.getLong("line")));
  }

  private static FunctionRecord parseFunction(JSONObject json) {
    return new FunctionRecord(
        new PathId(json.getInt("path_id")), new Line(json.getLong("line")), json.getString("name"));
  }

  private static CallRecord parseCall(JSONObject json) {
    JSONArray args = json.getJSONArray("args");
    List<FullValueRecord> parsed = new ArrayList<>(args.length());
    for (int i = 0; i < args.length(); i++) {
      parsed.add(parseFullValue(args.getJSONObject(i)));
    }
    return new CallRecord(new FunctionId(json.getInt("function_id")), parsed);
  }

  private static FullValueRecord parseFullValue(JSONObject json) {
    return new FullValueRecord(
        variableId(json, "variable_id"), parseValue(json.getJSONObject("value")));
  }

  private static RecordEvent parseRecordEvent(JSONObject json) {
    return new RecordEvent(
        EventLogKind.fromCode(json.getInt("kind")),
        json.optString("metadata", ""),
        json.getString("content"));
  }

  private static AssignmentRecord parseAssignment(JSONObject json) {
    String passBy = json.getString("pass_by");
    PassBy parsedPassBy;
    if (passBy.equals("Value")) {
      parsedPassBy = PassBy.VALUE;
    } else if (passBy.equals("Reference")) {
      parsedPassBy = PassBy.REFERENCE;
    } else {
      throw new IllegalArgumentException("Unknown pass_by " + passBy);
    } // if

    JSONObject from = json.getJSONObject("from");
    String kind = from.getString("kind");
    RValue rvalue;
    if (kind.equals("Simple")) {
      rvalue = new RValue.Simple(variableId(from, "variable"));
    } else if (kind.equals("Compound")) {
      rvalue = new RValue.Compound(parseVariableIds(from.getJSONArray("variables")));
    } else {
      throw new IllegalArgumentException("Unknown rvalue kind " + kind);
    } // if
    return new AssignmentRecord(variableId(json, "to"), parsedPassBy, rvalue);
  }

  private static List<ValueRecord> parseValues(JSONArray array) {
    List<ValueRecord> values = new ArrayList<>(array.length());
    for (int i = 0; i < array.length(); i++) {
      values.add(parseValue(array.getJSONObject(i)));
    }
    return values;
  }

  private static List<VariableId> parseVariableIds(JSONArray array) {
    List<VariableId> ids = new ArrayList<>(array.length());
    for (int i = 0; i < array.length(); i++) {
      ids.add(new VariableId(array.getInt(i)));
    }
    return ids;
  }

  private static List<String> parseStrings(JSONArray array) {
    List<String> strings = new ArrayList<>(array.length());
    for (int i = 0; i < array.length(); i++) {
      strings.add(array.getString(i));
    }
    return strings;
  }

  private static double parseDouble(Object json) {
    if (json instanceof String special) {
      return switch (special) {
        case "NaN" -> Double.NaN;
        case "Infinity" -> Double.POSITIVE_INFINITY;
        case "-Infinity" -> Double.NEGATIVE_INFINITY;
        default -> throw new IllegalArgumentException("Unknown float literal " + special);
      };
    }
    if (json instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException("Expected a number, got " + json);
  }

  private static long unsignedLong(JSONObject json, String key) {
    BigInteger value = json.getBigInteger(key);
    if (value.signum() < 0 || value.bitLength() > Long.SIZE) {
      throw new IllegalArgumentException(
          String.format("%s %s is not an unsigned 64-bit value", key, value));
    }
    return value.longValue();
  }

  private static VariableId variableId(JSONObject json, String key) {
    return new VariableId(json.getInt(key));
  }

  private static TypeId typeId(JSONObject json, String key) {
    return new TypeId(json.getInt(key));
  }

  private static Place place(JSONObject json, String key) {
    return new Place(json.getLong(key));
  }
}
