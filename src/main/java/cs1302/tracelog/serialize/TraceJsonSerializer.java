package cs1302.tracelog.serialize;

import cs1302.tracelog.types.FieldTypeRecord;
import cs1302.tracelog.types.FullValueRecord;
import cs1302.tracelog.types.PassBy;
import cs1302.tracelog.types.RValue;
import cs1302.tracelog.types.TraceLowLevelEvent;
import cs1302.tracelog.types.TraceMetadata;
import cs1302.tracelog.types.TypeRecord;
import cs1302.tracelog.types.TypeSpecificInfo;
import cs1302.tracelog.types.ValueRecord;
import cs1302.tracelog.types.VariableId;
import java.io.IOException;
import java.io.Writer;
import java.math.BigInteger;
import java.util.Base64;
import java.util.List;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Serializes the three trace artifacts (metadata, path table and event stream) to JSON.
 *
 * <p>Events are tagged externally by their kind ({@code {"Step": {...}}}, or the bare string
 * {@code "DropLastStep"}). Values, type refinements and rvalues are tagged internally with a
 * {@code "kind"} member. Ids are bare integers and enum kinds are their wire codes.
 *
 * @param indentFactor Spaces per nesting level when writing, 0 for single-line output.
 */
public record TraceJsonSerializer(int indentFactor) {

  /** Single-line output, used for the stored artifacts. */
  public static final TraceJsonSerializer COMPACT = new TraceJsonSerializer(0);

  /** Indented output for people. */
  public static final TraceJsonSerializer PRETTY = new TraceJsonSerializer(2);

  /**
   * Serialize run metadata.
   *
   * @param metadata The metadata.
   * @return The JSON object.
   */
  public JSONObject serializeMetadata(TraceMetadata metadata) {
    return new JSONObject()
        .put("workdir", metadata.workdir())
        .put("program", metadata.program())
        .put("args", new JSONArray(metadata.args()));
  }

  /**
   * Serialize the path table.
   *
   * @param paths The paths, where position equals path id.
   * @return The JSON array.
   */
  public JSONArray serializePaths(List<String> paths) {
    return new JSONArray(paths);
  }

  /**
   * Serialize an event stream.
   *
   * @param events The events in log order.
   * @return The JSON array.
   */
  public JSONArray serializeEvents(List<TraceLowLevelEvent> events) {
    JSONArray serialized = new JSONArray();
    EventSerializer eventSerializer = new EventSerializer();
    for (TraceLowLevelEvent event : events) {
      serialized.put(event.accept(eventSerializer));
    } // for
    return serialized;
  }

  /**
   * Serialize a single event.
   *
   * @param event The event.
   * @return A JSONObject with the event kind as its only key, or a String for events without
   *     payload.
   */
  public Object serializeEvent(TraceLowLevelEvent event) {
    return event.accept(new EventSerializer());
  }

  /**
   * Serialize a value.
   *
   * @param value The value.
   * @return The JSON object, tagged with {@code "kind"}.
   */
  public JSONObject serializeValue(ValueRecord value) {
    return value.accept(new ValueSerializer());
  }

  /**
   * Serialize a type record.
   *
   * @param type The type.
   * @return The JSON object.
   */
  public JSONObject serializeType(TypeRecord type) {
    return new JSONObject()
        .put("kind", type.kind().code())
        .put("lang_type", type.langType())
        .put("specific_info", serializeSpecificInfo(type.specificInfo()));
  }

  /**
   * Write serialized JSON, honoring this serializer's indentation.
   *
   * @param json A JSONObject or JSONArray produced by this serializer.
   * @param writer Where to write.
   * @throws IOException If writing failed.
   */
  public void write(Object json, Writer writer) throws IOException {
    if (json instanceof JSONObject object) {
      writer.write(object.toString(indentFactor));
    } else if (json instanceof JSONArray array) {
      writer.write(array.toString(indentFactor));
    } else {
      throw new IllegalArgumentException("Can only write JSONObject or JSONArray, got " + json);
    } // if
    writer.flush();
  }

  private JSONObject serializeSpecificInfo(TypeSpecificInfo info) {
    if (info instanceof TypeSpecificInfo.Struct struct) {
      JSONArray fields = new JSONArray();
      for (FieldTypeRecord field : struct.fields()) {
        fields.put(
            new JSONObject().put("name", field.name()).put("type_id", field.typeId().index()));
      }
      return new JSONObject().put("kind", "Struct").put("fields", fields);
    } else if (info instanceof TypeSpecificInfo.Pointer pointer) {
      return new JSONObject()
          .put("kind", "Pointer")
          .put("dereference_type_id", pointer.dereferenceTypeId().index());
    } else {
      return new JSONObject().put("kind", "None");
    } // if
  }

  private JSONObject serializeFullValue(FullValueRecord fullValue) {
    return new JSONObject()
        .put("variable_id", fullValue.variableId().index())
        .put("value", serializeValue(fullValue.value()));
  }

  private static JSONArray serializeVariableIds(List<VariableId> variableIds) {
    return new JSONArray(variableIds.stream().map(VariableId::index).toList());
  }

  private static JSONObject serializeRValue(RValue rvalue) {
    if (rvalue instanceof RValue.Simple simple) {
      return new JSONObject().put("kind", "Simple").put("variable", simple.variableId().index());
    } else {
      RValue.Compound compound = (RValue.Compound) rvalue;
      return new JSONObject()
          .put("kind", "Compound")
          .put("variables", serializeVariableIds(compound.variableIds()));
    } // if
  }

  /** Wraps each event payload in an object keyed by the event's kind. */
  private final class EventSerializer implements TraceLowLevelEvent.Visitor<Object> {

    private JSONObject tagged(TraceLowLevelEvent event, Object payload) {
      return new JSONObject().put(event.kindName(), payload);
    }

    @Override
    public Object visitStep(TraceLowLevelEvent.Step event) {
      return tagged(
          event,
          new JSONObject()
              .put("path_id", event.step().pathId().index())
              .put("line", event.step().line().line()));
    }

    @Override
    public Object visitPath(TraceLowLevelEvent.Path event) {
      return tagged(event, event.path());
    }

    @Override
    public Object visitVariableName(TraceLowLevelEvent.VariableName event) {
      return tagged(event, event.name());
    }

    @Override
    public Object visitVariable(TraceLowLevelEvent.Variable event) {
      return tagged(event, event.name());
    }

    @Override
    public Object visitType(TraceLowLevelEvent.Type event) {
      return tagged(event, serializeType(event.type()));
    }

    @Override
    public Object visitValue(TraceLowLevelEvent.Value event) {
      return tagged(event, serializeFullValue(event.value()));
    }

    @Override
    public Object visitFunction(TraceLowLevelEvent.Function event) {
      return tagged(
          event,
          new JSONObject()
              .put("path_id", event.function().pathId().index())
              .put("line", event.function().line().line())
              .put("name", event.function().name()));
    }

    @Override
    public Object visitCall(TraceLowLevelEvent.Call event) {
      JSONArray args = new JSONArray();
      event.call().args().forEach(arg -> args.put(serializeFullValue(arg)));
      return tagged(
          event,
          new JSONObject()
              .put("function_id", event.call().functionId().index())
              .put("args", args));
    }

    @Override
    public Object visitReturn(TraceLowLevelEvent.Return event) {
      return tagged(
          event,
          new JSONObject()
              .put("return_value", serializeValue(event.returnRecord().returnValue())));
    }

    @Override
    public Object visitEvent(TraceLowLevelEvent.Event event) {
      return tagged(
          event,
          new JSONObject()
              .put("kind", event.event().kind().code())
              .put("metadata", event.event().metadata())
              .put("content", event.event().content()));
    }

    @Override
    public Object visitAsm(TraceLowLevelEvent.Asm event) {
      return tagged(event, new JSONArray(event.instructions()));
    }

    @Override
    public Object visitBindVariable(TraceLowLevelEvent.BindVariable event) {
      return tagged(
          event,
          new JSONObject()
              .put("variable_id", event.binding().variableId().index())
              .put("place", event.binding().place().id()));
    }

    @Override
    public Object visitAssignment(TraceLowLevelEvent.Assignment event) {
      return tagged(
          event,
          new JSONObject()
              .put("to", event.assignment().to().index())
              .put("pass_by", event.assignment().passBy() == PassBy.VALUE ? "Value" : "Reference")
              .put("from", serializeRValue(event.assignment().from())));
    }

    @Override
    public Object visitDropVariables(TraceLowLevelEvent.DropVariables event) {
      return tagged(event, serializeVariableIds(event.variableIds()));
    }

    @Override
    public Object visitCompoundValue(TraceLowLevelEvent.CompoundValue event) {
      return tagged(
          event,
          new JSONObject()
              .put("place", event.compoundValue().place().id())
              .put("value", serializeValue(event.compoundValue().value())));
    }

    @Override
    public Object visitCellValue(TraceLowLevelEvent.CellValue event) {
      return tagged(
          event,
          new JSONObject()
              .put("place", event.cellValue().place().id())
              .put("value", serializeValue(event.cellValue().value())));
    }

    @Override
    public Object visitAssignCompoundItem(TraceLowLevelEvent.AssignCompoundItem event) {
      return tagged(
          event,
          new JSONObject()
              .put("place", event.assignment().place().id())
              .put("index", event.assignment().index())
              .put("item_place", event.assignment().itemPlace().id()));
    }

    @Override
    public Object visitAssignCell(TraceLowLevelEvent.AssignCell event) {
      return tagged(
          event,
          new JSONObject()
              .put("place", event.assignment().place().id())
              .put("new_value", serializeValue(event.assignment().newValue())));
    }

    @Override
    public Object visitVariableCell(TraceLowLevelEvent.VariableCell event) {
      return tagged(
          event,
          new JSONObject()
              .put("variable_id", event.binding().variableId().index())
              .put("place", event.binding().place().id()));
    }

    @Override
    public Object visitDropVariable(TraceLowLevelEvent.DropVariable event) {
      return tagged(event, event.variableId().index());
    }

    @Override
    public Object visitDropLastStep(TraceLowLevelEvent.DropLastStep event) {
      return event.kindName();
    }
  }

  /** Tags each value with its variant name under {@code "kind"}. */
  private final class ValueSerializer implements ValueRecord.Visitor<JSONObject> {

    private JSONObject typed(String kind, int typeId) {
      return new JSONObject().put("kind", kind).put("type_id", typeId);
    }

    private JSONArray all(List<ValueRecord> values) {
      JSONArray serialized = new JSONArray();
      values.forEach(v -> serialized.put(v.accept(this)));
      return serialized;
    }

    @Override
    public JSONObject visitInt(ValueRecord.Int value) {
      return typed("Int", value.typeId().index()).put("i", value.i());
    }

    @Override
    public JSONObject visitInt128(ValueRecord.Int128 value) {
      return typed("Int128", value.typeId().index()).put("i", value.i());
    }

    @Override
    public JSONObject visitFloat(ValueRecord.Float value) {
      double f = value.f();
      JSONObject serialized = typed("Float", value.typeId().index());
      // JSON has no literal for these
      if (Double.isNaN(f)) {
        return serialized.put("f", "NaN");
      } else if (f == Double.POSITIVE_INFINITY) {
        return serialized.put("f", "Infinity");
      } else if (f == Double.NEGATIVE_INFINITY) {
        return serialized.put("f", "-Infinity");
      } // if
      return serialized.put("f", f);
    }

    @Override
    public JSONObject visitBool(ValueRecord.Bool value) {
      return typed("Bool", value.typeId().index()).put("b", value.b());
    }

    @Override
    public JSONObject visitString(ValueRecord.String value) {
      return typed("String", value.typeId().index()).put("text", value.text());
    }

    @Override
    public JSONObject visitSequence(ValueRecord.Sequence value) {
      return typed("Sequence", value.typeId().index())
          .put("elements", all(value.elements()))
          .put("is_slice", value.isSlice());
    }

    @Override
    public JSONObject visitTuple(ValueRecord.Tuple value) {
      return typed("Tuple", value.typeId().index()).put("elements", all(value.elements()));
    }

    @Override
    public JSONObject visitStruct(ValueRecord.Struct value) {
      return typed("Struct", value.typeId().index())
          .put("field_values", all(value.fieldValues()));
    }

    @Override
    public JSONObject visitVariant(ValueRecord.Variant value) {
      return typed("Variant", value.typeId().index())
          .put("discriminator", value.discriminator())
          .put("contents", value.contents().accept(this));
    }

    @Override
    public JSONObject visitReference(ValueRecord.Reference value) {
      return typed("Reference", value.typeId().index())
          .put("dereferenced", value.dereferenced().accept(this))
          .put("address", new BigInteger(Long.toUnsignedString(value.address())))
          .put("mutable", value.mutable());
    }

    @Override
    public JSONObject visitRaw(ValueRecord.Raw value) {
      return typed("Raw", value.typeId().index()).put("r", value.r());
    }

    @Override
    public JSONObject visitError(ValueRecord.Error value) {
      return typed("Error", value.typeId().index()).put("msg", value.msg());
    }

    @Override
    public JSONObject visitNone(ValueRecord.None value) {
      return typed("None", value.typeId().index());
    }

    @Override
    public JSONObject visitCell(ValueRecord.Cell value) {
      return new JSONObject().put("kind", "Cell").put("place", value.place().id());
    }

    @Override
    public JSONObject visitBigInt(ValueRecord.BigInt value) {
      return typed("BigInt", value.typeId().index())
          .put("b", Base64.getEncoder().encodeToString(value.b()))
          .put("negative", value.negative());
    }
  }
}
