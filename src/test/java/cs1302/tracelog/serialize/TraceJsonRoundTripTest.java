package cs1302.tracelog.serialize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

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
import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.math.BigInteger;
import java.util.List;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.skyscreamer.jsonassert.JSONAssert;
import org.skyscreamer.jsonassert.JSONCompareMode;

/** Tests for {@link TraceJsonSerializer} and {@link TraceJsonDeserializer}. */
public class TraceJsonRoundTripTest {

  private static final TypeId T = new TypeId(1);
  private static final VariableId V = new VariableId(0);

  private static String write(Object json) throws IOException {
    StringWriter out = new StringWriter();
    TraceJsonSerializer.COMPACT.write(json, out);
    return out.toString();
  }

  private static String eventJson(TraceLowLevelEvent event) {
    return TraceJsonSerializer.COMPACT.serializeEvent(event).toString();
  }

  /** Ensure that every event kind and value variant survives a write and read. */
  @Test
  public void testEveryEventKindRoundTrips() throws IOException {
    ValueRecord nested =
        new ValueRecord.Variant(
            "Some",
            new ValueRecord.Reference(
                new ValueRecord.Tuple(
                    List.of(
                        new ValueRecord.Float(Double.NaN, T),
                        new ValueRecord.Float(Double.NEGATIVE_INFINITY, T),
                        new ValueRecord.Float(2.5, T),
                        new ValueRecord.Raw("0xdead", T),
                        new ValueRecord.Error("unreadable", T)),
                    T),
                4096,
                false,
                T),
            T);
    List<TraceLowLevelEvent> events =
        List.of(
            new TraceLowLevelEvent.Path("/work/main.py"),
            new TraceLowLevelEvent.Function(
                new FunctionRecord(new PathId(0), new Line(1), "<toplevel>")),
            new TraceLowLevelEvent.Call(new CallRecord(new FunctionId(0), List.of())),
            new TraceLowLevelEvent.Type(new TypeRecord(TypeKind.NONE, "None")),
            new TraceLowLevelEvent.Type(
                new TypeRecord(
                    TypeKind.STRUCT,
                    "Point",
                    new TypeSpecificInfo.Struct(List.of(new FieldTypeRecord("x", T))))),
            new TraceLowLevelEvent.Type(
                new TypeRecord(TypeKind.POINTER, "Point*", new TypeSpecificInfo.Pointer(T))),
            new TraceLowLevelEvent.Step(new StepRecord(new PathId(0), new Line(3))),
            new TraceLowLevelEvent.VariableName("x"),
            new TraceLowLevelEvent.Variable("y"),
            new TraceLowLevelEvent.Value(new FullValueRecord(V, new ValueRecord.Int(-3, T))),
            new TraceLowLevelEvent.Value(
                new FullValueRecord(
                    V,
                    new ValueRecord.Int128(BigInteger.ONE.shiftLeft(100).negate(), T))),
            new TraceLowLevelEvent.Value(
                new FullValueRecord(
                    V, ValueRecord.BigInt.of(BigInteger.TEN.pow(40).negate(), T))),
            new TraceLowLevelEvent.Value(new FullValueRecord(V, nested)),
            new TraceLowLevelEvent.Value(
                new FullValueRecord(
                    V,
                    new ValueRecord.Struct(
                        List.of(new ValueRecord.String("a\"b\n", T), new ValueRecord.Bool(true, T)),
                        T))),
            new TraceLowLevelEvent.Return(new ReturnRecord(new ValueRecord.None(new TypeId(0)))),
            new TraceLowLevelEvent.Event(
                new RecordEvent(EventLogKind.WRITE_FILE, "out.txt", "hello\n")),
            new TraceLowLevelEvent.Asm(List.of("mov eax, 1", "ret")),
            new TraceLowLevelEvent.BindVariable(new BindVariableRecord(V, new Place(9))),
            new TraceLowLevelEvent.Assignment(
                new AssignmentRecord(V, PassBy.REFERENCE, new RValue.Simple(V))),
            new TraceLowLevelEvent.Assignment(
                new AssignmentRecord(
                    V, PassBy.VALUE, new RValue.Compound(List.of(V, new VariableId(1))))),
            new TraceLowLevelEvent.DropVariables(List.of(V, new VariableId(1))),
            new TraceLowLevelEvent.CellValue(
                new CellValueRecord(new Place(1), new ValueRecord.Int(1, T))),
            new TraceLowLevelEvent.CompoundValue(
                new CompoundValueRecord(
                    new Place(2),
                    new ValueRecord.Sequence(
                        List.of(new ValueRecord.Cell(new Place(1))), true, T))),
            new TraceLowLevelEvent.AssignCompoundItem(
                new AssignCompoundItemRecord(new Place(2), 0, new Place(1))),
            new TraceLowLevelEvent.AssignCell(
                new AssignCellRecord(new Place(1), new ValueRecord.Int(2, T))),
            new TraceLowLevelEvent.VariableCell(new VariableCellRecord(V, new Place(2))),
            new TraceLowLevelEvent.DropVariable(V),
            TraceLowLevelEvent.DROP_LAST_STEP);

    String json = write(TraceJsonSerializer.COMPACT.serializeEvents(events));
    assertEquals(events, TraceJsonDeserializer.readEvents(new StringReader(json)));

    String pretty = write(TraceJsonSerializer.PRETTY.serializeEvents(events));
    assertEquals(events, TraceJsonDeserializer.readEvents(new StringReader(pretty)));
  }

  /** Ensure that events are tagged externally and values internally. */
  @Test
  public void testWireShape() {
    JSONAssert.assertEquals(
        "{\"Step\":{\"path_id\":0,\"line\":3}}",
        eventJson(new TraceLowLevelEvent.Step(new StepRecord(new PathId(0), new Line(3)))),
        JSONCompareMode.STRICT);
    JSONAssert.assertEquals(
        "{\"Value\":{\"variable_id\":0,\"value\":{\"kind\":\"Int\",\"type_id\":1,\"i\":5}}}",
        eventJson(new TraceLowLevelEvent.Value(new FullValueRecord(V, new ValueRecord.Int(5, T)))),
        JSONCompareMode.STRICT);
    JSONAssert.assertEquals(
        "{\"Event\":{\"kind\":0,\"metadata\":\"\",\"content\":\"hi\"}}",
        eventJson(new TraceLowLevelEvent.Event(new RecordEvent(EventLogKind.WRITE, "", "hi"))),
        JSONCompareMode.STRICT);
    JSONAssert.assertEquals(
        "{\"Assignment\":{\"to\":0,\"pass_by\":\"Reference\","
            + "\"from\":{\"kind\":\"Compound\",\"variables\":[0,1]}}}",
        eventJson(
            new TraceLowLevelEvent.Assignment(
                new AssignmentRecord(
                    V, PassBy.REFERENCE, new RValue.Compound(List.of(V, new VariableId(1)))))),
        JSONCompareMode.STRICT);
    JSONAssert.assertEquals(
        "{\"Type\":{\"kind\":6,\"lang_type\":\"P\",\"specific_info\":"
            + "{\"kind\":\"Struct\",\"fields\":[{\"name\":\"x\",\"type_id\":1}]}}}",
        eventJson(
            new TraceLowLevelEvent.Type(
                new TypeRecord(
                    TypeKind.STRUCT,
                    "P",
                    new TypeSpecificInfo.Struct(List.of(new FieldTypeRecord("x", T)))))),
        JSONCompareMode.STRICT);
    assertEquals(
        "DropLastStep",
        TraceJsonSerializer.COMPACT.serializeEvent(TraceLowLevelEvent.DROP_LAST_STEP));
  }

  /** Ensure that non-finite floats and big integers use their string encodings. */
  @Test
  public void testSpecialValueEncodings() {
    JSONAssert.assertEquals(
        "{\"kind\":\"Float\",\"type_id\":1,\"f\":\"Infinity\"}",
        TraceJsonSerializer.COMPACT
            .serializeValue(new ValueRecord.Float(Double.POSITIVE_INFINITY, T))
            .toString(),
        JSONCompareMode.STRICT);
    JSONAssert.assertEquals(
        "{\"kind\":\"BigInt\",\"type_id\":1,\"b\":\"AQA=\",\"negative\":true}",
        TraceJsonSerializer.COMPACT
            .serializeValue(ValueRecord.BigInt.of(BigInteger.valueOf(-256), T))
            .toString(),
        JSONCompareMode.STRICT);
    JSONAssert.assertEquals(
        "{\"kind\":\"Cell\",\"place\":7}",
        TraceJsonSerializer.COMPACT.serializeValue(new ValueRecord.Cell(new Place(7))).toString(),
        JSONCompareMode.STRICT);
  }

  /** Ensure that reference addresses are written and read as unsigned 64-bit numbers. */
  @Test
  public void testReferenceAddressesAreUnsigned() {
    ValueRecord target = new ValueRecord.Int(1, T);
    ValueRecord highHalf = new ValueRecord.Reference(target, 0xFFFF800000001000L, true, T);
    ValueRecord allOnes = new ValueRecord.Reference(target, 0xFFFFFFFFFFFFFFFFL, false, T);

    String highJson = TraceJsonSerializer.COMPACT.serializeValue(highHalf).toString();
    String allOnesJson = TraceJsonSerializer.COMPACT.serializeValue(allOnes).toString();
    assertTrue(highJson.contains("\"address\":18446603336221200384"), highJson);
    assertTrue(allOnesJson.contains("\"address\":18446744073709551615"), allOnesJson);

    assertEquals(highHalf, TraceJsonDeserializer.parseValue(new JSONObject(highJson)));
    assertEquals(allOnes, TraceJsonDeserializer.parseValue(new JSONObject(allOnesJson)));
  }

  /** Ensure that addresses outside the unsigned 64-bit range are rejected instead of wrapped. */
  @Test
  public void testOutOfRangeAddressesRejected() {
    String tooLarge =
        "[{\"Return\":{\"return_value\":{\"kind\":\"Reference\",\"type_id\":1,"
            + "\"address\":18446744073709551616,\"mutable\":false,"
            + "\"dereferenced\":{\"kind\":\"None\",\"type_id\":0}}}}]";
    TraceFormatException wrapped =
        assertThrows(
            TraceFormatException.class,
            () -> TraceJsonDeserializer.readEvents(new StringReader(tooLarge)));
    assertTrue(wrapped.getMessage().contains("index 0"), wrapped.getMessage());

    String negative = tooLarge.replace("18446744073709551616", "-1");
    assertThrows(
        TraceFormatException.class,
        () -> TraceJsonDeserializer.readEvents(new StringReader(negative)));
  }

  /** Ensure that metadata and path tables survive a write and read. */
  @Test
  public void testMetadataAndPathsRoundTrip() throws IOException {
    TraceMetadata metadata = new TraceMetadata("/work", "main.py", List.of("-x", "1"));
    String json = write(TraceJsonSerializer.COMPACT.serializeMetadata(metadata));
    JSONAssert.assertEquals(
        "{\"workdir\":\"/work\",\"program\":\"main.py\",\"args\":[\"-x\",\"1\"]}",
        json,
        JSONCompareMode.STRICT);
    assertEquals(metadata, TraceJsonDeserializer.readMetadata(new StringReader(json)));

    List<String> paths = List.of("/work/main.py", "/work/lib.py");
    String pathsJson = write(TraceJsonSerializer.COMPACT.serializePaths(paths));
    assertEquals(paths, TraceJsonDeserializer.readPaths(new StringReader(pathsJson)));
  }

  /** Ensure that malformed input is reported with the index of the bad event. */
  @Test
  public void testMalformedEventsRejected() {
    TraceFormatException notJson =
        assertThrows(
            TraceFormatException.class,
            () -> TraceJsonDeserializer.readEvents(new StringReader("{not json")));
    assertTrue(notJson.getMessage().startsWith("Invalid trace events"));

    TraceFormatException badEvent =
        assertThrows(
            TraceFormatException.class,
            () ->
                TraceJsonDeserializer.readEvents(
                    new StringReader("[\"DropLastStep\", {\"Teleport\": 1}]")));
    assertTrue(badEvent.getMessage().contains("index 1"), badEvent.getMessage());

    TraceFormatException missingMember =
        assertThrows(
            TraceFormatException.class,
            () ->
                TraceJsonDeserializer.readEvents(
                    new StringReader("[{\"Step\": {\"line\": 1}}]")));
    assertTrue(missingMember.getMessage().contains("index 0"), missingMember.getMessage());

    assertThrows(
        TraceFormatException.class,
        () -> TraceJsonDeserializer.readEvents(new StringReader("[{\"Path\":\"a\",\"Step\":1}]")));
  }
}
