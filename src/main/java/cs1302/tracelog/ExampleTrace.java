package cs1302.tracelog;

import cs1302.tracelog.trace.Tracer;
import cs1302.tracelog.types.EventLogKind;
import cs1302.tracelog.types.FunctionId;
import cs1302.tracelog.types.Line;
import cs1302.tracelog.types.Place;
import cs1302.tracelog.types.TypeId;
import cs1302.tracelog.types.TypeKind;
import cs1302.tracelog.types.ValueRecord;
import java.nio.file.Path;
import java.util.List;

/**
 * Records a fixed session for a small program, the way an instrumented interpreter would:
 *
 * <pre>
 * 1  def add(a, b):
 * 2      return a + b
 * 3  x = add(1, 2)
 * 4  print(x)
 * 5  xs = [x]
 * 6  xs[0] = 4
 * </pre>
 */
public final class ExampleTrace {

  private ExampleTrace() {}

  /**
   * Record the example session.
   *
   * @param source The path to record as the program's source file.
   * @return A started tracer holding the session's events.
   */
  public static Tracer record(Path source) {
    Tracer tracer = new Tracer(source.getFileName().toString(), List.of());
    tracer.start(source, new Line(1));
    TypeId intType = tracer.ensureTypeId(TypeKind.INT, "int");

    tracer.registerStep(source, new Line(3));
    FunctionId add = tracer.ensureFunctionId("add", source, new Line(1));
    tracer.registerCall(
        add,
        List.of(
            tracer.arg("a", new ValueRecord.Int(1, intType)),
            tracer.arg("b", new ValueRecord.Int(2, intType))));
    tracer.registerStep(source, new Line(2));
    tracer.registerReturn(new ValueRecord.Int(3, intType));
    tracer.dropVariables(List.of("a", "b"));
    tracer.registerVariableWithFullValue("x", new ValueRecord.Int(3, intType));

    tracer.registerStep(source, new Line(4));
    tracer.registerSpecialEvent(EventLogKind.WRITE, "3\n");

    tracer.registerStep(source, new Line(5));
    TypeId listType = tracer.ensureTypeId(TypeKind.SEQ, "list[int]");
    tracer.registerCellValue(new Place(1), new ValueRecord.Int(3, intType));
    tracer.registerCompoundValue(
        new Place(2),
        new ValueRecord.Sequence(List.of(new ValueRecord.Cell(new Place(1))), false, listType));
    tracer.registerVariable("xs", new Place(2));

    tracer.registerStep(source, new Line(6));
    tracer.assignCell(new Place(1), new ValueRecord.Int(4, intType));
    return tracer;
  }
}
