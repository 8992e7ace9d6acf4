package cs1302.tracelog.trace;

import cs1302.tracelog.types.FieldTypeRecord;
import cs1302.tracelog.types.TypeId;
import cs1302.tracelog.types.TypeRecord;
import cs1302.tracelog.types.TypeSpecificInfo;
import cs1302.tracelog.types.ValueRecord;
import java.util.List;
import java.util.Optional;

/**
 * Checks that every type id inside a value refers to a known type and that struct values match
 * their struct type.
 */
public final class ValueTypeCheck implements ValueRecord.Visitor<Optional<String>> {

  private final List<TypeRecord> types;

  private ValueTypeCheck(List<TypeRecord> types) {
    this.types = types;
  }

  /**
   * Find the first problem in a value, if any.
   *
   * @param value The value to check, including all nested values.
   * @param types The type table, where position equals type id index.
   * @return A description of the first problem found, or empty if the value is consistent.
   */
  public static Optional<String> findProblem(ValueRecord value, List<TypeRecord> types) {
    return value.accept(new ValueTypeCheck(types));
  }

  private Optional<String> checkTypeId(TypeId typeId) {
    if (typeId.index() >= types.size()) {
      return Optional.of(String.format("type id %d was never registered", typeId.index()));
    }
    return Optional.empty();
  }

  private Optional<String> checkAll(TypeId typeId, List<ValueRecord> nested) {
    Optional<String> problem = checkTypeId(typeId);
    for (ValueRecord element : nested) {
      if (problem.isPresent()) {
        break;
      }
      problem = element.accept(this);
    }
    return problem;
  }

  @Override
  public Optional<String> visitInt(ValueRecord.Int value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitInt128(ValueRecord.Int128 value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitFloat(ValueRecord.Float value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitBool(ValueRecord.Bool value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitString(ValueRecord.String value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitSequence(ValueRecord.Sequence value) {
    return checkAll(value.typeId(), value.elements());
  }

  @Override
  public Optional<String> visitTuple(ValueRecord.Tuple value) {
    return checkAll(value.typeId(), value.elements());
  }

  @Override
  public Optional<String> visitStruct(ValueRecord.Struct value) {
    Optional<String> problem = checkTypeId(value.typeId());
    if (problem.isPresent()) {
      return problem;
    }
    TypeRecord type = types.get(value.typeId().index());
    if (!(type.specificInfo() instanceof TypeSpecificInfo.Struct structInfo)) {
      return Optional.of(
          String.format("struct value uses non-struct type %s", type.langType()));
    }
    if (structInfo.fields().size() != value.fieldValues().size()) {
      return Optional.of(
          String.format(
              "struct value has %d fields but type %s declares %d",
              value.fieldValues().size(), type.langType(), structInfo.fields().size()));
    }
    for (int i = 0; i < value.fieldValues().size(); i++) {
      FieldTypeRecord declared = structInfo.fields().get(i);
      // cells are typed by the place they refer to
      if (value.fieldValues().get(i) instanceof ValueRecord.Typed field
          && !field.typeId().equals(declared.typeId())) {
        return Optional.of(
            String.format(
                "field %s of %s has type id %d but is declared as type id %d",
                declared.name(),
                type.langType(),
                field.typeId().index(),
                declared.typeId().index()));
      }
    } // for
    return checkAll(value.typeId(), value.fieldValues());
  }

  @Override
  public Optional<String> visitVariant(ValueRecord.Variant value) {
    return checkAll(value.typeId(), List.of(value.contents()));
  }

  @Override
  public Optional<String> visitReference(ValueRecord.Reference value) {
    return checkAll(value.typeId(), List.of(value.dereferenced()));
  }

  @Override
  public Optional<String> visitRaw(ValueRecord.Raw value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitError(ValueRecord.Error value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitNone(ValueRecord.None value) {
    return checkTypeId(value.typeId());
  }

  @Override
  public Optional<String> visitCell(ValueRecord.Cell value) {
    // places are checked by the place graph
    return Optional.empty();
  }

  @Override
  public Optional<String> visitBigInt(ValueRecord.BigInt value) {
    return checkTypeId(value.typeId());
  }
}
