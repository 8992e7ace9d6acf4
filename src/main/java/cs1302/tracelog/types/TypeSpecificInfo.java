package cs1302.tracelog.types;

import java.util.List;
import java.util.Objects;

/** Structural refinement of a {@link TypeRecord}. Only structs and pointers carry any. */
public sealed interface TypeSpecificInfo {

  /** The shared instance for types without refinement. */
  TypeSpecificInfo NONE = new None();

  /**
   * Get the types this refinement refers to.
   *
   * @return Field types for structs, the target type for pointers, nothing otherwise.
   */
  List<TypeId> referencedTypeIds();

  /** No refinement. */
  record None() implements TypeSpecificInfo {
    @Override
    public List<TypeId> referencedTypeIds() {
      return List.of();
    }
  }

  /**
   * The ordered field list of a struct type. Struct values list their field values in this order.
   *
   * @param fields The fields.
   */
  record Struct(List<FieldTypeRecord> fields) implements TypeSpecificInfo {
    public Struct {
      fields = List.copyOf(fields);
    }

    @Override
    public List<TypeId> referencedTypeIds() {
      return fields.stream().map(FieldTypeRecord::typeId).toList();
    }
  }

  /**
   * The target of a pointer type.
   *
   * @param dereferenceTypeId The type of the referent.
   */
  record Pointer(TypeId dereferenceTypeId) implements TypeSpecificInfo {
    public Pointer {
      Objects.requireNonNull(dereferenceTypeId, "dereferenceTypeId");
    }

    @Override
    public List<TypeId> referencedTypeIds() {
      return List.of(dereferenceTypeId);
    }
  }
}
