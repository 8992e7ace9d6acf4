package cs1302.tracelog.types;

import java.util.Objects;

/**
 * A named, typed field of a struct type.
 *
 * @param name The field's name.
 * @param typeId The field's declared type.
 */
public record FieldTypeRecord(String name, TypeId typeId) {
  public FieldTypeRecord {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(typeId, "typeId");
  }
}
