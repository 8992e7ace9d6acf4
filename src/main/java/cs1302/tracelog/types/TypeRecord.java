package cs1302.tracelog.types;

import java.util.Objects;

/**
 * A type table entry.
 *
 * @param kind The category of the type.
 * @param langType The type's name in the recorded language. This is also its interning key.
 * @param specificInfo Struct fields or pointer target, {@link TypeSpecificInfo#NONE} otherwise.
 */
public record TypeRecord(TypeKind kind, String langType, TypeSpecificInfo specificInfo) {

  public TypeRecord {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(langType, "langType");
    Objects.requireNonNull(specificInfo, "specificInfo");
  }

  /**
   * Create a type record without structural refinement.
   *
   * @param kind The category of the type.
   * @param langType The type's name in the recorded language.
   */
  public TypeRecord(TypeKind kind, String langType) {
    this(kind, langType, TypeSpecificInfo.NONE);
  }
}
