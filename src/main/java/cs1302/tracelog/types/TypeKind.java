package cs1302.tracelog.types;

/**
 * Categories of recorded types, used by consumers for generic rendering.
 *
 * <p>Each constant carries its wire code explicitly. Codes are part of the trace format: new kinds
 * may only be appended with the next free code, existing codes never change.
 */
public enum TypeKind {
  SEQ(0),
  SET(1),
  HASH_SET(2),
  ORDERED_SET(3),
  ARRAY(4),
  VARARGS(5),

  STRUCT(6),

  INT(7),
  FLOAT(8),
  STRING(9),
  C_STRING(10),
  CHAR(11),
  BOOL(12),

  LITERAL(13),

  REF(14),

  RECURSION(15),

  RAW(16),

  ENUM(17),
  ENUM16(18),
  ENUM32(19),

  C(20),

  TABLE_KIND(21),

  UNION(22),

  POINTER(23),

  ERROR(24),

  FUNCTION_KIND(25),

  TYPE_VALUE(26),

  TUPLE(27),

  VARIANT(28),

  HTML(29),

  NONE(30),
  NON_EXPANDED(31),
  ANY(32),
  SLICE(33);

  private static final TypeKind[] BY_CODE = new TypeKind[values().length];

  static {
    for (TypeKind kind : values()) {
      if (BY_CODE[kind.code] != null) {
        throw new ExceptionInInitializerError("Duplicate TypeKind code " + kind.code);
      }
      BY_CODE[kind.code] = kind;
    }
  }

  private final int code;

  TypeKind(int code) {
    this.code = code;
  }

  /**
   * Get the number this kind is written as.
   *
   * @return The wire code of this kind.
   */
  public int code() {
    return code;
  }

  /**
   * Look up a kind by its wire code.
   *
   * @param code The wire code.
   * @return The kind with that code.
   * @throws IllegalArgumentException If no kind has that code.
   */
  public static TypeKind fromCode(int code) {
    if (code < 0 || code >= BY_CODE.length) {
      throw new IllegalArgumentException("Unknown TypeKind code " + code);
    }
    return BY_CODE[code];
  }
}
