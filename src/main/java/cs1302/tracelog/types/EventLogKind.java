package cs1302.tracelog.types;

/**
 * Kinds of I/O and log side effects recorded as {@link TraceLowLevelEvent.Event} markers.
 *
 * <p>Wire codes are fixed; append new kinds only.
 */
public enum EventLogKind {
  WRITE(0),
  WRITE_FILE(1),
  WRITE_OTHER(2),
  READ(3),
  READ_FILE(4),
  READ_OTHER(5),
  // not emitted by current recorders
  READ_DIR(6),
  OPEN_DIR(7),
  CLOSE_DIR(8),
  SOCKET(9),
  OPEN(10),
  ERROR(11),
  TRACE_LOG_EVENT(12);

  private static final EventLogKind[] BY_CODE = new EventLogKind[values().length];

  static {
    for (EventLogKind kind : values()) {
      if (BY_CODE[kind.code] != null) {
        throw new ExceptionInInitializerError("Duplicate EventLogKind code " + kind.code);
      }
      BY_CODE[kind.code] = kind;
    }
  }

  private final int code;

  EventLogKind(int code) {
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
  public static EventLogKind fromCode(int code) {
    if (code < 0 || code >= BY_CODE.length) {
      throw new IllegalArgumentException("Unknown EventLogKind code " + code);
    }
    return BY_CODE[code];
  }
}
