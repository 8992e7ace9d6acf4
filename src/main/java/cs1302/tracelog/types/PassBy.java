package cs1302.tracelog.types;

/** How a value travels in an assignment or parameter pass. */
public enum PassBy {
  VALUE,
  REFERENCE
}
