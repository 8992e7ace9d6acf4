package cs1302.tracelog.types;

/**
 * A handle to a mutable storage cell.
 *
 * <p>The value is opaque and chosen by the recorded language: usually an address, an interpreter
 * slot index or some other id that uniquely represents where a value lives. Places let the trace
 * follow aliasing and in-place mutation without re-recording whole values.
 *
 * @param id The language-defined place id.
 */
public record Place(long id) {}
