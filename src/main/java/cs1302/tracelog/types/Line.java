package cs1302.tracelog.types;

/**
 * A source line number.
 *
 * @param line The line number, 1-based by convention.
 */
public record Line(long line) {}
