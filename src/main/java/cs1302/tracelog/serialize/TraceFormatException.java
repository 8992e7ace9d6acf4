package cs1302.tracelog.serialize;

import java.io.IOException;

/** Thrown when a stored trace artifact cannot be decoded. */
public class TraceFormatException extends IOException {

  /**
   * Create an exception with a message and the underlying failure.
   *
   * @param message What was wrong with the input.
   * @param cause The exception raised while decoding.
   */
  public TraceFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
