package cs1302.tracelog.types;

/**
 * A position in the reconstructed call sequence. Call keys are not part of the event stream, they
 * are derived from the order of {@code Call} events when a stream is read back.
 *
 * @param key The zero-based call index, or -1 for {@link #NO_KEY}.
 */
public record CallKey(long key) {

  /** Sentinel for "no call", e.g. steps recorded before the toplevel call. */
  public static final CallKey NO_KEY = new CallKey(-1);

  public CallKey {
    if (key < -1) {
      throw new IllegalArgumentException("CallKey must be -1 or greater");
    }
  }

  /**
   * Get the key that follows this one.
   *
   * @return A key one greater than this one.
   */
  public CallKey next() {
    return new CallKey(key + 1);
  }

  /**
   * Check whether this key is the {@link #NO_KEY} sentinel.
   *
   * @return True if this key does not denote a call.
   */
  public boolean isNone() {
    return key == -1;
  }
}
