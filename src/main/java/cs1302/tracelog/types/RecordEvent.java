package cs1302.tracelog.types;

import java.util.Objects;

/**
 * A side-effect marker such as program output or an error. It does not affect call structure.
 *
 * @param kind What happened.
 * @param metadata Free-form extra data, empty if none.
 * @param content The payload, e.g. the written text.
 */
public record RecordEvent(EventLogKind kind, String metadata, String content) {
  public RecordEvent {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(metadata, "metadata");
    Objects.requireNonNull(content, "content");
  }
}
