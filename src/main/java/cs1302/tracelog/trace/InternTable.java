package cs1302.tracelog.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntFunction;

/**
 * A get-or-create table that assigns dense ids to keys in first-seen order.
 *
 * <p>Entries are never removed. The table is owned by a single {@link Tracer} and is not
 * thread-safe.
 *
 * @param <K> The natural key, e.g. a path or a name.
 * @param <I> The id type handed out for keys.
 */
public final class InternTable<K, I> {

  private final List<K> keys = new ArrayList<>();
  private final Map<K, I> ids = new HashMap<>();
  private final IntFunction<I> idFactory;

  /**
   * Create an empty table.
   *
   * @param idFactory Wraps a dense index into the table's id type.
   */
  public InternTable(IntFunction<I> idFactory) {
    this.idFactory = idFactory;
  }

  /**
   * Get the id of a key, assigning the next free id if the key has not been seen before.
   *
   * @param key The key to look up.
   * @param onFirstSight Called with the new id, after it has been assigned, only when the key is
   *     new. This is where the definition event gets emitted.
   * @return The key's id. Repeated calls with equal keys return equal ids.
   */
  public I ensureId(K key, Consumer<I> onFirstSight) {
    I existing = ids.get(key);
    if (existing != null) {
      return existing;
    }
    I id = idFactory.apply(keys.size());
    keys.add(key);
    ids.put(key, id);
    onFirstSight.accept(id);
    return id;
  }

  /**
   * Look up a key without assigning an id.
   *
   * @param key The key to look up.
   * @return The key's id, or empty if it was never interned.
   */
  public Optional<I> find(K key) {
    return Optional.ofNullable(ids.get(key));
  }

  /**
   * Get the key that was assigned a given index.
   *
   * @param index A dense index handed out by this table.
   * @return The key with that index.
   * @throws IndexOutOfBoundsException If no key has that index.
   */
  public K keyAt(int index) {
    return keys.get(index);
  }

  /**
   * Check whether an index has been handed out.
   *
   * @param index The index to check.
   * @return True if some key has that index.
   */
  public boolean hasIndex(int index) {
    return index >= 0 && index < keys.size();
  }

  /**
   * Get all keys in id order.
   *
   * @return An unmodifiable view of the keys, where position equals id index.
   */
  public List<K> keys() {
    return Collections.unmodifiableList(keys);
  }

  /**
   * Get the number of interned keys.
   *
   * @return The number of keys, which is also the next id index.
   */
  public int size() {
    return keys.size();
  }
}
