package cs1302.tracelog.trace;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cs1302.tracelog.types.PathId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/** Tests for {@link InternTable}. */
public class InternTableTest {

  /** Ensure that ids are dense and follow first-seen order. */
  @Test
  public void testIdsAreDenseInFirstSeenOrder() {
    InternTable<String, PathId> table = new InternTable<>(PathId::new);
    List<PathId> defined = new ArrayList<>();

    assertEquals(new PathId(0), table.ensureId("a.py", defined::add));
    assertEquals(new PathId(1), table.ensureId("b.py", defined::add));
    assertEquals(new PathId(0), table.ensureId("a.py", defined::add));
    assertEquals(new PathId(2), table.ensureId("c.py", defined::add));

    assertEquals(List.of(new PathId(0), new PathId(1), new PathId(2)), defined);
    assertEquals(List.of("a.py", "b.py", "c.py"), table.keys());
    assertEquals(3, table.size());
  }

  /** Ensure that the key is readable from inside the first-sight callback. */
  @Test
  public void testKeyVisibleDuringCallback() {
    InternTable<String, PathId> table = new InternTable<>(PathId::new);
    List<String> seen = new ArrayList<>();
    table.ensureId("main.py", id -> seen.add(table.keyAt(id.index())));
    assertEquals(List.of("main.py"), seen);
  }

  /** Ensure that lookups never assign ids. */
  @Test
  public void testFindDoesNotIntern() {
    InternTable<String, PathId> table = new InternTable<>(PathId::new);
    assertEquals(Optional.empty(), table.find("x"));
    assertEquals(0, table.size());
    table.ensureId("x", id -> {});
    assertEquals(Optional.of(new PathId(0)), table.find("x"));
    assertTrue(table.hasIndex(0));
    assertFalse(table.hasIndex(1));
    assertFalse(table.hasIndex(-1));
  }

  /** Ensure that the key view cannot be used to corrupt the table. */
  @Test
  public void testKeysUnmodifiable() {
    InternTable<String, PathId> table = new InternTable<>(PathId::new);
    table.ensureId("x", id -> {});
    assertThrows(UnsupportedOperationException.class, () -> table.keys().add("y"));
  }
}
