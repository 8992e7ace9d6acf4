package cs1302.tracelog.types;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for the value and identifier records. */
public class ValueRecordTest {

  private static final TypeId INT = new TypeId(1);

  /** Ensure that values compare structurally. */
  @Test
  public void testStructuralEquality() {
    ValueRecord a =
        new ValueRecord.Sequence(
            List.of(new ValueRecord.Int(1, INT), new ValueRecord.Cell(new Place(4))), false, INT);
    ValueRecord b =
        new ValueRecord.Sequence(
            List.of(new ValueRecord.Int(1, INT), new ValueRecord.Cell(new Place(4))), false, INT);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, new ValueRecord.Sequence(List.of(), true, INT));
  }

  /** Ensure that 128-bit integers reject values that do not fit. */
  @Test
  public void testInt128Range() {
    BigInteger max = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    BigInteger min = BigInteger.ONE.shiftLeft(127).negate();
    assertEquals(max, new ValueRecord.Int128(max, INT).i());
    assertEquals(min, new ValueRecord.Int128(min, INT).i());
    assertThrows(
        IllegalArgumentException.class,
        () -> new ValueRecord.Int128(max.add(BigInteger.ONE), INT));
    assertThrows(
        IllegalArgumentException.class,
        () -> new ValueRecord.Int128(min.subtract(BigInteger.ONE), INT));
  }

  /** Ensure that big integers keep a minimal magnitude and a separate sign. */
  @Test
  public void testBigIntFromBigInteger() {
    ValueRecord.BigInt positive = ValueRecord.BigInt.of(BigInteger.valueOf(255), INT);
    assertArrayEquals(new byte[] {(byte) 0xff}, positive.b());
    assertFalse(positive.negative());

    ValueRecord.BigInt negative = ValueRecord.BigInt.of(BigInteger.valueOf(-256), INT);
    assertArrayEquals(new byte[] {1, 0}, negative.b());
    assertTrue(negative.negative());
    assertEquals(BigInteger.valueOf(-256), negative.toBigInteger());

    BigInteger huge =
        new BigInteger("-123456789012345678901234567890123456789012345678901234567890");
    assertEquals(huge, ValueRecord.BigInt.of(huge, INT).toBigInteger());
  }

  /** Ensure that big integers compare by content and cannot be mutated through their bytes. */
  @Test
  public void testBigIntEqualityAndCopies() {
    byte[] bytes = {1, 2, 3};
    ValueRecord.BigInt value = new ValueRecord.BigInt(bytes, false, INT);
    bytes[0] = 9;
    value.b()[1] = 9;
    assertEquals(new ValueRecord.BigInt(new byte[] {1, 2, 3}, false, INT), value);
    assertNotEquals(new ValueRecord.BigInt(new byte[] {1, 2, 3}, true, INT), value);
    assertEquals(
        new ValueRecord.BigInt(new byte[] {1, 2, 3}, false, INT).hashCode(), value.hashCode());
  }

  /** Ensure that negative ids and call keys are rejected. */
  @Test
  public void testIdentifiersRejectNegatives() {
    assertThrows(IllegalArgumentException.class, () -> new TypeId(-1));
    assertThrows(IllegalArgumentException.class, () -> new PathId(-1));
    assertThrows(IllegalArgumentException.class, () -> new CallKey(-2));
    assertTrue(CallKey.NO_KEY.isNone());
    assertEquals(new CallKey(0), CallKey.NO_KEY.next());
  }

  /** Ensure that kind codes match their wire values. */
  @Test
  public void testKindCodes() {
    assertEquals(0, TypeKind.SEQ.code());
    assertEquals(6, TypeKind.STRUCT.code());
    assertEquals(7, TypeKind.INT.code());
    assertEquals(30, TypeKind.NONE.code());
    assertEquals(33, TypeKind.SLICE.code());
    for (TypeKind kind : TypeKind.values()) {
      assertEquals(kind, TypeKind.fromCode(kind.code()));
    }
    assertThrows(IllegalArgumentException.class, () -> TypeKind.fromCode(34));

    assertEquals(0, EventLogKind.WRITE.code());
    assertEquals(12, EventLogKind.TRACE_LOG_EVENT.code());
    assertThrows(IllegalArgumentException.class, () -> EventLogKind.fromCode(-1));
  }
}
