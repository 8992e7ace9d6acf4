package cs1302.tracelog.types;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

/**
 * A runtime value captured in a trace.
 *
 * <p>Every variant except {@link Cell} carries the id of its type. {@link Cell} points at a
 * {@link Place} instead of embedding data and is only meaningful in the structural (place-graph)
 * encoding.
 */
public sealed interface ValueRecord {

  /**
   * Dispatch on the variant of this value.
   *
   * @param visitor The visitor to call.
   * @param <R> The visitor's result type.
   * @return Whatever the visitor returned.
   */
  <R> R accept(Visitor<R> visitor);

  /** A value that carries the id of its type. This is every variant except {@link Cell}. */
  sealed interface Typed extends ValueRecord {
    /**
     * Get the value's type.
     *
     * @return The id of the value's type.
     */
    TypeId typeId();
  }

  /**
   * One method per value variant. Implementations are exhaustive by construction: adding a
   * variant adds a method here.
   *
   * @param <R> The result type.
   */
  interface Visitor<R> {
    R visitInt(Int value);

    R visitInt128(Int128 value);

    R visitFloat(Float value);

    R visitBool(Bool value);

    R visitString(String value);

    R visitSequence(Sequence value);

    R visitTuple(Tuple value);

    R visitStruct(Struct value);

    R visitVariant(Variant value);

    R visitReference(Reference value);

    R visitRaw(Raw value);

    R visitError(Error value);

    R visitNone(None value);

    R visitCell(Cell value);

    R visitBigInt(BigInt value);
  }

  /** A 64-bit signed integer. */
  record Int(long i, TypeId typeId) implements Typed {
    public Int {
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInt(this);
    }
  }

  /** A signed integer that fits in 128 bits. */
  record Int128(BigInteger i, TypeId typeId) implements Typed {
    public Int128 {
      Objects.requireNonNull(i, "i");
      Objects.requireNonNull(typeId, "typeId");
      if (i.bitLength() > 127) {
        throw new IllegalArgumentException("Int128 value out of range: " + i);
      }
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitInt128(this);
    }
  }

  /** A double precision float. */
  record Float(double f, TypeId typeId) implements Typed {
    public Float {
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitFloat(this);
    }
  }

  /** A boolean. */
  record Bool(boolean b, TypeId typeId) implements Typed {
    public Bool {
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBool(this);
    }
  }

  /** A string. */
  record String(java.lang.String text, TypeId typeId) implements Typed {
    public String {
      Objects.requireNonNull(text, "text");
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitString(this);
    }
  }

  /**
   * An ordered collection.
   *
   * @param elements The elements, in order.
   * @param isSlice True if this is a borrowed view into another sequence.
   * @param typeId The collection's type.
   */
  record Sequence(java.util.List<ValueRecord> elements, boolean isSlice, TypeId typeId)
      implements Typed {
    public Sequence {
      elements = java.util.List.copyOf(elements);
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSequence(this);
    }
  }

  /** A fixed-size heterogeneous tuple. */
  record Tuple(java.util.List<ValueRecord> elements, TypeId typeId) implements Typed {
    public Tuple {
      elements = java.util.List.copyOf(elements);
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitTuple(this);
    }
  }

  /**
   * A struct with positional field values.
   *
   * @param fieldValues The field values in the order of the struct type's field list.
   * @param typeId A type registered with {@link TypeSpecificInfo.Struct} info.
   */
  record Struct(java.util.List<ValueRecord> fieldValues, TypeId typeId) implements Typed {
    public Struct {
      fieldValues = java.util.List.copyOf(fieldValues);
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitStruct(this);
    }
  }

  /**
   * A value of a sum type.
   *
   * @param discriminator The name of the active case.
   * @param contents The payload, usually a {@link Struct} or a {@link Tuple}.
   * @param typeId The sum type.
   */
  record Variant(java.lang.String discriminator, ValueRecord contents, TypeId typeId)
      implements Typed {
    public Variant {
      Objects.requireNonNull(discriminator, "discriminator");
      Objects.requireNonNull(contents, "contents");
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitVariant(this);
    }
  }

  /**
   * A pointer or reference, recorded together with an eager snapshot of its referent.
   *
   * @param dereferenced The referent at the time of recording.
   * @param address The address the reference held, as an unsigned 64-bit value. Addresses in
   *     the upper half of the address space are negative as a {@code long}.
   * @param mutable True if the referent may be mutated through this reference.
   * @param typeId The reference type, usually registered with {@link TypeSpecificInfo.Pointer}.
   */
  record Reference(ValueRecord dereferenced, long address, boolean mutable, TypeId typeId)
      implements Typed {
    public Reference {
      Objects.requireNonNull(dereferenced, "dereferenced");
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitReference(this);
    }
  }

  /** An opaque textual rendering of a value with no better representation. */
  record Raw(java.lang.String r, TypeId typeId) implements Typed {
    public Raw {
      Objects.requireNonNull(r, "r");
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRaw(this);
    }
  }

  /** A value that could not be captured, with the reason. */
  record Error(java.lang.String msg, TypeId typeId) implements Typed {
    public Error {
      Objects.requireNonNull(msg, "msg");
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitError(this);
    }
  }

  /** The absence of a value. */
  record None(TypeId typeId) implements Typed {
    public None {
      Objects.requireNonNull(typeId, "typeId");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNone(this);
    }
  }

  /** An indirect value stored at a place. */
  record Cell(Place place) implements ValueRecord {
    public Cell {
      Objects.requireNonNull(place, "place");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCell(this);
    }
  }

  /**
   * An arbitrary precision integer.
   *
   * @param b The big-endian unsigned magnitude.
   * @param negative True if the value is below zero.
   * @param typeId The integer's type.
   */
  record BigInt(byte[] b, boolean negative, TypeId typeId) implements Typed {
    public BigInt {
      b = b.clone();
      Objects.requireNonNull(typeId, "typeId");
    }

    /**
     * Create a big integer value from a {@link BigInteger}.
     *
     * @param value The integer.
     * @param typeId The integer's type.
     * @return A value with the minimal big-endian magnitude of {@code value}.
     */
    public static BigInt of(BigInteger value, TypeId typeId) {
      byte[] magnitude = value.abs().toByteArray();
      // toByteArray leaves a leading zero byte for the sign bit
      if (magnitude.length > 1 && magnitude[0] == 0) {
        magnitude = Arrays.copyOfRange(magnitude, 1, magnitude.length);
      }
      return new BigInt(magnitude, value.signum() < 0, typeId);
    }

    /**
     * Convert this value back into a {@link BigInteger}.
     *
     * @return The integer this value represents.
     */
    public BigInteger toBigInteger() {
      BigInteger magnitude = new BigInteger(1, b);
      return negative ? magnitude.negate() : magnitude;
    }

    @Override
    public byte[] b() {
      return b.clone();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBigInt(this);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof BigInt that
          && negative == that.negative
          && typeId.equals(that.typeId)
          && Arrays.equals(b, that.b);
    }

    @Override
    public int hashCode() {
      return Objects.hash(Arrays.hashCode(b), negative, typeId);
    }

    @Override
    public java.lang.String toString() {
      return "BigInt[b=" + Arrays.toString(b) + ", negative=" + negative + ", typeId=" + typeId
          + "]";
    }
  }
}
