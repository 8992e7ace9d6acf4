package cs1302.tracelog.trace;

import cs1302.tracelog.types.Place;
import cs1302.tracelog.types.ValueRecord;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The current contents of every place defined by structural events.
 *
 * <p>Values are stored flat, by place. Aggregates refer to their elements through
 * {@link ValueRecord.Cell}s, so aliasing and cycles between places never turn into cyclic object
 * graphs; cells are resolved by lookup when rendering.
 *
 * <p>Each mutating operation comes as a {@code check} method that describes the precondition
 * violation, if any, and a {@code record} method that applies the change.
 */
public final class PlaceGraph {

  private final Map<Place, ValueRecord> values = new HashMap<>();
  private final Map<Place, Integer> compoundSizes = new HashMap<>();
  private final Set<Place> cellPlaces = new HashSet<>();

  /**
   * Check a {@code CompoundValue} definition.
   *
   * @param place The aggregate's place.
   * @param value The aggregate.
   * @return The problem with the definition, or empty if it is valid.
   */
  public Optional<String> checkCompoundValue(Place place, ValueRecord value) {
    Optional<List<ValueRecord>> elements = elementsOf(value);
    if (elements.isEmpty()) {
      return Optional.of(
          String.format("compound value at place %d is not a sequence, tuple or struct",
              place.id()));
    }
    if (refersTo(value, place)) {
      return Optional.of(
          String.format("compound value at place %d contains a cell referring to itself",
              place.id()));
    }
    return Optional.empty();
  }

  /**
   * Define an aggregate at a place. Places referenced by its cell elements become assignable
   * cells.
   *
   * @param place The aggregate's place.
   * @param value The aggregate, already checked with {@link #checkCompoundValue}.
   */
  public void recordCompoundValue(Place place, ValueRecord value) {
    List<ValueRecord> elements = elementsOf(value).orElseThrow();
    values.put(place, value);
    cellPlaces.remove(place);
    compoundSizes.put(place, elements.size());
    for (ValueRecord element : elements) {
      if (element instanceof ValueRecord.Cell cell) {
        bindElement(cell.place());
      }
    }
  }

  /**
   * Check a {@code CellValue} definition.
   *
   * @param place The cell's place.
   * @param value The cell's value.
   * @return The problem with the definition, or empty if it is valid.
   */
  public Optional<String> checkCellValue(Place place, ValueRecord value) {
    if (refersTo(value, place)) {
      return Optional.of(
          String.format("cell value at place %d refers to itself", place.id()));
    }
    return Optional.empty();
  }

  /**
   * Define a scalar cell at a place.
   *
   * @param place The cell's place.
   * @param value The cell's value.
   */
  public void recordCellValue(Place place, ValueRecord value) {
    values.put(place, value);
    compoundSizes.remove(place);
    cellPlaces.add(place);
  }

  /**
   * Check an {@code AssignCompoundItem} mutation.
   *
   * @param place The aggregate's place.
   * @param index The element to rebind.
   * @param itemPlace The place the element will refer to.
   * @return The problem with the mutation, or empty if it is valid.
   */
  public Optional<String> checkAssignCompoundItem(Place place, int index, Place itemPlace) {
    Integer size = compoundSizes.get(place);
    if (size == null) {
      return Optional.of(
          String.format("place %d was not defined by a compound value", place.id()));
    }
    if (index < 0 || index >= size) {
      return Optional.of(
          String.format("index %d is out of bounds for compound value at place %d of size %d",
              index, place.id(), size));
    }
    if (!isKnown(itemPlace)) {
      return Optional.of(String.format("item place %d was never defined", itemPlace.id()));
    }
    if (itemPlace.equals(place)) {
      return Optional.of(
          String.format("compound value at place %d cannot contain itself", place.id()));
    }
    return Optional.empty();
  }

  /**
   * Rebind one element of an aggregate.
   *
   * @param place The aggregate's place.
   * @param index The element to rebind.
   * @param itemPlace The place the element now refers to.
   */
  public void recordAssignCompoundItem(Place place, int index, Place itemPlace) {
    values.put(place, withElement(values.get(place), index, new ValueRecord.Cell(itemPlace)));
    bindElement(itemPlace);
  }

  /**
   * Check an {@code AssignCell} mutation.
   *
   * @param place The cell's place.
   * @param newValue The value to store.
   * @return The problem with the mutation, or empty if it is valid.
   */
  public Optional<String> checkAssignCell(Place place, ValueRecord newValue) {
    if (!cellPlaces.contains(place)) {
      return Optional.of(
          String.format("place %d was not defined as a cell or bound as a compound element",
              place.id()));
    }
    return checkCellValue(place, newValue);
  }

  /**
   * Overwrite the value stored in a cell.
   *
   * @param place The cell's place.
   * @param newValue The value now stored there.
   */
  public void recordAssignCell(Place place, ValueRecord newValue) {
    values.put(place, newValue);
  }

  /**
   * Check whether a place has been defined or bound by any structural event.
   *
   * @param place The place to check.
   * @return True if the place is known.
   */
  public boolean isKnown(Place place) {
    return values.containsKey(place) || cellPlaces.contains(place);
  }

  /**
   * Get the value currently stored at a place.
   *
   * @param place The place to look up.
   * @return The stored value, or empty if the place holds none yet.
   */
  public Optional<ValueRecord> valueAt(Place place) {
    return Optional.ofNullable(values.get(place));
  }

  /**
   * Render a value as text, resolving cells through this graph.
   *
   * @param value The value to render.
   * @return A human-readable rendering. Cycles are cut at the first repeated place.
   */
  public String render(ValueRecord value) {
    return value.accept(new Renderer(new HashSet<>()));
  }

  private void bindElement(Place elementPlace) {
    if (!compoundSizes.containsKey(elementPlace)) {
      cellPlaces.add(elementPlace);
    }
  }

  private static Optional<List<ValueRecord>> elementsOf(ValueRecord value) {
    if (value instanceof ValueRecord.Sequence sequence) {
      return Optional.of(sequence.elements());
    } else if (value instanceof ValueRecord.Tuple tuple) {
      return Optional.of(tuple.elements());
    } else if (value instanceof ValueRecord.Struct struct) {
      return Optional.of(struct.fieldValues());
    } // if
    return Optional.empty();
  }

  private static ValueRecord withElement(ValueRecord aggregate, int index, ValueRecord element) {
    List<ValueRecord> elements = new ArrayList<>(elementsOf(aggregate).orElseThrow());
    elements.set(index, element);
    if (aggregate instanceof ValueRecord.Sequence sequence) {
      return new ValueRecord.Sequence(elements, sequence.isSlice(), sequence.typeId());
    } else if (aggregate instanceof ValueRecord.Tuple tuple) {
      return new ValueRecord.Tuple(elements, tuple.typeId());
    } else {
      return new ValueRecord.Struct(elements, ((ValueRecord.Struct) aggregate).typeId());
    } // if
  }

  private static boolean refersTo(ValueRecord value, Place place) {
    if (value instanceof ValueRecord.Cell cell) {
      return cell.place().equals(place);
    } else if (value instanceof ValueRecord.Variant variant) {
      return refersTo(variant.contents(), place);
    } else if (value instanceof ValueRecord.Reference reference) {
      return refersTo(reference.dereferenced(), place);
    } // if
    return elementsOf(value).map(
        elements -> elements.stream().anyMatch(e -> refersTo(e, place))).orElse(false);
  }

  /** Renders values, following cells into the graph. */
  private final class Renderer implements ValueRecord.Visitor<String> {

    private final Set<Place> visiting;

    private Renderer(Set<Place> visiting) {
      this.visiting = visiting;
    }

    private String joined(List<ValueRecord> elements) {
      return elements.stream().map(e -> e.accept(this)).collect(Collectors.joining(", "));
    }

    @Override
    public String visitInt(ValueRecord.Int value) {
      return Long.toString(value.i());
    }

    @Override
    public String visitInt128(ValueRecord.Int128 value) {
      return value.i().toString();
    }

    @Override
    public String visitFloat(ValueRecord.Float value) {
      return Double.toString(value.f());
    }

    @Override
    public String visitBool(ValueRecord.Bool value) {
      return Boolean.toString(value.b());
    }

    @Override
    public String visitString(ValueRecord.String value) {
      return '"' + value.text() + '"';
    }

    @Override
    public String visitSequence(ValueRecord.Sequence value) {
      return (value.isSlice() ? "&[" : "[") + joined(value.elements()) + "]";
    }

    @Override
    public String visitTuple(ValueRecord.Tuple value) {
      return "(" + joined(value.elements()) + ")";
    }

    @Override
    public String visitStruct(ValueRecord.Struct value) {
      return "{" + joined(value.fieldValues()) + "}";
    }

    @Override
    public String visitVariant(ValueRecord.Variant value) {
      return value.discriminator() + value.contents().accept(this);
    }

    @Override
    public String visitReference(ValueRecord.Reference value) {
      return (value.mutable() ? "&mut " : "&") + value.dereferenced().accept(this);
    }

    @Override
    public String visitRaw(ValueRecord.Raw value) {
      return value.r();
    }

    @Override
    public String visitError(ValueRecord.Error value) {
      return "<error: " + value.msg() + ">";
    }

    @Override
    public String visitNone(ValueRecord.None value) {
      return "none";
    }

    @Override
    public String visitCell(ValueRecord.Cell value) {
      Place place = value.place();
      ValueRecord target = values.get(place);
      if (target == null) {
        return "<unset @" + place.id() + ">";
      }
      if (!visiting.add(place)) {
        return "<cycle @" + place.id() + ">";
      }
      String rendered = target.accept(this);
      visiting.remove(place);
      return rendered;
    }

    @Override
    public String visitBigInt(ValueRecord.BigInt value) {
      return value.toBigInteger().toString();
    }
  }
}
