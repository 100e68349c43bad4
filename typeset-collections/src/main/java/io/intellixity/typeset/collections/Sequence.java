package io.intellixity.typeset.collections;

import io.intellixity.typeset.keys.StrictEquality;
import io.intellixity.typeset.types.TypeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Ordered list whose items are checked against an optional {@link TypeSet}.
 *
 * <p>Setting an index past the end fills the gap with {@link TypeSet#defaultValue()}, so a
 * sequence of {@code int} grows with zeros and one of {@code ?int} with nulls. Removing an item
 * closes the gap; it never leaves a default behind.</p>
 */
public final class Sequence<T> implements Iterable<T> {
  private static final Logger log = LoggerFactory.getLogger(Sequence.class);

  private static final int MAX_RANGE_ITEMS = Integer.MAX_VALUE - 8;

  private final CollectionContext ctx;
  private final TypeSet valueTypes;
  private final List<T> items = new ArrayList<>();

  public Sequence() {
    this(CollectionContext.shared());
  }

  public Sequence(CollectionContext ctx) {
    this(ctx, ctx.types());
  }

  /** @param valueTypes allowed item types, e.g. {@code "?int"}; null for any */
  public Sequence(String valueTypes) {
    this(CollectionContext.shared(), CollectionContext.shared().types(valueTypes));
  }

  public Sequence(TypeSet valueTypes) {
    this(CollectionContext.shared(), valueTypes);
  }

  public Sequence(CollectionContext ctx, TypeSet valueTypes) {
    this.ctx = Objects.requireNonNull(ctx, "ctx");
    this.valueTypes = TypeSet.copyOf(Objects.requireNonNull(valueTypes, "valueTypes"));
  }

  /** Copies {@code source}, inferring the item types from it. */
  public static <T> Sequence<T> inferFrom(Iterable<? extends T> source) {
    return inferFrom(CollectionContext.shared(), source);
  }

  public static <T> Sequence<T> inferFrom(CollectionContext ctx, Iterable<? extends T> source) {
    Sequence<T> s = new Sequence<>(ctx);
    for (T item : source) {
      s.valueTypes.infer(item);
      s.append(item);
    }
    return s;
  }

  /**
   * Copies {@code source} under explicit constraints.
   *
   * @throws io.intellixity.typeset.types.TypeMismatchException if an item is disallowed
   */
  public static <T> Sequence<T> of(String valueTypes, Iterable<? extends T> source) {
    Sequence<T> s = new Sequence<>(valueTypes);
    for (T item : source) s.append(item);
    return s;
  }

  // ---- ranges ----

  public static Sequence<Integer> range(int start, int end) {
    return range(start, end, 1);
  }

  /**
   * Integers from {@code start} towards {@code end}, inclusive when {@code end} is reached exactly.
   *
   * @throws IllegalArgumentException if {@code step} is zero or points away from {@code end}
   */
  public static Sequence<Integer> range(int start, int end, int step) {
    checkStep(start, end, step);
    Sequence<Integer> s = new Sequence<>("int");
    for (long v = start; step > 0 ? v <= end : v >= end; v += step) s.append((int) v);
    return s;
  }

  /**
   * Doubles from {@code start} towards {@code end}. A last value that lands past {@code end} by
   * rounding error is clamped to {@code end}.
   *
   * @throws IllegalArgumentException if an argument is NaN or infinite, if {@code step} is zero or
   *     points away from {@code end}, or if the range has more items than a list can hold
   */
  public static Sequence<Double> range(double start, double end, double step) {
    if (!Double.isFinite(start) || !Double.isFinite(end) || !Double.isFinite(step)) {
      throw new IllegalArgumentException("Range bounds and step must be finite numbers.");
    }
    checkStep(start, end, step);
    // multiply rather than accumulate, so the error does not build up over long ranges
    double last = Math.floor((end - start) / step + 1e-9);
    if (last >= MAX_RANGE_ITEMS) {
      throw new IllegalArgumentException("The range is too large: " + last + " steps.");
    }
    Sequence<Double> s = new Sequence<>("float");
    for (long i = 0; i <= (long) last; i++) {
      double v = start + i * step;
      s.append(step > 0 ? Math.min(v, end) : Math.max(v, end));
    }
    return s;
  }

  private static void checkStep(double start, double end, double step) {
    if (step == 0) throw new IllegalArgumentException("The step size cannot be zero.");
    if (start < end && step < 0) {
      throw new IllegalArgumentException("The step size must be positive for an increasing range.");
    }
    if (start > end && step > 0) {
      throw new IllegalArgumentException("The step size must be negative for a decreasing range.");
    }
  }

  // ---- access ----

  public TypeSet valueTypes() {
    return valueTypes;
  }

  /** @throws io.intellixity.typeset.types.TypeMismatchException if the item type is disallowed */
  public Sequence<T> append(T item) {
    valueTypes.check(item, "value");
    items.add(item);
    return this;
  }

  public Sequence<T> appendAll(Iterable<? extends T> source) {
    for (T item : source) append(item);
    return this;
  }

  public T get(int index) {
    Objects.checkIndex(index, items.size());
    return items.get(index);
  }

  /**
   * Replaces the item at {@code index}. An index past the end first fills the gap with defaults.
   *
   * @throws IndexOutOfBoundsException if {@code index} is negative
   * @throws io.intellixity.typeset.types.NoDefaultAvailableException if a gap must be filled but the
   *     constraints have no default
   */
  public Sequence<T> set(int index, T item) {
    if (index < 0) throw new IndexOutOfBoundsException("Index out of range: " + index);
    valueTypes.check(item, "value");
    if (index > items.size() && log.isTraceEnabled()) {
      log.trace("typeset.sequence fill from={} to={} types={}", items.size(), index, valueTypes);
    }
    while (items.size() < index) items.add(defaultItem());
    if (index == items.size()) {
      items.add(item);
    } else {
      items.set(index, item);
    }
    return this;
  }

  /** Removes and returns the item at {@code index}; later items shift left. */
  public T removeAt(int index) {
    Objects.checkIndex(index, items.size());
    return items.remove(index);
  }

  public boolean contains(Object item) {
    return indexOf(item) >= 0;
  }

  /** Position of the first item strictly equal to {@code item}, or -1. */
  public int indexOf(Object item) {
    for (int i = 0; i < items.size(); i++) {
      if (StrictEquality.test(items.get(i), item)) return i;
    }
    return -1;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public List<T> toList() {
    return new ArrayList<>(items);
  }

  /** Dictionary from position to item, with {@code int} keys and this sequence's item constraints. */
  public Dictionary<Integer, T> toDictionary() {
    Dictionary<Integer, T> d = new Dictionary<>(ctx, ctx.types("int"), valueTypes);
    for (int i = 0; i < items.size(); i++) d.put(i, items.get(i));
    return d;
  }

  @Override
  public Iterator<T> iterator() {
    return Collections.unmodifiableList(items).iterator();
  }

  @SuppressWarnings("unchecked")
  private T defaultItem() {
    return (T) valueTypes.defaultValue();
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", "Sequence<" + valueTypes + ">[", "]");
    for (T item : items) sj.add(Dictionary.abbrev(item));
    return sj.toString();
  }
}
