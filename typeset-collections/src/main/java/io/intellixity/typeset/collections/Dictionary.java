package io.intellixity.typeset.collections;

import io.intellixity.typeset.keys.StrictEquality;
import io.intellixity.typeset.types.TypeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Insertion-ordered map whose keys and values may be of any type, including null, lists,
 * maps and arbitrary objects, each checked against an optional {@link TypeSet}.
 *
 * <p>Entries are stored under the canonical index produced by the context's
 * {@link io.intellixity.typeset.keys.KeyCodec}: lists, maps and scalars are keyed by content,
 * any other object by identity. The index never leaves this class; iteration yields
 * {@link Pair}s in insertion order.</p>
 *
 * <pre>
 * var customers = new Dictionary&lt;Integer, Customer&gt;("int", "Customer");
 * var carMake   = new Dictionary&lt;String, String&gt;("string", "?string");
 * </pre>
 *
 * <p>As with {@link java.util.HashMap}, mutating a list or map after using it as a key leaves the
 * entry filed under its old content.</p>
 */
public final class Dictionary<K, V> implements Iterable<Pair<K, V>> {
  private static final Logger log = LoggerFactory.getLogger(Dictionary.class);

  private final CollectionContext ctx;
  private final TypeSet keyTypes;
  private final TypeSet valueTypes;
  private final LinkedHashMap<String, Pair<K, V>> items = new LinkedHashMap<>();

  /** Unconstrained dictionary in the shared context. */
  public Dictionary() {
    this(CollectionContext.shared());
  }

  public Dictionary(CollectionContext ctx) {
    this(ctx, ctx.types(), ctx.types());
  }

  /**
   * @param keyTypes allowed key types, e.g. {@code "int|string"}; null for any
   * @param valueTypes allowed value types; null for any
   * @throws io.intellixity.typeset.types.InvalidTypeNameException if a type name is invalid
   */
  public Dictionary(String keyTypes, String valueTypes) {
    this(CollectionContext.shared(), keyTypes, valueTypes);
  }

  public Dictionary(CollectionContext ctx, String keyTypes, String valueTypes) {
    this(ctx, ctx.types(keyTypes), ctx.types(valueTypes));
  }

  public Dictionary(TypeSet keyTypes, TypeSet valueTypes) {
    this(CollectionContext.shared(), keyTypes, valueTypes);
  }

  /** The given sets are copied; growing them later does not affect this dictionary. */
  public Dictionary(CollectionContext ctx, TypeSet keyTypes, TypeSet valueTypes) {
    this.ctx = Objects.requireNonNull(ctx, "ctx");
    this.keyTypes = TypeSet.copyOf(Objects.requireNonNull(keyTypes, "keyTypes"));
    this.valueTypes = TypeSet.copyOf(Objects.requireNonNull(valueTypes, "valueTypes"));
  }

  // ---- factories ----

  /** Copies {@code source}, inferring key and value types from its entries. */
  public static <K, V> Dictionary<K, V> inferFrom(Map<? extends K, ? extends V> source) {
    return inferFrom(CollectionContext.shared(), source);
  }

  public static <K, V> Dictionary<K, V> inferFrom(CollectionContext ctx, Map<? extends K, ? extends V> source) {
    Dictionary<K, V> d = new Dictionary<>(ctx);
    for (var e : source.entrySet()) d.inferAndPut(e.getKey(), e.getValue());
    return d;
  }

  public static <K, V> Dictionary<K, V> inferFrom(Iterable<Pair<K, V>> source) {
    return inferFrom(CollectionContext.shared(), source);
  }

  public static <K, V> Dictionary<K, V> inferFrom(CollectionContext ctx, Iterable<Pair<K, V>> source) {
    Dictionary<K, V> d = new Dictionary<>(ctx);
    for (Pair<K, V> p : source) d.inferAndPut(p.key(), p.value());
    return d;
  }

  public static <K, V> Dictionary<K, V> combine(Iterable<? extends K> keys, Iterable<? extends V> values) {
    return combine(CollectionContext.shared(), keys, values, true);
  }

  /**
   * Zips separate key and value sequences into a dictionary.
   *
   * @param inferTypes infer constraints from the data; otherwise the result is unconstrained
   * @throws IllegalArgumentException if the counts differ
   * @throws DuplicateKeyException if a key repeats
   */
  public static <K, V> Dictionary<K, V> combine(
      CollectionContext ctx, Iterable<? extends K> keys, Iterable<? extends V> values, boolean inferTypes) {
    List<K> ks = new ArrayList<>();
    keys.forEach(ks::add);
    List<V> vs = new ArrayList<>();
    values.forEach(vs::add);
    if (ks.size() != vs.size()) {
      throw new IllegalArgumentException("Cannot combine: keys count (" + ks.size()
          + ") does not match values count (" + vs.size() + ").");
    }

    Dictionary<K, V> d = new Dictionary<>(ctx);
    for (int i = 0; i < ks.size(); i++) {
      K key = ks.get(i);
      if (d.containsKey(key)) throw new DuplicateKeyException("Cannot combine: keys are not unique.");
      V value = vs.get(i);
      if (inferTypes) {
        d.inferAndPut(key, value);
      } else {
        d.put(key, value);
      }
    }
    return d;
  }

  // ---- constraints ----

  public TypeSet keyTypes() { return keyTypes; }
  public TypeSet valueTypes() { return valueTypes; }
  public CollectionContext context() { return ctx; }

  // ---- adding and removing ----

  /**
   * Sets the value for {@code key}. An existing key keeps its position; a new key is appended.
   *
   * @return the previous value, or null if the key was absent
   * @throws io.intellixity.typeset.types.TypeMismatchException if the key or value type is disallowed
   */
  public V put(K key, V value) {
    keyTypes.check(key, "key");
    valueTypes.check(value, "value");
    Pair<K, V> prev = items.put(ctx.codec().encode(key), new Pair<>(key, value));
    return prev == null ? null : prev.value();
  }

  public Dictionary<K, V> add(K key, V value) {
    put(key, value);
    return this;
  }

  public Dictionary<K, V> add(Pair<? extends K, ? extends V> pair) {
    Objects.requireNonNull(pair, "pair");
    put(pair.key(), pair.value());
    return this;
  }

  public Dictionary<K, V> putAll(Map<? extends K, ? extends V> source) {
    for (var e : source.entrySet()) put(e.getKey(), e.getValue());
    return this;
  }

  public Dictionary<K, V> importPairs(Iterable<? extends Pair<? extends K, ? extends V>> source) {
    for (Pair<? extends K, ? extends V> p : source) add(p);
    return this;
  }

  /**
   * @throws io.intellixity.typeset.types.TypeMismatchException if the key type is disallowed
   * @throws UnknownKeyException if the key is absent
   */
  public V get(Object key) {
    return items.get(indexOf(key)).value();
  }

  /**
   * Removes {@code key} and returns its value.
   *
   * @throws io.intellixity.typeset.types.TypeMismatchException if the key type is disallowed
   * @throws UnknownKeyException if the key is absent
   */
  public V remove(Object key) {
    return items.remove(indexOf(key)).value();
  }

  /**
   * Removes every entry whose value is strictly equal to {@code value}.
   *
   * @return number of entries removed
   */
  public int removeByValue(Object value) {
    valueTypes.check(value, "value");
    int removed = 0;
    Iterator<Pair<K, V>> it = items.values().iterator();
    while (it.hasNext()) {
      if (StrictEquality.test(it.next().value(), value)) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  public void clear() {
    items.clear();
  }

  // ---- inspection ----

  /** Never throws: a key of a disallowed type is simply not present. */
  public boolean containsKey(Object key) {
    if (!keyTypes.match(key)) return false;
    String index;
    try {
      index = ctx.codec().encode(key);
    } catch (IllegalArgumentException e) {
      // NaN and self-containing composites can never have been stored
      return false;
    }
    return items.containsKey(index);
  }

  /** Linear scan using strict equality. */
  public boolean containsValue(Object value) {
    for (Pair<K, V> p : items.values()) {
      if (StrictEquality.test(p.value(), value)) return true;
    }
    return false;
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public List<K> keys() {
    List<K> out = new ArrayList<>(items.size());
    for (Pair<K, V> p : items.values()) out.add(p.key());
    return out;
  }

  public List<V> values() {
    List<V> out = new ArrayList<>(items.size());
    for (Pair<K, V> p : items.values()) out.add(p.value());
    return out;
  }

  public List<Pair<K, V>> pairs() {
    return new ArrayList<>(items.values());
  }

  /**
   * Same number of entries, strictly equal keys and values, same order. Type constraints are
   * not compared.
   */
  public boolean contentEquals(Dictionary<?, ?> other) {
    if (other == null || other.size() != size()) return false;
    Iterator<Pair<?, ?>> theirs = new ArrayList<Pair<?, ?>>(other.items.values()).iterator();
    for (Pair<K, V> mine : items.values()) {
      Pair<?, ?> p = theirs.next();
      if (!StrictEquality.test(mine.key(), p.key()) || !StrictEquality.test(mine.value(), p.value())) return false;
    }
    return true;
  }

  @Override
  public Iterator<Pair<K, V>> iterator() {
    return Collections.unmodifiableCollection(items.values()).iterator();
  }

  public void forEach(BiConsumer<? super K, ? super V> action) {
    for (Pair<K, V> p : items.values()) action.accept(p.key(), p.value());
  }

  // ---- sorting ----

  public Dictionary<K, V> sort(Comparator<? super Pair<K, V>> order) {
    List<Map.Entry<String, Pair<K, V>>> entries = new ArrayList<>(items.entrySet());
    entries.sort((a, b) -> order.compare(a.getValue(), b.getValue()));
    items.clear();
    for (var e : entries) items.put(e.getKey(), e.getValue());
    return this;
  }

  /**
   * Sorts by natural key order; nulls first.
   *
   * @throws ClassCastException if the keys are not mutually comparable
   */
  public Dictionary<K, V> sortByKey() {
    Comparator<Object> natural = naturalOrder();
    return sort((a, b) -> natural.compare(a.key(), b.key()));
  }

  public Dictionary<K, V> sortByValue() {
    Comparator<Object> natural = naturalOrder();
    return sort((a, b) -> natural.compare(a.value(), b.value()));
  }

  @SuppressWarnings("unchecked")
  private static Comparator<Object> naturalOrder() {
    return Comparator.nullsFirst((a, b) -> ((Comparable<Object>) a).compareTo(b));
  }

  // ---- transformations ----

  /** New dictionary with the same constraints and the entries {@code keep} accepts. */
  public Dictionary<K, V> filter(BiPredicate<? super K, ? super V> keep) {
    Dictionary<K, V> out = new Dictionary<>(ctx, keyTypes, valueTypes);
    for (Pair<K, V> p : items.values()) {
      if (keep.test(p.key(), p.value())) out.items.put(ctx.codec().encode(p.key()), new Pair<>(p.key(), p.value()));
    }
    return out;
  }

  /**
   * Swaps keys and values, and the key and value constraints.
   *
   * @throws DuplicateKeyException if two entries share a value
   */
  public Dictionary<V, K> flip() {
    Dictionary<V, K> out = new Dictionary<>(ctx, valueTypes, keyTypes);
    for (Pair<K, V> p : items.values()) {
      if (out.containsKey(p.value())) throw new DuplicateKeyException("Cannot flip Dictionary: values are not unique.");
      out.put(p.value(), p.key());
    }
    return out;
  }

  /**
   * Transforms every pair. Keys and values may change type; the result's constraints are
   * inferred from what {@code fn} returns.
   *
   * @throws IllegalArgumentException if {@code fn} returns null
   * @throws DuplicateKeyException if {@code fn} produces the same key twice
   */
  public <K2, V2> Dictionary<K2, V2> map(Function<? super Pair<K, V>, ? extends Pair<K2, V2>> fn) {
    Dictionary<K2, V2> out = new Dictionary<>(ctx);
    for (Pair<K, V> p : items.values()) {
      Pair<K2, V2> mapped = fn.apply(p);
      if (mapped == null) throw new IllegalArgumentException("Map callback must return a Pair, got null.");
      if (out.containsKey(mapped.key())) {
        throw new DuplicateKeyException("Map callback produced a duplicate key: " + abbrev(mapped.key()) + ".");
      }
      out.inferAndPut(mapped.key(), mapped.value());
    }
    if (log.isDebugEnabled()) {
      log.debug("typeset.dictionary map size={} keyTypes={} valueTypes={}", out.size(), out.keyTypes, out.valueTypes);
    }
    return out;
  }

  /**
   * Entries of this dictionary followed by those of {@code other}, under the union of both
   * constraint sets. A key present in both takes {@code other}'s value and keeps its first position.
   */
  public Dictionary<K, V> merge(Dictionary<? extends K, ? extends V> other) {
    TypeSet kt = TypeSet.copyOf(keyTypes).add(other.keyTypes);
    TypeSet vt = TypeSet.copyOf(valueTypes).add(other.valueTypes);
    Dictionary<K, V> out = new Dictionary<>(ctx, kt, vt);
    out.importPairs(items.values());
    out.importPairs(other.items.values());
    if (log.isDebugEnabled()) {
      log.debug("typeset.dictionary merge left={} right={} result={}", size(), other.size(), out.size());
    }
    return out;
  }

  /** The pairs, in order, as a sequence whose element type is inferred. */
  public Sequence<Pair<K, V>> toSequence() {
    return Sequence.inferFrom(ctx, items.values());
  }

  // ---- internals ----

  private void inferAndPut(K key, V value) {
    keyTypes.infer(key);
    valueTypes.infer(value);
    put(key, value);
  }

  private String indexOf(Object key) {
    keyTypes.check(key, "key");
    String index = ctx.codec().encode(key);
    if (!items.containsKey(index)) throw new UnknownKeyException(key, "Unknown key: " + abbrev(key) + ".");
    return index;
  }

  static String abbrev(Object v) {
    String s = v instanceof String str ? '"' + str + '"' : String.valueOf(v);
    return s.length() <= 40 ? s : s.substring(0, 37) + "...";
  }

  @Override
  public String toString() {
    StringJoiner sj = new StringJoiner(", ", "Dictionary<" + keyTypes + ", " + valueTypes + ">[", "]");
    for (Pair<K, V> p : items.values()) sj.add(abbrev(p.key()) + " => " + abbrev(p.value()));
    return sj.toString();
  }
}
